/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.discovery;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mybooks.oauth.util.Utils;

/**
 * Builds the candidate well-known metadata URLs, in the order they are tried.
 */
public final class WellKnownUrls {

	private static final Logger logger = LoggerFactory.getLogger(WellKnownUrls.class);

	public static final String OAUTH_AUTHORIZATION_SERVER = "oauth-authorization-server";

	public static final String OPENID_CONFIGURATION = "openid-configuration";

	public static final String OAUTH_PROTECTED_RESOURCE = "oauth-protected-resource";

	private static final String WELL_KNOWN = "/.well-known/";

	private WellKnownUrls() {
	}

	/**
	 * Authorization server metadata candidates for a server URL with optional path
	 * {@code p}: path-inserted RFC 8414 and OpenID URLs, the path-appended OpenID URL,
	 * then the root URLs.
	 * @param serverUrl the authorization server URL
	 * @return candidate URLs in priority order
	 */
	public static List<String> authorizationServer(String serverUrl) {
		ParsedUrl parsed = parse(serverUrl);
		Set<String> urls = new LinkedHashSet<>();
		if (!parsed.path().isEmpty()) {
			urls.add(parsed.origin() + WELL_KNOWN + OAUTH_AUTHORIZATION_SERVER + "/" + parsed.path());
			urls.add(parsed.origin() + WELL_KNOWN + OPENID_CONFIGURATION + "/" + parsed.path());
			urls.add(parsed.origin() + "/" + parsed.path() + WELL_KNOWN + OPENID_CONFIGURATION);
		}
		urls.add(parsed.origin() + WELL_KNOWN + OAUTH_AUTHORIZATION_SERVER);
		urls.add(parsed.origin() + WELL_KNOWN + OPENID_CONFIGURATION);
		return new ArrayList<>(urls);
	}

	/**
	 * Protected resource metadata candidates for a resource URL: the path-inserted URL
	 * when the resource has a path, then the root URL.
	 * @param resourceUrl the protected resource URL
	 * @return candidate URLs in priority order
	 */
	public static List<String> protectedResource(String resourceUrl) {
		ParsedUrl parsed = parse(resourceUrl);
		Set<String> urls = new LinkedHashSet<>();
		if (!parsed.path().isEmpty()) {
			urls.add(parsed.origin() + WELL_KNOWN + OAUTH_PROTECTED_RESOURCE + "/" + parsed.path());
		}
		urls.add(parsed.origin() + WELL_KNOWN + OAUTH_PROTECTED_RESOURCE);
		return new ArrayList<>(urls);
	}

	/**
	 * Candidates for the authorization servers listed by a protected resource. A listed
	 * server that is already a well-known URL is tried as is. Any other is tried with the
	 * well-known documents appended to its URL, for servers mounted under a path, then
	 * expanded with {@link #authorizationServer(String)}.
	 * @param authorizationServers servers listed in the protected resource metadata
	 * @return de-duplicated candidate URLs in priority order
	 */
	public static List<String> authorizationServerHints(List<String> authorizationServers) {
		Set<String> urls = new LinkedHashSet<>();
		for (String server : authorizationServers) {
			if (!Utils.hasText(server)) {
				continue;
			}
			String candidate = server.strip();
			if (candidate.contains(WELL_KNOWN)) {
				urls.add(candidate);
				continue;
			}
			try {
				List<String> expanded = authorizationServer(candidate);
				String base = stripTrailingSlashes(candidate);
				urls.add(base + WELL_KNOWN + OAUTH_AUTHORIZATION_SERVER);
				urls.add(base + WELL_KNOWN + OPENID_CONFIGURATION);
				urls.addAll(expanded);
			}
			catch (DiscoveryException e) {
				logger.debug("Ignoring authorization server hint '{}': {}", candidate, e.getMessage());
			}
		}
		return new ArrayList<>(urls);
	}

	/**
	 * The {@link #authorizationServerHints(List) hint candidates} followed by the
	 * host-guessed candidates of the resource itself.
	 * @param authorizationServers servers listed in the protected resource metadata
	 * @param resourceUrl the protected resource URL
	 * @return de-duplicated candidate URLs in priority order
	 */
	public static List<String> authorizationServer(List<String> authorizationServers, String resourceUrl) {
		Set<String> urls = new LinkedHashSet<>(authorizationServerHints(authorizationServers));
		urls.addAll(authorizationServer(resourceUrl));
		return new ArrayList<>(urls);
	}

	static ParsedUrl parse(String url) {
		URI uri;
		try {
			uri = new URI(url.strip());
		}
		catch (URISyntaxException e) {
			throw new DiscoveryException(DiscoveryException.Reason.INVALID_URL, url, "Invalid server URL: " + url, e);
		}
		if (uri.getScheme() == null || uri.getRawAuthority() == null) {
			throw new DiscoveryException(DiscoveryException.Reason.INVALID_URL, url,
					"Server URL must be absolute: " + url);
		}
		String path = uri.getRawPath() == null ? "" : uri.getRawPath();
		path = stripSlashes(path);
		return new ParsedUrl(uri.getScheme() + "://" + uri.getRawAuthority(), path);
	}

	private static String stripSlashes(String path) {
		int start = 0;
		int end = path.length();
		while (start < end && path.charAt(start) == '/') {
			start++;
		}
		while (end > start && path.charAt(end - 1) == '/') {
			end--;
		}
		return path.substring(start, end);
	}

	private static String stripTrailingSlashes(String url) {
		int end = url.length();
		while (end > 0 && url.charAt(end - 1) == '/') {
			end--;
		}
		return url.substring(0, end);
	}

	record ParsedUrl(String origin, String path) {
	}

}
