/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.discovery;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import reactor.util.annotation.Nullable;

/**
 * Reads the {@code resource_metadata} parameter of a {@code WWW-Authenticate} challenge
 * (RFC 9728 section 5.1), e.g.
 * {@code Bearer resource_metadata="https://api.example.com/.well-known/oauth-protected-resource"}.
 */
public final class ResourceMetadataHeader {

	private static final Pattern RESOURCE_METADATA = Pattern.compile("resource_metadata=(\"([^\"]+)\"|([^,\\s]+))",
			Pattern.CASE_INSENSITIVE);

	private ResourceMetadataHeader() {
	}

	/**
	 * Extract the resource metadata URL.
	 * @param headerValue the {@code WWW-Authenticate} header value, may be null
	 * @return the URL, empty when the header is absent or has no such parameter
	 */
	public static Optional<String> extract(@Nullable String headerValue) {
		if (headerValue == null || headerValue.isBlank()) {
			return Optional.empty();
		}
		Matcher matcher = RESOURCE_METADATA.matcher(headerValue);
		if (!matcher.find()) {
			return Optional.empty();
		}
		String url = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
		url = url.strip();
		return url.isEmpty() ? Optional.empty() : Optional.of(url);
	}

}
