/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.discovery;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mybooks.oauth.OAuthClientSettings;
import io.mybooks.oauth.http.HttpExchanges;
import io.mybooks.oauth.http.OAuthHttpClients;
import io.mybooks.oauth.metadata.OAuthMetadata;
import io.mybooks.oauth.metadata.OAuthProtectedResourceMetadata;
import io.mybooks.oauth.metadata.OAuthServerMetadata;
import io.mybooks.oauth.util.Assert;
import io.mybooks.oauth.util.Utils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Resolves OAuth Authorization Server Metadata (RFC 8414) and Protected Resource
 * Metadata (RFC 9728) through the well-known URL conventions.
 *
 * <p>
 * Candidate URLs are tried in order. A candidate answering with a status other than 200
 * is skipped, and when every candidate is skipped discovery fails with
 * {@link DiscoveryException.Reason#NOT_FOUND} (all answered 404) or
 * {@link DiscoveryException.Reason#HTTP_STATUS}; the first one answering 200 decides the outcome, so a document that is not
 * JSON or lacks a required member fails discovery instead of falling through to the next
 * candidate.
 *
 * <p>
 * Results of {@link #discover(String)} are cached per resource URL. The cache is safe
 * for concurrent use; two simultaneous discoveries of the same URL may both hit the
 * network, the last one to finish wins.
 *
 * @see WellKnownUrls
 */
public class MetadataDiscoverer {

	private static final Logger logger = LoggerFactory.getLogger(MetadataDiscoverer.class);

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final Duration timeout;

	private final ConcurrentMap<String, OAuthMetadata> cache = new ConcurrentHashMap<>();

	public MetadataDiscoverer(HttpClient httpClient, ObjectMapper objectMapper, Duration timeout) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(timeout, "timeout must not be null");
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.timeout = timeout;
	}

	public static MetadataDiscoverer create(OAuthClientSettings settings) {
		return new MetadataDiscoverer(OAuthHttpClients.create(settings), new ObjectMapper(),
				settings.getRequestTimeout());
	}

	/**
	 * Discover authorization server metadata from the server URL alone.
	 * @param serverUrl the authorization server URL, optionally with a path
	 * @return the first qualifying document
	 */
	public Mono<DiscoveredDocument<OAuthServerMetadata>> discoverAuthorizationServer(String serverUrl) {
		return Mono.defer(() -> firstDocument(WellKnownUrls.authorizationServer(serverUrl),
				MetadataParser::parseServerMetadata, "Unable to discover OAuth metadata for " + serverUrl));
	}

	/**
	 * Discover protected resource metadata from the resource URL.
	 * @param resourceUrl the protected resource URL
	 * @return the first qualifying document
	 */
	public Mono<DiscoveredDocument<OAuthProtectedResourceMetadata>> discoverProtectedResource(String resourceUrl) {
		return Mono.defer(() -> firstDocument(WellKnownUrls.protectedResource(resourceUrl),
				MetadataParser::parseProtectedResourceMetadata,
				"Unable to discover OAuth protected resource metadata for " + resourceUrl));
	}

	/**
	 * Full discovery with the cached result when there is one.
	 * @param resourceUrl the protected resource (or authorization server) URL
	 * @return the metadata
	 * @see #discover(String, boolean)
	 */
	public Mono<OAuthMetadata> discover(String resourceUrl) {
		return discover(resourceUrl, false);
	}

	/**
	 * Full discovery: protected resource metadata first, then the authorization servers
	 * it lists, then the host-guessed authorization server URLs of the resource itself.
	 * @param resourceUrl the protected resource (or authorization server) URL
	 * @param forceRefresh bypass and replace the cached result
	 * @return the metadata
	 */
	public Mono<OAuthMetadata> discover(String resourceUrl, boolean forceRefresh) {
		return Mono.defer(() -> {
			String key = Utils.normalizeUrl(resourceUrl);
			if (!forceRefresh) {
				OAuthMetadata cached = cache.get(key);
				if (cached != null) {
					return Mono.just(cached);
				}
			}
			return resolve(resourceUrl).doOnNext(metadata -> cache.put(key, metadata));
		});
	}

	/**
	 * Discovery after a request to the resource was rejected with 401. When the
	 * {@code WWW-Authenticate} header names a {@code resource_metadata} URL that URL is
	 * used first, without guessing; otherwise, or when it yields nothing usable, the
	 * resource URL is rediscovered. The cached entry is always replaced.
	 * @param resourceUrl the protected resource URL
	 * @param wwwAuthenticate the {@code WWW-Authenticate} header of the 401 response
	 * @return the metadata
	 */
	public Mono<OAuthMetadata> discover(String resourceUrl, @Nullable String wwwAuthenticate) {
		Optional<String> headerUrl = ResourceMetadataHeader.extract(wwwAuthenticate);
		if (headerUrl.isEmpty()) {
			return discover(resourceUrl, true);
		}
		String resourceMetadataUrl = headerUrl.get();
		return Mono.defer(() -> {
			String key = Utils.normalizeUrl(resourceUrl);
			return discoverFromResourceMetadataUrl(resourceMetadataUrl)
				.onErrorResume(DiscoveryException.class, e -> {
					logger.warn("Discovery from resource metadata {} failed, falling back to {}: {}",
							resourceMetadataUrl, resourceUrl, e.getMessage());
					return Mono.empty();
				})
				.switchIfEmpty(Mono.defer(() -> resolve(resourceUrl)))
				.onErrorMap(DiscoveryException.class,
						e -> new DiscoveryException(e.getReason(), e.getUrl(),
								e.getMessage() + " (tried resource metadata: " + resourceMetadataUrl + ")", e))
				.doOnNext(metadata -> cache.put(key, metadata));
		});
	}

	/**
	 * Discovery from an explicit protected resource metadata URL, as advertised by a
	 * {@code WWW-Authenticate} challenge. The document is read from exactly that URL;
	 * the authorization server is then located from its {@code authorization_servers}.
	 * @param resourceMetadataUrl the protected resource metadata URL
	 * @return the metadata
	 */
	public Mono<OAuthMetadata> discoverFromResourceMetadataUrl(String resourceMetadataUrl) {
		return Mono.defer(() -> firstDocument(List.of(resourceMetadataUrl),
				MetadataParser::parseProtectedResourceMetadata,
				"Unable to read OAuth protected resource metadata from " + resourceMetadataUrl))
			.flatMap(protectedDocument -> firstDocument(
					WellKnownUrls.authorizationServerHints(protectedDocument.metadata().authorizationServers()),
					MetadataParser::parseServerMetadata,
					"Unable to discover OAuth metadata for the authorization servers of " + resourceMetadataUrl)
				.map(serverDocument -> new OAuthMetadata(serverDocument.metadata(), serverDocument.url(),
						protectedDocument.metadata(), protectedDocument.url())));
	}

	/**
	 * The cached discovery result for a resource URL.
	 * @param resourceUrl the resource URL
	 * @return the cached metadata, if any
	 */
	public Optional<OAuthMetadata> cached(String resourceUrl) {
		return Optional.ofNullable(cache.get(Utils.normalizeUrl(resourceUrl)));
	}

	public void evict(String resourceUrl) {
		cache.remove(Utils.normalizeUrl(resourceUrl));
	}

	public void clearCache() {
		cache.clear();
	}

	private Mono<OAuthMetadata> resolve(String resourceUrl) {
		return discoverProtectedResource(resourceUrl).map(Optional::of)
			.onErrorResume(MetadataDiscoverer::isMissingDocument, e -> {
						logger.debug("No protected resource metadata for {}", resourceUrl);
						return Mono.just(Optional.empty());
					})
			.flatMap(protectedDocument -> {
				List<String> hints = protectedDocument.map(document -> document.metadata().authorizationServers())
					.orElse(List.of());
				return firstDocument(WellKnownUrls.authorizationServer(hints, resourceUrl),
						MetadataParser::parseServerMetadata, "Unable to discover OAuth metadata for " + resourceUrl)
					.map(serverDocument -> new OAuthMetadata(serverDocument.metadata(), serverDocument.url(),
							protectedDocument.map(DiscoveredDocument::metadata).orElse(null),
							protectedDocument.map(DiscoveredDocument::url).orElse(null)));
			})
			.doOnNext(metadata -> logger.debug("Discovered OAuth metadata for {} at {}", resourceUrl,
					metadata.authorizationServerMetadataUrl()));
	}

	private static boolean isMissingDocument(Throwable error) {
		if (!(error instanceof DiscoveryException)) {
			return false;
		}
		DiscoveryException.Reason reason = ((DiscoveryException) error).getReason();
		return reason == DiscoveryException.Reason.NOT_FOUND || reason == DiscoveryException.Reason.HTTP_STATUS;
	}

	private <T> Mono<DiscoveredDocument<T>> firstDocument(List<String> candidates,
			BiFunction<JsonNode, String, T> parser, String notFoundMessage) {
		return Mono.defer(() -> {
			List<String> attempts = new ArrayList<>();
			return Flux.fromIterable(candidates)
				.concatMap(url -> fetchDocument(url, attempts)
					.map(document -> new DiscoveredDocument<>(url, parser.apply(document, url))))
				.next()
				.switchIfEmpty(Mono.error(() -> noDocument(attempts, notFoundMessage)));
		});
	}

	private DiscoveryException noDocument(List<String> attempts, String message) {
		boolean allNotFound = attempts.stream().allMatch(attempt -> attempt.endsWith(" -> 404"));
		DiscoveryException.Reason reason = allNotFound ? DiscoveryException.Reason.NOT_FOUND
				: DiscoveryException.Reason.HTTP_STATUS;
		return new DiscoveryException(reason, null, message + " (tried: " + String.join(", ", attempts) + ")");
	}

	private Mono<JsonNode> fetchDocument(String url, List<String> attempts) {
		return Mono.defer(() -> {
			HttpRequest request;
			try {
				request = HttpRequest.newBuilder(URI.create(url))
					.header(HttpExchanges.ACCEPT, HttpExchanges.APPLICATION_JSON)
					.timeout(timeout)
					.GET()
					.build();
			}
			catch (IllegalArgumentException e) {
				return Mono.error(new DiscoveryException(DiscoveryException.Reason.INVALID_URL, url,
						"Invalid OAuth metadata URL: " + url, e));
			}

			logger.debug("Fetching OAuth metadata from {}", url);
			return HttpExchanges.send(httpClient, request, timeout)
				.onErrorMap(e -> !(e instanceof DiscoveryException),
						e -> new DiscoveryException(DiscoveryException.Reason.NETWORK, url,
								"OAuth discovery request failed for " + url + ": " + describe(e), e))
				.flatMap(response -> {
					if (response.statusCode() != 200) {
						logger.debug("OAuth metadata candidate {} answered {}", url, response.statusCode());
						attempts.add(url + " -> " + response.statusCode());
						return Mono.empty();
					}
					return Mono.fromCallable(() -> readObject(response.body(), url));
				});
		});
	}

	private JsonNode readObject(String body, String url) {
		JsonNode document;
		try {
			document = objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new DiscoveryException(DiscoveryException.Reason.INVALID_JSON, url,
					"OAuth discovery document at " + url + " is not valid JSON: " + e.getOriginalMessage(), e);
		}
		if (document == null || !document.isObject()) {
			throw new DiscoveryException(DiscoveryException.Reason.NOT_AN_OBJECT, url,
					"OAuth discovery document at " + url + " is not a JSON object.");
		}
		return document;
	}

	private String describe(Throwable error) {
		if (error instanceof TimeoutException || error instanceof HttpTimeoutException) {
			return "timed out after " + timeout.toMillis() + " ms";
		}
		return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
	}

}
