/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.client;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import io.mybooks.oauth.http.HttpExchanges;
import io.mybooks.oauth.metadata.OAuthMetadata;
import io.mybooks.oauth.util.Assert;
import io.mybooks.oauth.util.Utils;
import reactor.core.publisher.Mono;

/**
 * Authenticates requests to the protected resource with the access token of the
 * session's registered client.
 */
public class BearerTokenAuthenticator {

	private final OAuthClientSession session;

	public BearerTokenAuthenticator(OAuthClientSession session) {
		Assert.notNull(session, "session must not be null");
		this.session = session;
	}

	/**
	 * Add an {@code Authorization: Bearer} header when the client is authorized.
	 * @param requestBuilder the request builder
	 * @return the same builder
	 */
	public HttpRequest.Builder authenticate(HttpRequest.Builder requestBuilder) {
		String accessToken = session.credentials().oauthAccessToken();
		if (Utils.hasText(accessToken)) {
			requestBuilder.header(HttpExchanges.AUTHORIZATION, "Bearer " + accessToken);
		}
		return requestBuilder;
	}

	/**
	 * Handle a response of the protected resource. A 401 means the metadata or the
	 * client registration may be stale, so the metadata is discovered again using the
	 * {@code WWW-Authenticate} challenge.
	 * @param response the response
	 * @return the fresh metadata after a 401, empty otherwise
	 */
	public Mono<OAuthMetadata> handleResponse(HttpResponse<?> response) {
		if (response.statusCode() != 401) {
			return Mono.empty();
		}
		String challenge = response.headers().firstValue(HttpExchanges.WWW_AUTHENTICATE).orElse("");
		return session.metadata(challenge, true);
	}

}
