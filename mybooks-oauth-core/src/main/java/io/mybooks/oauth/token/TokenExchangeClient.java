/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.token;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mybooks.oauth.OAuthClientSettings;
import io.mybooks.oauth.http.HttpExchanges;
import io.mybooks.oauth.http.OAuthHttpClients;
import io.mybooks.oauth.util.Assert;
import io.mybooks.oauth.util.Utils;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Client for the OAuth token endpoint: authorization code exchange with PKCE and the
 * refresh token grant.
 *
 * <p>
 * Requests are form encoded and sent with {@code Cache-Control: no-cache}. Nothing is
 * retried.
 */
public class TokenExchangeClient {

	private static final Logger logger = LoggerFactory.getLogger(TokenExchangeClient.class);

	private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
	};

	static final int BODY_LIMIT = 500;

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final Duration timeout;

	private final boolean forwardState;

	/**
	 * Create a client.
	 * @param httpClient the HTTP client
	 * @param objectMapper decodes token responses
	 * @param timeout per request timeout
	 * @param forwardState whether {@code state} is sent with the code exchange
	 */
	public TokenExchangeClient(HttpClient httpClient, ObjectMapper objectMapper, Duration timeout,
			boolean forwardState) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(timeout, "timeout must not be null");
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.timeout = timeout;
		this.forwardState = forwardState;
	}

	public static TokenExchangeClient create(OAuthClientSettings settings) {
		return new TokenExchangeClient(OAuthHttpClients.create(settings), new ObjectMapper(),
				settings.getRequestTimeout(), settings.isForwardStateToTokenEndpoint());
	}

	/**
	 * Exchange an authorization code for tokens.
	 * @param tokenEndpoint the token endpoint
	 * @param code the authorization code from the callback
	 * @param redirectUri the redirect URI used when the flow started
	 * @param clientId the client id
	 * @param codeVerifier the PKCE verifier of the flow
	 * @param state the callback state, sent only when forwarding is enabled
	 * @return the token
	 */
	public Mono<OAuthToken> exchangeAuthorizationCode(String tokenEndpoint, String code, String redirectUri,
			String clientId, String codeVerifier, @Nullable String state) {
		Assert.hasText(code, "code must not be empty");
		Assert.hasText(redirectUri, "redirectUri must not be empty");
		Assert.hasText(clientId, "clientId must not be empty");
		Assert.hasText(codeVerifier, "codeVerifier must not be empty");

		Map<String, String> form = new LinkedHashMap<>();
		form.put("grant_type", "authorization_code");
		form.put("code", code);
		form.put("redirect_uri", redirectUri);
		form.put("client_id", clientId);
		form.put("code_verifier", codeVerifier);
		if (forwardState && Utils.hasText(state)) {
			form.put("state", state);
		}
		return post(tokenEndpoint, form, "authorization_code");
	}

	/**
	 * Obtain a new access token with a refresh token.
	 * @param tokenEndpoint the token endpoint
	 * @param refreshToken the refresh token
	 * @param clientId the client id
	 * @param scope the scope to request, omitted when {@code null}
	 * @return the token
	 */
	public Mono<OAuthToken> refresh(String tokenEndpoint, String refreshToken, String clientId,
			@Nullable String scope) {
		Assert.hasText(refreshToken, "refreshToken must not be empty");
		Assert.hasText(clientId, "clientId must not be empty");

		Map<String, String> form = new LinkedHashMap<>();
		form.put("grant_type", "refresh_token");
		form.put("refresh_token", refreshToken);
		form.put("client_id", clientId);
		if (Utils.hasText(scope)) {
			form.put("scope", scope);
		}
		return post(tokenEndpoint, form, "refresh_token");
	}

	private Mono<OAuthToken> post(String tokenEndpoint, Map<String, String> form, String grantType) {
		Assert.hasText(tokenEndpoint, "tokenEndpoint must not be empty");
		return Mono.defer(() -> {
			HttpRequest request;
			try {
				request = HttpRequest.newBuilder(URI.create(tokenEndpoint))
					.header(HttpExchanges.CONTENT_TYPE, HttpExchanges.APPLICATION_FORM_URLENCODED)
					.header(HttpExchanges.CACHE_CONTROL, "no-cache")
					.header(HttpExchanges.ACCEPT, HttpExchanges.APPLICATION_JSON)
					.timeout(timeout)
					.POST(HttpRequest.BodyPublishers.ofString(Utils.formEncode(form)))
					.build();
			}
			catch (IllegalArgumentException e) {
				return Mono.error(new TokenExchangeException("Invalid token endpoint: " + tokenEndpoint, e));
			}

			logger.debug("Requesting {} grant at {}", grantType, tokenEndpoint);
			return HttpExchanges.send(httpClient, request, timeout)
				.onErrorMap(e -> !(e instanceof TokenExchangeException),
						e -> new TokenExchangeException("Token request to " + tokenEndpoint + " failed: " + describe(e),
								e))
				.map(this::toToken)
				.doOnNext(token -> logger.debug("Token endpoint {} issued a {} token", tokenEndpoint,
						token.tokenType()));
		});
	}

	private OAuthToken toToken(HttpResponse<String> response) {
		int status = response.statusCode();
		String reasonPhrase = HttpExchanges.reasonPhrase(status);
		String body = response.body() == null ? "" : response.body();
		JsonNode document = readTree(body);

		if (!HttpExchanges.isSuccess(status)) {
			String error = member(document, "error");
			String errorDescription = member(document, "error_description");
			StringBuilder message = new StringBuilder("Token request failed: ").append(status);
			if (!reasonPhrase.isEmpty()) {
				message.append(' ').append(reasonPhrase);
			}
			if (error != null) {
				message.append(" (").append(error);
				if (errorDescription != null) {
					message.append(": ").append(errorDescription);
				}
				message.append(')');
			}
			String truncated = Utils.snippet(body, BODY_LIMIT);
			if (!truncated.isEmpty()) {
				message.append(": ").append(truncated);
			}
			throw new TokenExchangeException(message.toString(), status, reasonPhrase, truncated, error,
					errorDescription);
		}

		if (document == null || !document.isObject()) {
			throw new TokenExchangeException("Token endpoint returned a response that is not a JSON object.", status,
					reasonPhrase, Utils.snippet(body, BODY_LIMIT), null, null);
		}
		return OAuthToken.fromPayload(objectMapper.convertValue(document, PAYLOAD_TYPE));
	}

	@Nullable
	private JsonNode readTree(String body) {
		if (body.isBlank()) {
			return null;
		}
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			logger.debug("Token endpoint body is not JSON: {}", e.getOriginalMessage());
			return null;
		}
	}

	@Nullable
	private static String member(@Nullable JsonNode document, String name) {
		if (document == null || !document.isObject()) {
			return null;
		}
		JsonNode value = document.get(name);
		return value != null && value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
	}

	private String describe(Throwable error) {
		if (error instanceof TimeoutException || error instanceof HttpTimeoutException) {
			return "timed out after " + timeout.toMillis() + " ms";
		}
		return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
	}

}
