/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import reactor.util.annotation.Nullable;

/**
 * Decoded token endpoint response. Members other than the standard ones are kept in
 * {@link #additionalParameters()}.
 *
 * @param accessToken the access token, {@code null} when the server sent none
 * @param tokenType the token type, usually {@code Bearer}
 * @param expiresIn lifetime in seconds
 * @param scope granted scopes
 * @param refreshToken the refresh token
 * @param additionalParameters all other members of the response
 */
public record OAuthToken(@Nullable String accessToken, @Nullable String tokenType, @Nullable Long expiresIn,
		@Nullable String scope, @Nullable String refreshToken, Map<String, Object> additionalParameters) {

	private static final Set<String> STANDARD_MEMBERS = Set.of("access_token", "token_type", "expires_in", "scope",
			"refresh_token");

	public OAuthToken {
		additionalParameters = additionalParameters == null ? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(additionalParameters));
	}

	/**
	 * Build a token from the decoded JSON object of a token response.
	 * @param payload the members of the response
	 * @return the token
	 */
	public static OAuthToken fromPayload(Map<String, Object> payload) {
		Map<String, Object> additional = new LinkedHashMap<>();
		payload.forEach((name, value) -> {
			if (!STANDARD_MEMBERS.contains(name)) {
				additional.put(name, value);
			}
		});
		return new OAuthToken(text(payload.get("access_token")), text(payload.get("token_type")),
				number(payload.get("expires_in")), text(payload.get("scope")), text(payload.get("refresh_token")),
				additional);
	}

	public boolean hasAccessToken() {
		return accessToken != null && !accessToken.isBlank();
	}

	@Nullable
	private static String text(@Nullable Object value) {
		return value instanceof String ? (String) value : null;
	}

	@Nullable
	private static Long number(@Nullable Object value) {
		if (value instanceof Number) {
			return ((Number) value).longValue();
		}
		if (value instanceof String && ((String) value).strip().matches("\\d{1,18}")) {
			return Long.parseLong(((String) value).strip());
		}
		return null;
	}

	@Override
	public String toString() {
		return "OAuthToken[tokenType=" + tokenType + ", expiresIn=" + expiresIn + ", scope=" + scope
				+ ", refreshToken=" + (refreshToken != null ? "present" : "absent") + "]";
	}

}
