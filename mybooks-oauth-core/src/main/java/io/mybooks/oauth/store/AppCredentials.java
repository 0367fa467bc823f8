/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import reactor.util.annotation.Nullable;

/**
 * Credentials persisted for one user: the user's own sign-in tokens, the registered
 * OAuth client and the tokens issued to that client.
 *
 * @param userAccessToken access token from the user sign-in flow
 * @param userRefreshToken refresh token from the user sign-in flow
 * @param clientId the registered client id
 * @param clientName the registered client name
 * @param clientRedirectUris the registered redirect URIs
 * @param oauthAccessToken access token issued to the registered client
 * @param oauthRefreshToken refresh token issued to the registered client
 * @param registrationAccessToken RFC 7592 registration access token
 * @param registrationClientUri RFC 7592 client configuration URI
 * @param registrationClientPayload the complete registration response
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AppCredentials(@JsonProperty("user_access_token") @Nullable String userAccessToken,
		@JsonProperty("user_refresh_token") @Nullable String userRefreshToken,
		@JsonProperty("oauth_client_id") @Nullable String clientId,
		@JsonProperty("oauth_client_name") @Nullable String clientName,
		@JsonProperty("oauth_client_redirect_uris") List<String> clientRedirectUris,
		@JsonProperty("oauth_access_token") @Nullable String oauthAccessToken,
		@JsonProperty("oauth_refresh_token") @Nullable String oauthRefreshToken,
		@JsonProperty("registration_access_token") @Nullable String registrationAccessToken,
		@JsonProperty("registration_client_uri") @Nullable String registrationClientUri,
		@JsonProperty("registration_client_payload") @Nullable Map<String, Object> registrationClientPayload) {

	private static final AppCredentials EMPTY = new AppCredentials(null, null, null, null, List.of(), null, null, null,
			null, null);

	public AppCredentials {
		clientRedirectUris = clientRedirectUris == null ? List.of() : List.copyOf(clientRedirectUris);
		registrationClientPayload = registrationClientPayload == null ? null
				: Collections.unmodifiableMap(new LinkedHashMap<>(registrationClientPayload));
	}

	public static AppCredentials empty() {
		return EMPTY;
	}

	public UserAuthState userAuthState() {
		return new UserAuthState(userAccessToken, userRefreshToken);
	}

	public AppAuthState appAuthState() {
		return new AppAuthState(clientId, clientName, oauthAccessToken, oauthRefreshToken, registrationAccessToken,
				registrationClientUri);
	}

	@Override
	public String toString() {
		return "AppCredentials[clientId=" + clientId + ", clientName=" + clientName + ", userAuthenticated="
				+ userAuthState().isAuthenticated() + ", appAuthorized=" + appAuthState().isAuthorized() + "]";
	}

}
