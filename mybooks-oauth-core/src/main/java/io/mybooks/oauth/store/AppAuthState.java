/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.store;

import io.mybooks.oauth.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Snapshot of the registered client and its tokens.
 *
 * @param clientId the client id
 * @param clientName the client name
 * @param accessToken the client's access token
 * @param refreshToken the client's refresh token
 * @param registrationAccessToken the registration access token
 * @param registrationClientUri the client configuration URI
 */
public record AppAuthState(@Nullable String clientId, @Nullable String clientName, @Nullable String accessToken,
		@Nullable String refreshToken, @Nullable String registrationAccessToken,
		@Nullable String registrationClientUri) {

	public boolean isRegistered() {
		return Utils.hasText(clientId);
	}

	public boolean isAuthorized() {
		return Utils.hasText(accessToken);
	}

	@Override
	public String toString() {
		return "AppAuthState[clientId=" + clientId + ", clientName=" + clientName + ", authorized=" + isAuthorized()
				+ "]";
	}

}
