/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.store;

import io.mybooks.oauth.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Snapshot of the user's sign-in tokens.
 *
 * @param accessToken the access token
 * @param refreshToken the refresh token
 */
public record UserAuthState(@Nullable String accessToken, @Nullable String refreshToken) {

	public boolean isAuthenticated() {
		return Utils.hasText(accessToken);
	}

	@Override
	public String toString() {
		return "UserAuthState[authenticated=" + isAuthenticated() + "]";
	}

}
