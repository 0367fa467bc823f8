/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.pkce;

/**
 * A PKCE code verifier with the challenge derived from it.
 *
 * @param codeVerifier the secret kept by the client
 * @param codeChallenge the challenge sent on the authorization request
 * @param codeChallengeMethod always {@code S256}
 */
public record PkcePair(String codeVerifier, String codeChallenge, String codeChallengeMethod) {

	@Override
	public String toString() {
		return "PkcePair[codeChallenge=" + codeChallenge + ", codeChallengeMethod=" + codeChallengeMethod + "]";
	}

}
