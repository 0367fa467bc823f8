/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.flow;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.mybooks.oauth.pkce.PkcePair;
import io.mybooks.oauth.pkce.PkceUtils;
import io.mybooks.oauth.util.Assert;
import io.mybooks.oauth.util.Utils;

/**
 * State of a pending authorization flow, persisted between the redirect to the
 * authorization endpoint and the callback. Never mutated; {@link #withContext} returns
 * a replacement.
 *
 * @param clientId the client the flow was started for
 * @param redirectUri the redirect URI sent to the authorization endpoint
 * @param scope the requested scope
 * @param codeVerifier the PKCE verifier
 * @param codeChallenge the PKCE challenge derived from the verifier
 * @param codeChallengeMethod always {@code S256}
 * @param state the CSRF token echoed back on the callback
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OAuthFlowState(@JsonProperty("client_id") String clientId,
		@JsonProperty("redirect_uri") String redirectUri, @JsonProperty("scope") String scope,
		@JsonProperty("code_verifier") String codeVerifier, @JsonProperty("code_challenge") String codeChallenge,
		@JsonProperty("code_challenge_method") String codeChallengeMethod, @JsonProperty("state") String state) {

	/** Random bytes in a state token, 192 bits. */
	public static final int STATE_BYTES = 24;

	/**
	 * New flow state with fresh PKCE material and state token.
	 * @param clientId the client id
	 * @param redirectUri the redirect URI
	 * @param scope the scope
	 * @return the state
	 */
	public static OAuthFlowState create(String clientId, String redirectUri, String scope) {
		Assert.hasText(clientId, "clientId must not be empty");
		Assert.hasText(redirectUri, "redirectUri must not be empty");
		Assert.hasText(scope, "scope must not be empty");
		PkcePair pkce = PkceUtils.generatePair();
		return new OAuthFlowState(clientId, redirectUri, scope, pkce.codeVerifier(), pkce.codeChallenge(),
				pkce.codeChallengeMethod(), PkceUtils.generateState(STATE_BYTES));
	}

	/**
	 * Replacement with a new client context, keeping the PKCE material and state.
	 * @param clientId the client id
	 * @param redirectUri the redirect URI
	 * @param scope the scope
	 * @return the replacement
	 */
	public OAuthFlowState withContext(String clientId, String redirectUri, String scope) {
		Assert.hasText(clientId, "clientId must not be empty");
		Assert.hasText(redirectUri, "redirectUri must not be empty");
		Assert.hasText(scope, "scope must not be empty");
		return new OAuthFlowState(clientId, redirectUri, scope, codeVerifier, codeChallenge, codeChallengeMethod,
				state);
	}

	/**
	 * Whether every member is present and non-empty. A persisted state failing this
	 * check is unusable and treated as absent.
	 * @return {@code true} when complete
	 */
	@JsonIgnore
	public boolean isComplete() {
		return Utils.hasText(clientId) && Utils.hasText(redirectUri) && Utils.hasText(scope)
				&& Utils.hasText(codeVerifier) && Utils.hasText(codeChallenge) && Utils.hasText(codeChallengeMethod)
				&& Utils.hasText(state);
	}

	@Override
	public String toString() {
		return "OAuthFlowState[clientId=" + clientId + ", redirectUri=" + redirectUri + ", scope=" + scope
				+ ", codeChallenge=" + codeChallenge + ", codeChallengeMethod=" + codeChallengeMethod + "]";
	}

}
