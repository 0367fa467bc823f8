/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.flow;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mybooks.oauth.store.FlowStateStore;
import io.mybooks.oauth.token.OAuthToken;
import io.mybooks.oauth.token.TokenExchangeClient;
import io.mybooks.oauth.util.Assert;
import io.mybooks.oauth.util.Utils;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * One named authorization code flow with PKCE.
 *
 * <p>
 * {@link #start(StartRequest)} persists the pending flow and returns the URL to send
 * the user agent to. {@link #complete(CompleteRequest)} validates the callback state
 * against the persisted flow before any request is made, exchanges the code and
 * removes the flow. A flow is completed at most once.
 *
 * <p>
 * Updates are load then save without compare-and-swap: two concurrent
 * {@code start} calls for the same flow leave the last one persisted.
 */
public class AuthorizationFlow {

	private static final Logger logger = LoggerFactory.getLogger(AuthorizationFlow.class);

	private final FlowType flowType;

	private final FlowStateStore store;

	private final TokenExchangeClient tokenClient;

	public AuthorizationFlow(FlowType flowType, FlowStateStore store, TokenExchangeClient tokenClient) {
		Assert.notNull(flowType, "flowType must not be null");
		Assert.notNull(store, "store must not be null");
		Assert.notNull(tokenClient, "tokenClient must not be null");
		this.flowType = flowType;
		this.store = store;
		this.tokenClient = tokenClient;
	}

	public FlowType getFlowType() {
		return flowType;
	}

	/**
	 * Start the flow. The flow state is persisted before the URL is returned.
	 * @param request the start parameters
	 * @return the authorization URL
	 */
	public String start(StartRequest request) {
		Assert.notNull(request, "request must not be null");

		OAuthFlowState flowState = null;
		if (request.reuseExisting()) {
			flowState = store.load(flowType)
				.map(existing -> existing.withContext(request.clientId(), request.redirectUri(), request.scope()))
				.orElse(null);
		}
		if (flowState == null) {
			flowState = OAuthFlowState.create(request.clientId(), request.redirectUri(), request.scope());
		}
		else {
			logger.debug("Reusing pending {} flow for client {}", flowType.value(), request.clientId());
		}

		store.save(flowType, flowState);
		logger.debug("Started {} flow for client {}", flowType.value(), request.clientId());
		return authorizationUrl(request.authorizationEndpoint(), flowState);
	}

	/**
	 * Complete the flow with the values of the callback.
	 * @param request the callback parameters
	 * @return the token; fails with {@link FlowException} before any request when the
	 * flow is missing or the state does not match, or with the token client's exception
	 * when the exchange fails, in which case the flow stays persisted
	 */
	public Mono<OAuthToken> complete(CompleteRequest request) {
		Assert.notNull(request, "request must not be null");
		return Mono.fromCallable(() -> store.load(flowType)).flatMap(loaded -> {
			OAuthFlowState flowState = loaded.orElseThrow(() -> new FlowException(FlowException.Reason.STATE_MISSING,
					"OAuth flow state missing for " + flowType.value()
							+ ". The flow expired, was started in another session, or was already completed."));

			if (Utils.hasText(flowState.state()) && !flowState.state().equals(request.returnedState())) {
				throw new FlowException(FlowException.Reason.STATE_MISMATCH,
						"OAuth state mismatch for " + flowType.value() + ".");
			}

			String clientId = Utils.hasText(request.clientIdOverride()) ? request.clientIdOverride()
					: flowState.clientId();
			if (!Utils.hasText(clientId)) {
				throw new FlowException(FlowException.Reason.CLIENT_ID_MISSING,
						"OAuth client_id missing for " + flowType.value() + ".");
			}

			return tokenClient.exchangeAuthorizationCode(request.tokenEndpoint(), request.code(),
					flowState.redirectUri(), clientId, flowState.codeVerifier(), request.returnedState());
		}).doOnNext(token -> {
			store.clear(flowType);
			logger.info("Completed {} flow", flowType.value());
		});
	}

	/**
	 * Whether the pending flow carries the given state.
	 * @param state the state from a callback
	 * @return {@code true} when a pending flow has exactly this state
	 */
	public boolean matchesState(@Nullable String state) {
		if (!Utils.hasText(state)) {
			return false;
		}
		return store.load(flowType).map(flowState -> state.equals(flowState.state())).orElse(false);
	}

	public Optional<OAuthFlowState> pending() {
		return store.load(flowType);
	}

	/**
	 * Abandon the pending flow, if any.
	 */
	public void clear() {
		store.clear(flowType);
	}

	static String authorizationUrl(String authorizationEndpoint, OAuthFlowState flowState) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("response_type", "code");
		params.put("client_id", flowState.clientId());
		params.put("redirect_uri", flowState.redirectUri());
		params.put("scope", flowState.scope());
		params.put("state", flowState.state());
		params.put("code_challenge", flowState.codeChallenge());
		params.put("code_challenge_method", flowState.codeChallengeMethod());

		String separator;
		if (!authorizationEndpoint.contains("?")) {
			separator = "?";
		}
		else if (authorizationEndpoint.endsWith("?") || authorizationEndpoint.endsWith("&")) {
			separator = "";
		}
		else {
			separator = "&";
		}
		return authorizationEndpoint + separator + Utils.formEncode(params);
	}

	/**
	 * Parameters of {@link AuthorizationFlow#start(StartRequest)}.
	 *
	 * @param clientId the client id
	 * @param scope the scope
	 * @param redirectUri the redirect URI
	 * @param authorizationEndpoint the authorization endpoint
	 * @param reuseExisting keep the PKCE material and state of a pending flow, replacing
	 * only the client id, redirect URI and scope
	 */
	public record StartRequest(String clientId, String scope, String redirectUri, String authorizationEndpoint,
			boolean reuseExisting) {

		public StartRequest {
			Assert.hasText(clientId, "clientId must not be empty");
			Assert.hasText(scope, "scope must not be empty");
			Assert.hasText(redirectUri, "redirectUri must not be empty");
			Assert.hasText(authorizationEndpoint, "authorizationEndpoint must not be empty");
		}

		public StartRequest(String clientId, String scope, String redirectUri, String authorizationEndpoint) {
			this(clientId, scope, redirectUri, authorizationEndpoint, false);
		}

	}

	/**
	 * Parameters of {@link AuthorizationFlow#complete(CompleteRequest)}.
	 *
	 * @param code the authorization code
	 * @param returnedState the state from the callback
	 * @param tokenEndpoint the token endpoint
	 * @param clientIdOverride client id to use instead of the persisted one
	 */
	public record CompleteRequest(String code, @Nullable String returnedState, String tokenEndpoint,
			@Nullable String clientIdOverride) {

		public CompleteRequest {
			Assert.hasText(code, "code must not be empty");
			Assert.hasText(tokenEndpoint, "tokenEndpoint must not be empty");
		}

		public CompleteRequest(String code, @Nullable String returnedState, String tokenEndpoint) {
			this(code, returnedState, tokenEndpoint, null);
		}

	}

}
