/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.flow;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import io.mybooks.oauth.store.FlowStateStore;
import io.mybooks.oauth.token.OAuthToken;
import io.mybooks.oauth.token.TokenExchangeClient;
import io.mybooks.oauth.util.Assert;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * The {@link AuthorizationFlow} of every {@link FlowType} over one shared
 * {@link FlowStateStore}, so several flows can be pending at once and a callback can
 * be routed to the flow whose state it carries.
 */
public class AuthorizationFlowManager {

	private final Map<FlowType, AuthorizationFlow> flows = new EnumMap<>(FlowType.class);

	public AuthorizationFlowManager(FlowStateStore store, TokenExchangeClient tokenClient) {
		Assert.notNull(store, "store must not be null");
		Assert.notNull(tokenClient, "tokenClient must not be null");
		for (FlowType flowType : FlowType.values()) {
			flows.put(flowType, new AuthorizationFlow(flowType, store, tokenClient));
		}
	}

	public AuthorizationFlow flow(FlowType flowType) {
		Assert.notNull(flowType, "flowType must not be null");
		return flows.get(flowType);
	}

	public String start(FlowType flowType, AuthorizationFlow.StartRequest request) {
		return flow(flowType).start(request);
	}

	public Mono<OAuthToken> complete(FlowType flowType, AuthorizationFlow.CompleteRequest request) {
		return flow(flowType).complete(request);
	}

	/**
	 * The flow whose pending state equals the given state.
	 * @param state the state from a callback
	 * @return the matching flow type
	 */
	public Optional<FlowType> findFlowByState(@Nullable String state) {
		for (FlowType flowType : FlowType.values()) {
			if (flows.get(flowType).matchesState(state)) {
				return Optional.of(flowType);
			}
		}
		return Optional.empty();
	}

	public void clear(FlowType flowType) {
		flow(flowType).clear();
	}

	public void clearAll() {
		flows.values().forEach(AuthorizationFlow::clear);
	}

}
