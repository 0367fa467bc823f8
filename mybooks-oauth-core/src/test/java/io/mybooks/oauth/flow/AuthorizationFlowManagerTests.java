/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.flow;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.mybooks.oauth.store.InMemoryFlowStateStore;
import io.mybooks.oauth.token.TokenExchangeClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class AuthorizationFlowManagerTests {

	private InMemoryFlowStateStore store;

	private AuthorizationFlowManager manager;

	@BeforeEach
	void setUp() {
		store = new InMemoryFlowStateStore();
		manager = new AuthorizationFlowManager(store, mock(TokenExchangeClient.class));
	}

	private String start(FlowType flowType) {
		manager.start(flowType, new AuthorizationFlow.StartRequest("abc123", "read", "https://app/cb",
				"https://auth/authorize"));
		return store.load(flowType).orElseThrow().state();
	}

	@Test
	void flowsArePendingIndependently() {
		String loginState = start(FlowType.USER_LOGIN);
		String appState = start(FlowType.APP_AUTHORIZE);

		assertThat(loginState).isNotEqualTo(appState);
		assertThat(manager.findFlowByState(loginState)).contains(FlowType.USER_LOGIN);
		assertThat(manager.findFlowByState(appState)).contains(FlowType.APP_AUTHORIZE);
		assertThat(manager.findFlowByState("unknown")).isEmpty();
	}

	@Test
	void clearAffectsOnlyTheNamedFlow() {
		start(FlowType.USER_LOGIN);
		String appState = start(FlowType.APP_AUTHORIZE);

		manager.clear(FlowType.USER_LOGIN);

		assertThat(store.load(FlowType.USER_LOGIN)).isEmpty();
		assertThat(manager.findFlowByState(appState)).contains(FlowType.APP_AUTHORIZE);
	}

	@Test
	void clearAllRemovesEveryFlow() {
		start(FlowType.USER_LOGIN);
		start(FlowType.APP_AUTHORIZE);

		manager.clearAll();

		assertThat(store.load(FlowType.USER_LOGIN)).isEmpty();
		assertThat(store.load(FlowType.APP_AUTHORIZE)).isEmpty();
	}

	@Test
	void flowTypeValuesAreStable() {
		assertThat(FlowType.USER_LOGIN.value()).isEqualTo("user_login");
		assertThat(FlowType.fromValue("app_authorize")).isEqualTo(FlowType.APP_AUTHORIZE);
	}

}
