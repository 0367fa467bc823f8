/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.mybooks.oauth.flow.FlowType;
import io.mybooks.oauth.flow.OAuthFlowState;
import io.mybooks.oauth.util.Assert;

/**
 * {@link FlowStateStore} kept in memory. Only suitable for tests and single process
 * deployments where the callback reaches the same process.
 */
public class InMemoryFlowStateStore implements FlowStateStore {

	private final Map<FlowType, OAuthFlowState> flows = new ConcurrentHashMap<>();

	@Override
	public void save(FlowType flowType, OAuthFlowState flowState) {
		Assert.notNull(flowType, "flowType must not be null");
		Assert.notNull(flowState, "flowState must not be null");
		flows.put(flowType, flowState);
	}

	@Override
	public Optional<OAuthFlowState> load(FlowType flowType) {
		Assert.notNull(flowType, "flowType must not be null");
		OAuthFlowState flowState = flows.get(flowType);
		if (flowState != null && !flowState.isComplete()) {
			flows.remove(flowType, flowState);
			return Optional.empty();
		}
		return Optional.ofNullable(flowState);
	}

	@Override
	public void clear(FlowType flowType) {
		Assert.notNull(flowType, "flowType must not be null");
		flows.remove(flowType);
	}

}
