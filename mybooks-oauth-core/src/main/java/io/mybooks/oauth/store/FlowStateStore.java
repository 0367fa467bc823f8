/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.store;

import java.util.Optional;

import io.mybooks.oauth.flow.FlowType;
import io.mybooks.oauth.flow.OAuthFlowState;

/**
 * Storage for pending authorization flows, one entry per {@link FlowType}.
 *
 * <p>
 * A pending flow has to survive the browser redirect, possibly a process restart in
 * between, so production implementations must be durable or shared. A {@link #save}
 * must be visible to the next {@link #load} once it returns. Entries that are not
 * {@link OAuthFlowState#isComplete() complete} are reported as absent.
 */
public interface FlowStateStore {

	void save(FlowType flowType, OAuthFlowState flowState);

	Optional<OAuthFlowState> load(FlowType flowType);

	void clear(FlowType flowType);

}
