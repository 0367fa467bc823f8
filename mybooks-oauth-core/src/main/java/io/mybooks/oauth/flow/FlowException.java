/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.flow;

import io.mybooks.oauth.OAuthException;

/**
 * Raised when an authorization flow cannot be started or completed.
 */
public class FlowException extends OAuthException {

	private static final long serialVersionUID = 1L;

	public enum Reason {

		/** No pending flow: expired, other browser or session, or already completed. */
		STATE_MISSING,

		/** The callback state differs from the persisted one. */
		STATE_MISMATCH,

		/** Neither the caller nor the persisted flow provides a client id. */
		CLIENT_ID_MISSING,

		/** The token response has no access token. */
		ACCESS_TOKEN_MISSING,

		/** The callback carries a code but no state. */
		CALLBACK_STATE_MISSING,

		/** The callback state matches no pending flow. */
		NO_ACTIVE_FLOW,

		/** A refresh was requested but no refresh token is stored. */
		REFRESH_TOKEN_MISSING

	}

	private final Reason reason;

	public FlowException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public Reason getReason() {
		return reason;
	}

}
