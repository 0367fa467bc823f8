/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.store;

import io.mybooks.oauth.OAuthException;

/**
 * Raised when persisted flow state or credentials cannot be read or written.
 */
public class StoreException extends OAuthException {

	private static final long serialVersionUID = 1L;

	public StoreException(String message, Throwable cause) {
		super(message, cause);
	}

}
