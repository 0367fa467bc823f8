/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth;

/**
 * Base class of every error raised by the OAuth client components.
 */
public class OAuthException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public OAuthException(String message) {
		super(message);
	}

	public OAuthException(String message, Throwable cause) {
		super(message, cause);
	}

}
