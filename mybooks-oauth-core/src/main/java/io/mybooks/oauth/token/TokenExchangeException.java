/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.token;

import io.mybooks.oauth.OAuthException;
import reactor.util.annotation.Nullable;

/**
 * Raised when the token endpoint rejects a request or cannot be reached. For a
 * rejected request the status, reason phrase and body are available for display,
 * together with the OAuth {@code error} and {@code error_description} when the body
 * carries them. Transport failures have status {@value #NO_STATUS}.
 */
public class TokenExchangeException extends OAuthException {

	private static final long serialVersionUID = 1L;

	public static final int NO_STATUS = -1;

	private final int statusCode;

	private final String reasonPhrase;

	private final String body;

	private final String error;

	private final String errorDescription;

	public TokenExchangeException(String message, int statusCode, String reasonPhrase, String body,
			@Nullable String error, @Nullable String errorDescription) {
		super(message);
		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
		this.body = body;
		this.error = error;
		this.errorDescription = errorDescription;
	}

	public TokenExchangeException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = NO_STATUS;
		this.reasonPhrase = "";
		this.body = "";
		this.error = null;
		this.errorDescription = null;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public String getReasonPhrase() {
		return reasonPhrase;
	}

	public String getBody() {
		return body;
	}

	@Nullable
	public String getError() {
		return error;
	}

	@Nullable
	public String getErrorDescription() {
		return errorDescription;
	}

}
