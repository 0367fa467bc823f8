/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.registration;

import io.mybooks.oauth.OAuthException;

/**
 * Raised when dynamic client registration fails. Carries the HTTP status
 * ({@code -1} when no response was received), its reason phrase and a snippet of the
 * response body.
 */
public class RegistrationException extends OAuthException {

	private static final long serialVersionUID = 1L;

	public static final int NO_STATUS = -1;

	private final int statusCode;

	private final String reasonPhrase;

	private final String bodySnippet;

	private final boolean htmlResponse;

	public RegistrationException(String message, int statusCode, String reasonPhrase, String bodySnippet,
			boolean htmlResponse) {
		super(message);
		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
		this.bodySnippet = bodySnippet;
		this.htmlResponse = htmlResponse;
	}

	public RegistrationException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = NO_STATUS;
		this.reasonPhrase = "";
		this.bodySnippet = "";
		this.htmlResponse = false;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public String getReasonPhrase() {
		return reasonPhrase;
	}

	public String getBodySnippet() {
		return bodySnippet;
	}

	/**
	 * Whether the endpoint answered with an HTML page, typically a login form, instead
	 * of JSON.
	 * @return {@code true} for an HTML response
	 */
	public boolean isHtmlResponse() {
		return htmlResponse;
	}

}
