/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.discovery;

import io.mybooks.oauth.OAuthException;
import reactor.util.annotation.Nullable;

/**
 * Raised when OAuth metadata cannot be fetched or parsed. The {@link Reason} tells
 * network trouble apart from documents that were found but are unusable.
 */
public class DiscoveryException extends OAuthException {

	private static final long serialVersionUID = 1L;

	/**
	 * Why discovery failed.
	 */
	public enum Reason {

		/** Transport failure or timeout. */
		NETWORK,

		/** A metadata URL answered with an unexpected status. */
		HTTP_STATUS,

		/** No candidate URL answered with a document. */
		NOT_FOUND,

		/** A document was returned but is not JSON. */
		INVALID_JSON,

		/** A JSON document was returned but it is not an object. */
		NOT_AN_OBJECT,

		/** A required member is missing or empty. */
		MISSING_FIELD,

		/** The URL to discover from cannot be parsed. */
		INVALID_URL

	}

	private final Reason reason;

	private final String url;

	public DiscoveryException(Reason reason, @Nullable String url, String message) {
		super(message);
		this.reason = reason;
		this.url = url;
	}

	public DiscoveryException(Reason reason, @Nullable String url, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason;
		this.url = url;
	}

	public Reason getReason() {
		return reason;
	}

	/**
	 * The URL involved in the failure, if any.
	 * @return the URL or {@code null}
	 */
	@Nullable
	public String getUrl() {
		return url;
	}

}
