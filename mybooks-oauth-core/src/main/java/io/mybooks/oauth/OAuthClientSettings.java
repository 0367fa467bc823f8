/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth;

import java.time.Duration;
import java.util.Map;

import io.mybooks.oauth.util.Assert;
import io.mybooks.oauth.util.Utils;

/**
 * Immutable configuration shared by the OAuth client components.
 *
 * <p>
 * Values can be set with the {@link #builder()} or read from an environment map with
 * {@link #fromEnvironment(Map)}. Recognized variables:
 * <ul>
 * <li>{@code MCP_SERVER_URL} - protected resource or authorization server base URL</li>
 * <li>{@code OAUTH_REDIRECT_URI} - redirect URI registered for the client</li>
 * <li>{@code OAUTH_SCOPES} - space-delimited scopes, default {@code read write}</li>
 * <li>{@code OAUTH_CLIENT_NAME} - name used for dynamic client registration</li>
 * <li>{@code OAUTH_TIMEOUT_SECONDS} - per request timeout, default 10</li>
 * <li>{@code REQUESTS_VERIFY_SSL} - TLS certificate verification, default true</li>
 * <li>{@code OAUTH_FORWARD_STATE} - send {@code state} with the code exchange</li>
 * </ul>
 */
public final class OAuthClientSettings {

	public static final String DEFAULT_SCOPE = "read write";

	public static final String DEFAULT_CLIENT_NAME = "MyBooks OAuth Client";

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

	private final String serverUrl;

	private final String redirectUri;

	private final String scope;

	private final String clientName;

	private final Duration requestTimeout;

	private final boolean verifySsl;

	private final boolean forwardStateToTokenEndpoint;

	private OAuthClientSettings(Builder builder) {
		this.serverUrl = builder.serverUrl;
		this.redirectUri = builder.redirectUri;
		this.scope = builder.scope;
		this.clientName = builder.clientName;
		this.requestTimeout = builder.requestTimeout;
		this.verifySsl = builder.verifySsl;
		this.forwardStateToTokenEndpoint = builder.forwardStateToTokenEndpoint;
	}

	public String getServerUrl() {
		return serverUrl;
	}

	public String getRedirectUri() {
		return redirectUri;
	}

	public String getScope() {
		return scope;
	}

	public String getClientName() {
		return clientName;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public boolean isVerifySsl() {
		return verifySsl;
	}

	public boolean isForwardStateToTokenEndpoint() {
		return forwardStateToTokenEndpoint;
	}

	/**
	 * Read settings from environment style variables.
	 * @param environment the variables, usually {@link System#getenv()}
	 * @return the settings
	 * @throws IllegalArgumentException if {@code MCP_SERVER_URL} or
	 * {@code OAUTH_REDIRECT_URI} is missing, or the timeout is not a positive number
	 */
	public static OAuthClientSettings fromEnvironment(Map<String, String> environment) {
		Builder builder = builder().serverUrl(environment.get("MCP_SERVER_URL"))
			.redirectUri(environment.get("OAUTH_REDIRECT_URI"));

		String scope = environment.get("OAUTH_SCOPES");
		if (Utils.hasText(scope)) {
			builder.scope(scope.strip());
		}
		String clientName = environment.get("OAUTH_CLIENT_NAME");
		if (Utils.hasText(clientName)) {
			builder.clientName(clientName.strip());
		}
		String timeout = environment.get("OAUTH_TIMEOUT_SECONDS");
		if (Utils.hasText(timeout)) {
			try {
				builder.requestTimeout(Duration.ofSeconds(Long.parseLong(timeout.strip())));
			}
			catch (NumberFormatException e) {
				throw new IllegalArgumentException("OAUTH_TIMEOUT_SECONDS must be a number: " + timeout, e);
			}
		}
		String verifySsl = environment.get("REQUESTS_VERIFY_SSL");
		if (verifySsl != null) {
			builder.verifySsl(Utils.parseFlag(verifySsl));
		}
		builder.forwardStateToTokenEndpoint(Utils.parseFlag(environment.get("OAUTH_FORWARD_STATE")));
		return builder.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link OAuthClientSettings}.
	 */
	public static final class Builder {

		private String serverUrl;

		private String redirectUri;

		private String scope = DEFAULT_SCOPE;

		private String clientName = DEFAULT_CLIENT_NAME;

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		private boolean verifySsl = true;

		private boolean forwardStateToTokenEndpoint = false;

		private Builder() {
		}

		public Builder serverUrl(String serverUrl) {
			this.serverUrl = serverUrl;
			return this;
		}

		public Builder redirectUri(String redirectUri) {
			this.redirectUri = redirectUri;
			return this;
		}

		public Builder scope(String scope) {
			this.scope = scope;
			return this;
		}

		public Builder clientName(String clientName) {
			this.clientName = clientName;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder verifySsl(boolean verifySsl) {
			this.verifySsl = verifySsl;
			return this;
		}

		/**
		 * Whether the {@code state} returned on the callback is also sent with the
		 * authorization code exchange. The token endpoint does not use it; some servers
		 * tolerate it.
		 * @param forwardStateToTokenEndpoint the flag
		 * @return this builder
		 */
		public Builder forwardStateToTokenEndpoint(boolean forwardStateToTokenEndpoint) {
			this.forwardStateToTokenEndpoint = forwardStateToTokenEndpoint;
			return this;
		}

		public OAuthClientSettings build() {
			Assert.hasText(serverUrl, "serverUrl must not be empty");
			Assert.hasText(redirectUri, "redirectUri must not be empty");
			Assert.hasText(scope, "scope must not be empty");
			Assert.hasText(clientName, "clientName must not be empty");
			Assert.notNull(requestTimeout, "requestTimeout must not be null");
			Assert.isTrue(!requestTimeout.isNegative() && !requestTimeout.isZero(),
					"requestTimeout must be positive");
			return new OAuthClientSettings(this);
		}

	}

}
