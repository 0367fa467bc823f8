/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.http;

import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mybooks.oauth.OAuthClientSettings;

/**
 * Factory for the {@link HttpClient} shared by discovery, registration and token
 * exchange.
 */
public final class OAuthHttpClients {

	private static final Logger logger = LoggerFactory.getLogger(OAuthHttpClients.class);

	private OAuthHttpClients() {
	}

	/**
	 * Create an HTTP client honouring the timeout and TLS verification settings.
	 * @param settings the client settings
	 * @return a new HTTP client
	 */
	public static HttpClient create(OAuthClientSettings settings) {
		return create(settings.getRequestTimeout(), settings.isVerifySsl());
	}

	/**
	 * Create an HTTP client.
	 * @param connectTimeout connect timeout
	 * @param verifySsl {@code false} to accept any server certificate
	 * @return a new HTTP client
	 */
	public static HttpClient create(Duration connectTimeout, boolean verifySsl) {
		HttpClient.Builder builder = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL);
		if (!verifySsl) {
			logger.warn("TLS certificate verification is disabled for OAuth requests");
			builder.sslContext(trustAllContext());
		}
		return builder.build();
	}

	private static SSLContext trustAllContext() {
		TrustManager[] trustManagers = { new X509TrustManager() {

			@Override
			public void checkClientTrusted(X509Certificate[] chain, String authType) {
			}

			@Override
			public void checkServerTrusted(X509Certificate[] chain, String authType) {
			}

			@Override
			public X509Certificate[] getAcceptedIssuers() {
				return new X509Certificate[0];
			}

		} };
		try {
			SSLContext context = SSLContext.getInstance("TLS");
			context.init(null, trustManagers, new SecureRandom());
			return context;
		}
		catch (GeneralSecurityException e) {
			throw new IllegalStateException("Unable to create TLS context", e);
		}
	}

}
