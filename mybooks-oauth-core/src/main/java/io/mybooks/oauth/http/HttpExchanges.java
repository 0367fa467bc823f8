/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.http;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Helpers for running a single request/response exchange with {@link HttpClient}.
 */
public final class HttpExchanges {

	public static final String CONTENT_TYPE = "Content-Type";

	public static final String ACCEPT = "Accept";

	public static final String CACHE_CONTROL = "Cache-Control";

	public static final String AUTHORIZATION = "Authorization";

	public static final String WWW_AUTHENTICATE = "WWW-Authenticate";

	public static final String APPLICATION_JSON = "application/json";

	public static final String APPLICATION_FORM_URLENCODED = "application/x-www-form-urlencoded";

	private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(Map.entry(200, "OK"),
			Map.entry(201, "Created"), Map.entry(204, "No Content"), Map.entry(301, "Moved Permanently"),
			Map.entry(302, "Found"), Map.entry(400, "Bad Request"), Map.entry(401, "Unauthorized"),
			Map.entry(403, "Forbidden"), Map.entry(404, "Not Found"), Map.entry(405, "Method Not Allowed"),
			Map.entry(409, "Conflict"), Map.entry(415, "Unsupported Media Type"), Map.entry(422, "Unprocessable Entity"),
			Map.entry(429, "Too Many Requests"), Map.entry(500, "Internal Server Error"),
			Map.entry(502, "Bad Gateway"), Map.entry(503, "Service Unavailable"), Map.entry(504, "Gateway Timeout"));

	private HttpExchanges() {
	}

	/**
	 * Send the request lazily. Nothing is sent until subscription; cancelling the
	 * subscription cancels the exchange. The whole exchange is bounded by
	 * {@code timeout}.
	 * @param httpClient the client
	 * @param request the request
	 * @param timeout upper bound for the exchange
	 * @return the response with the body read as a string
	 */
	public static Mono<HttpResponse<String>> send(HttpClient httpClient, HttpRequest request, Duration timeout) {
		return Mono.fromFuture(() -> httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()))
			.timeout(timeout);
	}

	public static boolean isSuccess(int statusCode) {
		return statusCode >= 200 && statusCode < 300;
	}

	/**
	 * The standard reason phrase for a status code, empty when unknown.
	 * @param statusCode the status code
	 * @return the reason phrase
	 */
	public static String reasonPhrase(int statusCode) {
		return REASON_PHRASES.getOrDefault(statusCode, "");
	}

	/**
	 * The response content type in lower case, empty when absent.
	 * @param response the response
	 * @return the content type
	 */
	public static String contentType(HttpResponse<?> response) {
		return response.headers().firstValue(CONTENT_TYPE).orElse("").toLowerCase(Locale.ROOT);
	}

}
