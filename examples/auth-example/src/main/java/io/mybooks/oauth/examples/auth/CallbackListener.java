/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.examples.auth;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local HTTP listener receiving the redirect from the authorization endpoint.
 */
public class CallbackListener implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(CallbackListener.class);

	private static final String PAGE = "<html><body><h1>%s</h1><p>You can close this window now.</p>"
			+ "<script>setTimeout(() => window.close(), 2000);</script></body></html>";

	private final HttpServer server;

	private final CompletableFuture<Callback> callback = new CompletableFuture<>();

	public CallbackListener(int port, String path) throws IOException {
		server = HttpServer.create(new InetSocketAddress("localhost", port), 0);
		server.createContext(path, this::handle);
		server.start();
		logger.info("Waiting for the authorization callback on port {}", port);
	}

	/**
	 * The first callback received.
	 * @return completes with the callback parameters
	 */
	public CompletableFuture<Callback> callback() {
		return callback;
	}

	@Override
	public void close() {
		server.stop(0);
	}

	private void handle(HttpExchange exchange) throws IOException {
		Map<String, String> params = parseQuery(exchange.getRequestURI().getRawQuery());
		Callback received = new Callback(params.get("code"), params.get("state"), params.get("error"),
				params.get("error_description"));

		String title = received.error() == null ? "Authorization received!" : "Authorization failed";
		byte[] body = String.format(PAGE, title).getBytes(StandardCharsets.UTF_8);
		exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
		exchange.sendResponseHeaders(200, body.length);
		try (OutputStream output = exchange.getResponseBody()) {
			output.write(body);
		}
		callback.complete(received);
	}

	static Map<String, String> parseQuery(String rawQuery) {
		Map<String, String> params = new HashMap<>();
		if (rawQuery == null || rawQuery.isEmpty()) {
			return params;
		}
		for (String pair : rawQuery.split("&")) {
			int separator = pair.indexOf('=');
			String name = separator < 0 ? pair : pair.substring(0, separator);
			String value = separator < 0 ? "" : pair.substring(separator + 1);
			params.putIfAbsent(URLDecoder.decode(name, StandardCharsets.UTF_8),
					URLDecoder.decode(value, StandardCharsets.UTF_8));
		}
		return params;
	}

	/**
	 * Query parameters of the redirect.
	 *
	 * @param code the authorization code
	 * @param state the returned state
	 * @param error the OAuth error, when authorization was refused
	 * @param errorDescription the error description
	 */
	public record Callback(String code, String state, String error, String errorDescription) {
	}

}
