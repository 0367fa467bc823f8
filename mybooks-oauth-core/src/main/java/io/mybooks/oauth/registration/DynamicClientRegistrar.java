/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.registration;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mybooks.oauth.OAuthClientSettings;
import io.mybooks.oauth.http.HttpExchanges;
import io.mybooks.oauth.http.OAuthHttpClients;
import io.mybooks.oauth.util.Assert;
import io.mybooks.oauth.util.Utils;
import reactor.core.publisher.Mono;

/**
 * Registers public OAuth clients with an RFC 7591 registration endpoint.
 *
 * <p>
 * Registration is an at-most-once action: a failed request is reported, never retried.
 */
public class DynamicClientRegistrar {

	private static final Logger logger = LoggerFactory.getLogger(DynamicClientRegistrar.class);

	private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
	};

	static final int ERROR_SNIPPET_LENGTH = 150;

	static final int PREVIEW_LENGTH = 2000;

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final Duration timeout;

	public DynamicClientRegistrar(HttpClient httpClient, ObjectMapper objectMapper, Duration timeout) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(timeout, "timeout must not be null");
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.timeout = timeout;
	}

	public static DynamicClientRegistrar create(OAuthClientSettings settings) {
		return new DynamicClientRegistrar(OAuthHttpClients.create(settings), new ObjectMapper(),
				settings.getRequestTimeout());
	}

	public Mono<ClientRegistration> register(String registrationEndpoint, String clientName, String redirectUri,
			String scope, List<String> contacts) {
		return register(registrationEndpoint,
				ClientRegistrationRequest.publicClient(clientName, redirectUri, scope, contacts));
	}

	/**
	 * Post the registration request.
	 * @param registrationEndpoint the registration endpoint
	 * @param registrationRequest the request
	 * @return the registration; fails with {@link RegistrationException}
	 */
	public Mono<ClientRegistration> register(String registrationEndpoint,
			ClientRegistrationRequest registrationRequest) {
		Assert.hasText(registrationEndpoint, "registrationEndpoint must not be empty");
		Assert.notNull(registrationRequest, "registrationRequest must not be null");

		return Mono.defer(() -> {
			HttpRequest request;
			try {
				request = HttpRequest.newBuilder(URI.create(registrationEndpoint))
					.header(HttpExchanges.CONTENT_TYPE, HttpExchanges.APPLICATION_JSON)
					.header(HttpExchanges.ACCEPT, HttpExchanges.APPLICATION_JSON)
					.timeout(timeout)
					.POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(registrationRequest)))
					.build();
			}
			catch (JsonProcessingException | IllegalArgumentException e) {
				return Mono.error(new RegistrationException(
						"Cannot build registration request for " + registrationEndpoint + ": " + e.getMessage(), e));
			}

			logger.debug("Registering client '{}' at {}", registrationRequest.clientName(), registrationEndpoint);
			return HttpExchanges.send(httpClient, request, timeout)
				.onErrorMap(e -> !(e instanceof RegistrationException),
						e -> new RegistrationException("Registration of '" + registrationRequest.clientName()
								+ "' failed: " + describe(e), e))
				.map(response -> toRegistration(response, registrationRequest.clientName()))
				.doOnNext(registration -> logger.info("Registered OAuth client '{}' with client_id {}",
						registrationRequest.clientName(), registration.clientId()));
		});
	}

	private ClientRegistration toRegistration(HttpResponse<String> response, String clientName) {
		int status = response.statusCode();
		String reasonPhrase = HttpExchanges.reasonPhrase(status);
		String body = response.body() == null ? "" : response.body();
		String contentType = HttpExchanges.contentType(response);
		boolean html = contentType.contains("html");

		if (!HttpExchanges.isSuccess(status)) {
			String snippet = Utils.snippet(body, ERROR_SNIPPET_LENGTH);
			String suffix = (status == 401 || status == 403)
					? " Sign in before registering a new OAuth application." : "";
			throw new RegistrationException("Registration of '" + clientName + "' failed: " + status + " "
					+ reasonPhrase + ": " + snippet + "." + suffix, status, reasonPhrase, snippet, html);
		}

		JsonNode document;
		try {
			document = objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw invalidPayload(status, reasonPhrase, body, html,
					"Registration endpoint returned invalid JSON (" + e.getOriginalMessage() + ").");
		}
		if (document == null || !document.isObject()) {
			throw invalidPayload(status, reasonPhrase, body, html, "Registration endpoint returned invalid payload.");
		}

		JsonNode clientId = document.get("client_id");
		if (clientId == null || !clientId.isTextual() || clientId.asText().isBlank()) {
			String snippet = Utils.snippet(body, ERROR_SNIPPET_LENGTH);
			throw new RegistrationException("Registration endpoint response did not include a client_id.", status,
					reasonPhrase, snippet, false);
		}
		return new ClientRegistration(objectMapper.convertValue(document, PAYLOAD_TYPE));
	}

	private RegistrationException invalidPayload(int status, String reasonPhrase, String body, boolean html,
			String jsonDetail) {
		String preview = Utils.snippet(body, PREVIEW_LENGTH);
		StringBuilder message = new StringBuilder();
		if (html) {
			message.append("Registration endpoint responded with HTML instead of JSON. ")
				.append("Ensure the request is authorized and the endpoint URL is correct.");
		}
		else {
			message.append(jsonDetail);
		}
		if (!preview.isEmpty()) {
			message.append(" Body preview: ").append(preview);
		}
		return new RegistrationException(message.toString(), status, reasonPhrase, preview, html);
	}

	private String describe(Throwable error) {
		if (error instanceof TimeoutException) {
			return "timed out after " + timeout.toMillis() + " ms";
		}
		return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
	}

}
