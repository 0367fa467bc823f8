/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.registration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.mybooks.oauth.MockOAuthServer;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class DynamicClientRegistrarTests {

	private final ObjectMapper objectMapper = new ObjectMapper();

	private MockOAuthServer server;

	private DynamicClientRegistrar registrar;

	@BeforeEach
	void setUp() throws Exception {
		server = new MockOAuthServer();
		registrar = new DynamicClientRegistrar(HttpClient.newHttpClient(), objectMapper, Duration.ofSeconds(5));
	}

	@AfterEach
	void tearDown() {
		server.close();
	}

	@Test
	void registersPublicClient() throws Exception {
		server.respond("/register", 201, "application/json",
				"{\"client_id\":\"abc123\",\"client_name\":\"Test Client\",\"redirect_uris\":[\"https://app.example.com/cb\"],"
						+ "\"registration_access_token\":\"rat\",\"registration_client_uri\":\"https://a/register/abc123\","
						+ "\"client_id_issued_at\":1700000000}");

		StepVerifier
			.create(registrar.register(server.url("/register"), "Test Client", "https://app.example.com/cb",
					"read write", List.of()))
			.assertNext(registration -> {
				assertThat(registration.clientId()).isEqualTo("abc123");
				assertThat(registration.clientName()).isEqualTo("Test Client");
				assertThat(registration.redirectUris()).containsExactly("https://app.example.com/cb");
				assertThat(registration.registrationAccessToken()).isEqualTo("rat");
				assertThat(registration.registrationClientUri()).isEqualTo("https://a/register/abc123");
				assertThat(registration.payload()).containsKey("client_id_issued_at");
			})
			.verifyComplete();

		MockOAuthServer.RecordedRequest request = server.requests("/register").get(0);
		assertThat(request.method()).isEqualTo("POST");
		assertThat(request.header("Content-Type")).isEqualTo("application/json");
		assertThat(request.header("Accept")).isEqualTo("application/json");

		JsonNode body = objectMapper.readTree(request.body());
		assertThat(body.get("client_name").asText()).isEqualTo("Test Client");
		assertThat(body.get("redirect_uris").get(0).asText()).isEqualTo("https://app.example.com/cb");
		assertThat(body.get("grant_types").toString()).isEqualTo("[\"authorization_code\",\"refresh_token\"]");
		assertThat(body.get("response_types").toString()).isEqualTo("[\"code\"]");
		assertThat(body.get("scope").asText()).isEqualTo("read write");
		assertThat(body.get("token_endpoint_auth_method").asText()).isEqualTo("none");
		assertThat(body.has("contacts")).isFalse();
	}

	@Test
	void contactsAreSentWhenGiven() throws Exception {
		server.respond("/register", 201, "application/json", "{\"client_id\":\"abc123\"}");

		registrar.register(server.url("/register"), "Test Client", "https://app.example.com/cb", "read",
				List.of("ops@example.com")).block();

		JsonNode body = objectMapper.readTree(server.requests("/register").get(0).body());
		assertThat(body.get("contacts").get(0).asText()).isEqualTo("ops@example.com");
	}

	@Test
	void htmlResponseIsExplained() {
		server.respond("/register", 200, "text/html; charset=utf-8", "<html><form>Sign in</form></html>");

		StepVerifier.create(registrar.register(server.url("/register"), "Test Client", "https://app/cb", "read", null))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(RegistrationException.class);
				RegistrationException registrationError = (RegistrationException) error;
				assertThat(registrationError.isHtmlResponse()).isTrue();
				assertThat(registrationError.getMessage())
					.startsWith("Registration endpoint responded with HTML instead of JSON.")
					.contains("Body preview: <html><form>Sign in</form></html>");
			})
			.verify();
	}

	@Test
	void invalidJsonIsReported() {
		server.respond("/register", 201, "application/json", "{client_id:");

		StepVerifier.create(registrar.register(server.url("/register"), "Test Client", "https://app/cb", "read", null))
			.expectErrorSatisfies(error -> {
				assertThat(error.getMessage()).startsWith("Registration endpoint returned invalid JSON");
				assertThat(((RegistrationException) error).isHtmlResponse()).isFalse();
			})
			.verify();
	}

	@Test
	void forbiddenAsksToSignIn() {
		server.respond("/register", 403, "application/json", "{\"error\":\"access_denied\"}");

		StepVerifier.create(registrar.register(server.url("/register"), "Test Client", "https://app/cb", "read", null))
			.expectErrorSatisfies(error -> {
				RegistrationException registrationError = (RegistrationException) error;
				assertThat(registrationError.getStatusCode()).isEqualTo(403);
				assertThat(registrationError.getReasonPhrase()).isEqualTo("Forbidden");
				assertThat(registrationError.getMessage()).contains("403 Forbidden")
					.contains("access_denied")
					.endsWith("Sign in before registering a new OAuth application.");
			})
			.verify();
	}

	@Test
	void longErrorBodyIsCut() {
		server.respond("/register", 400, "text/plain", "x".repeat(400));

		StepVerifier.create(registrar.register(server.url("/register"), "Test Client", "https://app/cb", "read", null))
			.expectErrorSatisfies(error -> {
				RegistrationException registrationError = (RegistrationException) error;
				assertThat(registrationError.getBodySnippet()).hasSize(151).endsWith("…");
				assertThat(registrationError.getMessage()).doesNotContain("Sign in");
			})
			.verify();
	}

	@Test
	void responseWithoutClientIdIsRejected() {
		server.respond("/register", 201, "application/json", "{\"client_name\":\"Test Client\"}");

		StepVerifier.create(registrar.register(server.url("/register"), "Test Client", "https://app/cb", "read", null))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(RegistrationException.class)
				.hasMessageContaining("client_id"))
			.verify();
	}

	@Test
	void registrationIsNotRetried() {
		server.respond("/register", 500, "text/plain", "boom");

		StepVerifier.create(registrar.register(server.url("/register"), "Test Client", "https://app/cb", "read", null))
			.expectError(RegistrationException.class)
			.verify();

		assertThat(server.requests("/register")).hasSize(1);
	}

}
