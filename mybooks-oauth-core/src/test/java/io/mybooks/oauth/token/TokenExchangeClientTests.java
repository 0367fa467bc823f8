/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.token;

import java.net.http.HttpClient;
import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.mybooks.oauth.MockOAuthServer;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class TokenExchangeClientTests {

	private MockOAuthServer server;

	@BeforeEach
	void setUp() throws Exception {
		server = new MockOAuthServer();
	}

	@AfterEach
	void tearDown() {
		server.close();
	}

	private TokenExchangeClient client(boolean forwardState) {
		return new TokenExchangeClient(HttpClient.newHttpClient(), new ObjectMapper(), Duration.ofSeconds(5),
				forwardState);
	}

	@Test
	void exchangesCodeWithFormBodyInProtocolOrder() {
		server.respondJson("/token", "{\"access_token\":\"tok_1\",\"token_type\":\"Bearer\",\"expires_in\":3600,"
				+ "\"refresh_token\":\"ref_1\",\"id_token\":\"idt\"}");

		StepVerifier
			.create(client(false).exchangeAuthorizationCode(server.url("/token"), "xyz", "https://app.example.com/cb",
					"abc123", "VERIFIER", "state-1"))
			.assertNext(token -> {
				assertThat(token.accessToken()).isEqualTo("tok_1");
				assertThat(token.tokenType()).isEqualTo("Bearer");
				assertThat(token.expiresIn()).isEqualTo(3600L);
				assertThat(token.refreshToken()).isEqualTo("ref_1");
				assertThat(token.additionalParameters()).containsEntry("id_token", "idt");
				assertThat(token.toString()).doesNotContain("tok_1", "ref_1");
			})
			.verifyComplete();

		MockOAuthServer.RecordedRequest request = server.requests("/token").get(0);
		assertThat(request.body()).isEqualTo("grant_type=authorization_code&code=xyz"
				+ "&redirect_uri=https%3A%2F%2Fapp.example.com%2Fcb&client_id=abc123&code_verifier=VERIFIER");
		assertThat(request.header("Content-Type")).isEqualTo("application/x-www-form-urlencoded");
		assertThat(request.header("Cache-Control")).isEqualTo("no-cache");
	}

	@Test
	void stateIsForwardedOnlyWhenEnabled() {
		server.respondJson("/token", "{\"access_token\":\"tok_1\"}");

		client(true).exchangeAuthorizationCode(server.url("/token"), "xyz", "https://app/cb", "abc123", "V", "s-1")
			.block();

		assertThat(server.requests("/token").get(0).body()).endsWith("&code_verifier=V&state=s-1");
	}

	@Test
	void refreshUsesRefreshTokenGrant() {
		server.respondJson("/token", "{\"access_token\":\"tok_2\"}");

		StepVerifier.create(client(false).refresh(server.url("/token"), "ref_1", "abc123", "read write"))
			.assertNext(token -> assertThat(token.accessToken()).isEqualTo("tok_2"))
			.verifyComplete();

		assertThat(server.requests("/token").get(0).body())
			.isEqualTo("grant_type=refresh_token&refresh_token=ref_1&client_id=abc123&scope=read+write");
	}

	@Test
	void rejectedExchangeCarriesOAuthError() {
		server.respond("/token", 400, "application/json",
				"{\"error\":\"invalid_grant\",\"error_description\":\"code expired\"}");

		StepVerifier
			.create(client(false).exchangeAuthorizationCode(server.url("/token"), "xyz", "https://app/cb", "abc123",
					"V", null))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(TokenExchangeException.class);
				TokenExchangeException exchangeError = (TokenExchangeException) error;
				assertThat(exchangeError.getStatusCode()).isEqualTo(400);
				assertThat(exchangeError.getReasonPhrase()).isEqualTo("Bad Request");
				assertThat(exchangeError.getError()).isEqualTo("invalid_grant");
				assertThat(exchangeError.getErrorDescription()).isEqualTo("code expired");
				assertThat(exchangeError.getMessage()).contains("400 Bad Request (invalid_grant: code expired)");
			})
			.verify();
	}

	@Test
	void errorBodyIsTruncated() {
		server.respond("/token", 500, "text/plain", "e".repeat(2000));

		StepVerifier
			.create(client(false).exchangeAuthorizationCode(server.url("/token"), "xyz", "https://app/cb", "abc123",
					"V", null))
			.expectErrorSatisfies(error -> {
				TokenExchangeException exchangeError = (TokenExchangeException) error;
				assertThat(exchangeError.getBody()).hasSize(501);
				assertThat(exchangeError.getError()).isNull();
			})
			.verify();
	}

	@Test
	void successWithoutJsonObjectIsRejected() {
		server.respond("/token", 200, "text/plain", "ok");

		StepVerifier
			.create(client(false).exchangeAuthorizationCode(server.url("/token"), "xyz", "https://app/cb", "abc123",
					"V", null))
			.expectErrorSatisfies(error -> assertThat(((TokenExchangeException) error).getStatusCode()).isEqualTo(200))
			.verify();
	}

	@Test
	void transportFailureHasNoStatus() {
		String url = server.url("/token");
		server.close();

		StepVerifier
			.create(client(false).exchangeAuthorizationCode(url, "xyz", "https://app/cb", "abc123", "V", null))
			.expectErrorSatisfies(error -> {
				assertThat(((TokenExchangeException) error).getStatusCode()).isEqualTo(TokenExchangeException.NO_STATUS);
				assertThat(error.getCause()).isNotNull();
			})
			.verify();
	}

	@Test
	void slowTokenEndpointTimesOut() {
		server.respondJson("/token", "{\"access_token\":\"tok_1\"}").delay("/token", Duration.ofSeconds(2));
		TokenExchangeClient client = new TokenExchangeClient(HttpClient.newHttpClient(), new ObjectMapper(),
				Duration.ofMillis(200), false);

		StepVerifier.create(client.exchangeAuthorizationCode(server.url("/token"), "xyz", "https://app/cb", "abc123",
				"V", null))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(TokenExchangeException.class).hasMessageContaining("timed out");
				assertThat(((TokenExchangeException) error).getStatusCode()).isEqualTo(TokenExchangeException.NO_STATUS);
			})
			.verify(Duration.ofSeconds(5));
	}

}
