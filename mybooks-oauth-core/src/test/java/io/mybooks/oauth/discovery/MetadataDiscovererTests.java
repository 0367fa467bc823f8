/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.discovery;

import java.net.http.HttpClient;
import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.mybooks.oauth.MockOAuthServer;
import io.mybooks.oauth.metadata.OAuthMetadata;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataDiscovererTests {

	private MockOAuthServer server;

	private MetadataDiscoverer discoverer;

	@BeforeEach
	void setUp() throws Exception {
		server = new MockOAuthServer();
		discoverer = new MetadataDiscoverer(HttpClient.newHttpClient(), new ObjectMapper(), Duration.ofSeconds(5));
	}

	@AfterEach
	void tearDown() {
		server.close();
	}

	@Test
	void fallsThroughPathCandidatesToRootDocument() {
		server.respondJson("/.well-known/oauth-authorization-server", server.serverMetadataJson(""));

		StepVerifier.create(discoverer.discoverAuthorizationServer(server.url("/tenant")))
			.assertNext(document -> {
				assertThat(document.url()).isEqualTo(server.url("/.well-known/oauth-authorization-server"));
				assertThat(document.metadata().tokenEndpoint()).isEqualTo(server.url("/token"));
			})
			.verifyComplete();

		assertThat(server.requestedPaths()).containsExactly("/.well-known/oauth-authorization-server/tenant",
				"/.well-known/openid-configuration/tenant", "/tenant/.well-known/openid-configuration",
				"/.well-known/oauth-authorization-server");
	}

	@Test
	void failsWithNotFoundListingEveryCandidate() {
		StepVerifier.create(discoverer.discoverAuthorizationServer(server.url("/tenant")))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(DiscoveryException.class);
				DiscoveryException discoveryError = (DiscoveryException) error;
				assertThat(discoveryError.getReason()).isEqualTo(DiscoveryException.Reason.NOT_FOUND);
				assertThat(discoveryError.getMessage()).contains("/.well-known/openid-configuration -> 404");
			})
			.verify();

		assertThat(server.requests()).hasSize(5);
	}

	@Test
	void serverErrorsAreReportedAsHttpStatus() {
		server.respond("/.well-known/oauth-authorization-server", 503, "text/plain", "down");

		StepVerifier.create(discoverer.discoverAuthorizationServer(server.baseUrl()))
			.expectErrorSatisfies(error -> assertThat(((DiscoveryException) error).getReason())
				.isEqualTo(DiscoveryException.Reason.HTTP_STATUS))
			.verify();
	}

	@Test
	void invalidJsonStopsDiscovery() {
		server.respond("/.well-known/oauth-authorization-server", 200, "text/html", "<html>login</html>");
		server.respondJson("/.well-known/openid-configuration", server.serverMetadataJson(""));

		StepVerifier.create(discoverer.discoverAuthorizationServer(server.baseUrl()))
			.expectErrorSatisfies(error -> assertThat(((DiscoveryException) error).getReason())
				.isEqualTo(DiscoveryException.Reason.INVALID_JSON))
			.verify();

		assertThat(server.requests("/.well-known/openid-configuration")).isEmpty();
	}

	@Test
	void jsonArrayIsNotAnObject() {
		server.respondJson("/.well-known/oauth-authorization-server", "[]");

		StepVerifier.create(discoverer.discoverAuthorizationServer(server.baseUrl()))
			.expectErrorSatisfies(error -> assertThat(((DiscoveryException) error).getReason())
				.isEqualTo(DiscoveryException.Reason.NOT_AN_OBJECT))
			.verify();
	}

	@Test
	void missingTokenEndpointIsReported() {
		server.respondJson("/.well-known/oauth-authorization-server",
				"{\"issuer\":\"x\",\"authorization_endpoint\":\"https://a/authorize\",\"token_endpoint\":\"  \"}");

		StepVerifier.create(discoverer.discoverAuthorizationServer(server.baseUrl()))
			.expectErrorSatisfies(error -> {
				assertThat(((DiscoveryException) error).getReason())
					.isEqualTo(DiscoveryException.Reason.MISSING_FIELD);
				assertThat(error.getMessage()).contains("token_endpoint");
			})
			.verify();
	}

	@Test
	void unreachableHostIsNetworkFailure() {
		String url = server.baseUrl();
		server.close();

		StepVerifier.create(discoverer.discoverAuthorizationServer(url))
			.expectErrorSatisfies(error -> assertThat(((DiscoveryException) error).getReason())
				.isEqualTo(DiscoveryException.Reason.NETWORK))
			.verify();
	}

	@Test
	void protectedResourceListsAuthorizationServerTriedBeforeHostGuessing() {
		server.respondJson("/.well-known/oauth-protected-resource/mcp", "{\"issuer\":\"" + server.url("/mcp")
				+ "\",\"authorization_servers\":[\"" + server.url("/auth") + "\"],\"resource\":\"" + server.url("/mcp")
				+ "\"}");
		server.respondJson("/.well-known/oauth-authorization-server/auth", server.serverMetadataJson("/auth"));

		StepVerifier.create(discoverer.discover(server.url("/mcp"))).assertNext(metadata -> {
			assertThat(metadata.authorizationServerMetadataUrl())
				.isEqualTo(server.url("/.well-known/oauth-authorization-server/auth"));
			assertThat(metadata.protectedResource()).isPresent();
			assertThat(metadata.protectedResourceMetadataUrl())
				.isEqualTo(server.url("/.well-known/oauth-protected-resource/mcp"));
		}).verifyComplete();
	}

	@Test
	void authorizationServerMountedUnderPathIsFoundFromHint() {
		server.respondJson("/.well-known/oauth-protected-resource/api", "{\"issuer\":\"" + server.url("/api")
				+ "\",\"authorization_servers\":[\"" + server.url("/mybooks/") + "\"]}");
		server.respondJson("/mybooks/.well-known/oauth-authorization-server", server.serverMetadataJson("/mybooks"));

		StepVerifier.create(discoverer.discover(server.url("/api")))
			.assertNext(metadata -> assertThat(metadata.authorizationServerMetadataUrl())
				.isEqualTo(server.url("/mybooks/.well-known/oauth-authorization-server")))
			.verifyComplete();

		assertThat(server.requestedPaths()).containsExactly("/.well-known/oauth-protected-resource/api",
				"/mybooks/.well-known/oauth-authorization-server");
	}

	@Test
	void missingProtectedResourceFallsBackToHostGuessing() {
		server.respondJson("/.well-known/openid-configuration", server.serverMetadataJson(""));

		StepVerifier.create(discoverer.discover(server.url("/mcp"))).assertNext(metadata -> {
			assertThat(metadata.protectedResource()).isEmpty();
			assertThat(metadata.authorizationEndpoint()).isEqualTo(server.url("/authorize"));
		}).verifyComplete();
	}

	@Test
	void discoveryIsCachedPerUrlUntilForced() {
		server.respondJson("/.well-known/oauth-authorization-server", server.serverMetadataJson(""));

		OAuthMetadata first = discoverer.discover(server.baseUrl()).block();
		int requestsAfterFirst = server.requests().size();
		OAuthMetadata second = discoverer.discover(server.baseUrl() + "/").block();

		assertThat(second).isSameAs(first);
		assertThat(server.requests()).hasSize(requestsAfterFirst);
		assertThat(discoverer.cached(server.baseUrl())).contains(first);

		discoverer.discover(server.baseUrl(), true).block();
		assertThat(server.requests()).hasSize(requestsAfterFirst * 2);

		discoverer.evict(server.baseUrl());
		assertThat(discoverer.cached(server.baseUrl())).isEmpty();

		discoverer.discover(server.baseUrl()).block();
		discoverer.discover(server.url("/other")).block();
		assertThat(discoverer.cached(server.url("/other"))).isPresent();

		discoverer.clearCache();
		assertThat(discoverer.cached(server.baseUrl())).isEmpty();
		assertThat(discoverer.cached(server.url("/other"))).isEmpty();
	}

	@Test
	void resourceMetadataFromChallengeIsUsedDirectly() {
		server.respondJson("/custom/prm", "{\"issuer\":\"" + server.url("/mcp") + "\",\"authorization_servers\":[\""
				+ server.url("/.well-known/oauth-authorization-server") + "\"]}");
		server.respondJson("/.well-known/oauth-authorization-server", server.serverMetadataJson(""));

		String challenge = "Bearer resource_metadata=\"" + server.url("/custom/prm") + "\"";

		StepVerifier.create(discoverer.discover(server.url("/mcp"), challenge))
			.assertNext(metadata -> assertThat(metadata.protectedResourceMetadataUrl())
				.isEqualTo(server.url("/custom/prm")))
			.verifyComplete();

		assertThat(server.requestedPaths()).containsExactly("/custom/prm", "/.well-known/oauth-authorization-server");
	}

	@Test
	void failedChallengeFallsBackAndNamesTheChallengeUrl() {
		String challenge = "Bearer resource_metadata=" + server.url("/gone");

		StepVerifier.create(discoverer.discover(server.url("/mcp"), challenge)).expectErrorSatisfies(error -> {
			assertThat(error).isInstanceOf(DiscoveryException.class);
			assertThat(error.getMessage()).contains("tried resource metadata: " + server.url("/gone"));
		}).verify();

		assertThat(server.requestedPaths()).startsWith("/gone", "/.well-known/oauth-protected-resource/mcp");
	}

}
