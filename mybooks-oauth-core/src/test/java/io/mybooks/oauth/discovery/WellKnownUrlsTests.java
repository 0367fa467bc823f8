/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.discovery;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WellKnownUrlsTests {

	@Test
	void authorizationServerWithPathTriesPathAwareCandidatesFirst() {
		assertThat(WellKnownUrls.authorizationServer("https://auth.example.com/tenant/one/")).containsExactly(
				"https://auth.example.com/.well-known/oauth-authorization-server/tenant/one",
				"https://auth.example.com/.well-known/openid-configuration/tenant/one",
				"https://auth.example.com/tenant/one/.well-known/openid-configuration",
				"https://auth.example.com/.well-known/oauth-authorization-server",
				"https://auth.example.com/.well-known/openid-configuration");
	}

	@Test
	void authorizationServerWithoutPathTriesRootCandidatesOnly() {
		assertThat(WellKnownUrls.authorizationServer("https://auth.example.com")).containsExactly(
				"https://auth.example.com/.well-known/oauth-authorization-server",
				"https://auth.example.com/.well-known/openid-configuration");
	}

	@Test
	void protectedResourceKeepsPortAndPath() {
		assertThat(WellKnownUrls.protectedResource("http://localhost:8080/mcp")).containsExactly(
				"http://localhost:8080/.well-known/oauth-protected-resource/mcp",
				"http://localhost:8080/.well-known/oauth-protected-resource");
	}

	@Test
	void hintsComeBeforeResourceCandidatesWithoutDuplicates() {
		List<String> candidates = WellKnownUrls.authorizationServer(
				List.of("https://login.example.com/.well-known/openid-configuration", "https://api.example.com"),
				"https://api.example.com/mcp");

		assertThat(candidates).containsExactly("https://login.example.com/.well-known/openid-configuration",
				"https://api.example.com/.well-known/oauth-authorization-server",
				"https://api.example.com/.well-known/openid-configuration",
				"https://api.example.com/.well-known/oauth-authorization-server/mcp",
				"https://api.example.com/.well-known/openid-configuration/mcp",
				"https://api.example.com/mcp/.well-known/openid-configuration");
	}

	@Test
	void hintWithPathTriesAppendedDocumentsBeforePathInsertion() {
		assertThat(WellKnownUrls.authorizationServerHints(List.of("https://host.example.com/mybooks/")))
			.containsExactly("https://host.example.com/mybooks/.well-known/oauth-authorization-server",
					"https://host.example.com/mybooks/.well-known/openid-configuration",
					"https://host.example.com/.well-known/oauth-authorization-server/mybooks",
					"https://host.example.com/.well-known/openid-configuration/mybooks",
					"https://host.example.com/.well-known/oauth-authorization-server",
					"https://host.example.com/.well-known/openid-configuration");
	}

	@Test
	void invalidHintsAreSkipped() {
		assertThat(WellKnownUrls.authorizationServerHints(List.of("not a url", " ", "https://a.example.com")))
			.containsExactly("https://a.example.com/.well-known/oauth-authorization-server",
					"https://a.example.com/.well-known/openid-configuration");
	}

	@Test
	void relativeUrlIsRejected() {
		assertThatThrownBy(() -> WellKnownUrls.authorizationServer("/only/a/path"))
			.isInstanceOfSatisfying(DiscoveryException.class,
					e -> assertThat(e.getReason()).isEqualTo(DiscoveryException.Reason.INVALID_URL));
	}

}
