/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.discovery;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

import io.mybooks.oauth.metadata.OAuthProtectedResourceMetadata;
import io.mybooks.oauth.metadata.OAuthServerMetadata;
import reactor.util.annotation.Nullable;

/**
 * Validating conversion of metadata JSON documents. String members are trimmed, blank
 * optional members become {@code null} and array members keep their non-blank string
 * items only.
 */
final class MetadataParser {

	private MetadataParser() {
	}

	static OAuthServerMetadata parseServerMetadata(JsonNode document, String url) {
		return new OAuthServerMetadata(requireText(document, "issuer", url),
				requireText(document, "authorization_endpoint", url), requireText(document, "token_endpoint", url),
				optionalText(document, "registration_endpoint"), optionalText(document, "revocation_endpoint"),
				optionalText(document, "introspection_endpoint"), stringList(document.get("scopes_supported")),
				stringList(document.get("grant_types_supported")),
				stringList(document.get("code_challenge_methods_supported")));
	}

	static OAuthProtectedResourceMetadata parseProtectedResourceMetadata(JsonNode document, String url) {
		String issuer = requireText(document, "issuer", url);

		JsonNode serversNode = document.get("authorization_servers");
		if (serversNode == null || !serversNode.isArray()) {
			throw new DiscoveryException(DiscoveryException.Reason.MISSING_FIELD, url,
					"OAuth protected metadata field 'authorization_servers' must be an array (" + url + ").");
		}
		List<String> authorizationServers = stringList(serversNode);
		if (authorizationServers.isEmpty()) {
			throw new DiscoveryException(DiscoveryException.Reason.MISSING_FIELD, url,
					"OAuth protected metadata did not include any authorization servers (" + url + ").");
		}

		List<String> bearerMethods = stringList(document.get("bearer_methods_supported"));
		List<String> scopes = stringList(document.get("scopes_supported"));

		return new OAuthProtectedResourceMetadata(issuer, authorizationServers, optionalText(document, "resource"),
				optionalText(document, "resource_name"), optionalText(document, "resource_documentation"),
				bearerMethods.isEmpty() ? null : bearerMethods, scopes.isEmpty() ? null : scopes);
	}

	private static String requireText(JsonNode document, String field, String url) {
		JsonNode value = document.get(field);
		if (value == null || value.isNull()) {
			throw new DiscoveryException(DiscoveryException.Reason.MISSING_FIELD, url,
					"OAuth metadata missing required field '" + field + "' (" + url + ").");
		}
		String text = value.asText().strip();
		if (text.isEmpty()) {
			throw new DiscoveryException(DiscoveryException.Reason.MISSING_FIELD, url,
					"OAuth metadata field '" + field + "' is empty (" + url + ").");
		}
		return text;
	}

	@Nullable
	private static String optionalText(JsonNode document, String field) {
		JsonNode value = document.get(field);
		if (value == null || value.isNull()) {
			return null;
		}
		String text = value.asText().strip();
		return text.isEmpty() ? null : text;
	}

	private static List<String> stringList(@Nullable JsonNode value) {
		List<String> items = new ArrayList<>();
		if (value == null || !value.isArray()) {
			return items;
		}
		for (JsonNode item : value) {
			String text = item.asText().strip();
			if (!text.isEmpty()) {
				items.add(text);
			}
		}
		return items;
	}

}
