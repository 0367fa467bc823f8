/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.registration;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.mybooks.oauth.util.Assert;

/**
 * RFC 7591 client registration request for a public client using the authorization
 * code grant with PKCE.
 *
 * @param clientName human readable client name
 * @param redirectUris redirect URIs, exactly the one the flow will use
 * @param grantTypes {@code authorization_code} and {@code refresh_token}
 * @param responseTypes {@code code}
 * @param scope space-delimited scopes
 * @param tokenEndpointAuthMethod {@code none}
 * @param contacts optional contact addresses, omitted when empty
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ClientRegistrationRequest(@JsonProperty("client_name") String clientName,
		@JsonProperty("redirect_uris") List<String> redirectUris, @JsonProperty("grant_types") List<String> grantTypes,
		@JsonProperty("response_types") List<String> responseTypes, @JsonProperty("scope") String scope,
		@JsonProperty("token_endpoint_auth_method") String tokenEndpointAuthMethod,
		@JsonProperty("contacts") List<String> contacts) {

	public static final List<String> GRANT_TYPES = List.of("authorization_code", "refresh_token");

	public static final List<String> RESPONSE_TYPES = List.of("code");

	public static final String AUTH_METHOD_NONE = "none";

	public ClientRegistrationRequest {
		Assert.hasText(clientName, "clientName must not be empty");
		Assert.notEmpty(redirectUris, "redirectUris must not be empty");
		Assert.hasText(scope, "scope must not be empty");
		contacts = contacts == null ? List.of() : List.copyOf(contacts);
	}

	public static ClientRegistrationRequest publicClient(String clientName, String redirectUri, String scope) {
		return publicClient(clientName, redirectUri, scope, List.of());
	}

	public static ClientRegistrationRequest publicClient(String clientName, String redirectUri, String scope,
			List<String> contacts) {
		Assert.hasText(redirectUri, "redirectUri must not be empty");
		return new ClientRegistrationRequest(clientName, List.of(redirectUri), GRANT_TYPES, RESPONSE_TYPES, scope,
				AUTH_METHOD_NONE, contacts);
	}

}
