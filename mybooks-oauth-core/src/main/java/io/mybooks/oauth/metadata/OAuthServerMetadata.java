/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.metadata;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * RFC 8414 OAuth 2.0 Authorization Server Metadata, reduced to the members the client
 * uses. See https://datatracker.ietf.org/doc/html/rfc8414#section-2
 *
 * @param issuer the authorization server issuer identifier
 * @param authorizationEndpoint URL of the authorization endpoint
 * @param tokenEndpoint URL of the token endpoint
 * @param registrationEndpoint URL of the RFC 7591 registration endpoint, may be null
 * @param revocationEndpoint URL of the RFC 7009 revocation endpoint, may be null
 * @param introspectionEndpoint URL of the RFC 7662 introspection endpoint, may be null
 * @param scopesSupported advertised scopes, never null
 * @param grantTypesSupported advertised grant types, never null
 * @param codeChallengeMethodsSupported advertised PKCE methods, never null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OAuthServerMetadata(@JsonProperty("issuer") String issuer,
		@JsonProperty("authorization_endpoint") String authorizationEndpoint,
		@JsonProperty("token_endpoint") String tokenEndpoint,
		@JsonProperty("registration_endpoint") String registrationEndpoint,
		@JsonProperty("revocation_endpoint") String revocationEndpoint,
		@JsonProperty("introspection_endpoint") String introspectionEndpoint,
		@JsonProperty("scopes_supported") List<String> scopesSupported,
		@JsonProperty("grant_types_supported") List<String> grantTypesSupported,
		@JsonProperty("code_challenge_methods_supported") List<String> codeChallengeMethodsSupported) {

	public OAuthServerMetadata {
		scopesSupported = scopesSupported != null ? List.copyOf(scopesSupported) : List.of();
		grantTypesSupported = grantTypesSupported != null ? List.copyOf(grantTypesSupported) : List.of();
		codeChallengeMethodsSupported = codeChallengeMethodsSupported != null
				? List.copyOf(codeChallengeMethodsSupported) : List.of();
	}

	public boolean supportsRegistration() {
		return registrationEndpoint != null;
	}

}
