/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.metadata;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.mybooks.oauth.util.Assert;

/**
 * RFC 9728 OAuth 2.0 Protected Resource Metadata. Used to locate the authorization
 * server when only the resource URL is known.
 *
 * @param issuer issuer identifier
 * @param authorizationServers authorization server URLs, never empty
 * @param resource the protected resource identifier, may be null
 * @param resourceName human readable name, may be null
 * @param resourceDocumentation documentation URL, may be null
 * @param bearerMethodsSupported accepted bearer token methods, may be null
 * @param scopesSupported scopes used by the resource, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OAuthProtectedResourceMetadata(@JsonProperty("issuer") String issuer,
		@JsonProperty("authorization_servers") List<String> authorizationServers,
		@JsonProperty("resource") String resource, @JsonProperty("resource_name") String resourceName,
		@JsonProperty("resource_documentation") String resourceDocumentation,
		@JsonProperty("bearer_methods_supported") List<String> bearerMethodsSupported,
		@JsonProperty("scopes_supported") List<String> scopesSupported) {

	public OAuthProtectedResourceMetadata {
		Assert.notEmpty(authorizationServers, "authorizationServers must not be empty");
		authorizationServers = List.copyOf(authorizationServers);
		bearerMethodsSupported = bearerMethodsSupported != null ? List.copyOf(bearerMethodsSupported) : null;
		scopesSupported = scopesSupported != null ? List.copyOf(scopesSupported) : null;
	}

}
