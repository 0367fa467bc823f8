/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.metadata;

import java.util.Optional;

import io.mybooks.oauth.util.Assert;

/**
 * Result of a discovery run: the authorization server metadata, and the protected
 * resource metadata when the resource published one, each with the URL it was read
 * from.
 *
 * @param authorizationServerMetadata the authorization server metadata
 * @param authorizationServerMetadataUrl where it was found
 * @param protectedResourceMetadata the protected resource metadata, may be null
 * @param protectedResourceMetadataUrl where it was found, may be null
 */
public record OAuthMetadata(OAuthServerMetadata authorizationServerMetadata, String authorizationServerMetadataUrl,
		OAuthProtectedResourceMetadata protectedResourceMetadata, String protectedResourceMetadataUrl) {

	public OAuthMetadata {
		Assert.notNull(authorizationServerMetadata, "authorizationServerMetadata must not be null");
		Assert.hasText(authorizationServerMetadataUrl, "authorizationServerMetadataUrl must not be empty");
	}

	public Optional<OAuthProtectedResourceMetadata> protectedResource() {
		return Optional.ofNullable(protectedResourceMetadata);
	}

	public String authorizationEndpoint() {
		return authorizationServerMetadata.authorizationEndpoint();
	}

	public String tokenEndpoint() {
		return authorizationServerMetadata.tokenEndpoint();
	}

	public Optional<String> registrationEndpoint() {
		return Optional.ofNullable(authorizationServerMetadata.registrationEndpoint());
	}

}
