/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.registration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import io.mybooks.oauth.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Decoded registration response. The complete payload is kept so that members this
 * client does not model survive persistence.
 */
public final class ClientRegistration {

	private final Map<String, Object> payload;

	public ClientRegistration(Map<String, Object> payload) {
		Assert.notNull(payload, "payload must not be null");
		Object clientId = payload.get("client_id");
		Assert.isTrue(clientId instanceof String && !((String) clientId).isBlank(), "client_id must not be empty");
		this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
	}

	public String clientId() {
		return (String) payload.get("client_id");
	}

	@Nullable
	public String clientName() {
		return text("client_name");
	}

	public List<String> redirectUris() {
		Object value = payload.get("redirect_uris");
		if (!(value instanceof List<?> list)) {
			return List.of();
		}
		return list.stream().filter(String.class::isInstance).map(String.class::cast).collect(Collectors.toList());
	}

	@Nullable
	public String registrationAccessToken() {
		return text("registration_access_token");
	}

	@Nullable
	public String registrationClientUri() {
		return text("registration_client_uri");
	}

	public Map<String, Object> payload() {
		return payload;
	}

	@Nullable
	private String text(String name) {
		Object value = payload.get(name);
		return value instanceof String ? (String) value : null;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof ClientRegistration other && payload.equals(other.payload);
	}

	@Override
	public int hashCode() {
		return payload.hashCode();
	}

	@Override
	public String toString() {
		return "ClientRegistration[clientId=" + clientId() + ", clientName=" + clientName() + "]";
	}

}
