/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.store;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * Partial update of {@link AppCredentials}. Only the fields set on the builder change;
 * setting a field to {@code null} clears it, leaving it unset keeps the stored value.
 *
 * <pre>{@code
 * CredentialUpdate update = CredentialUpdate.builder()
 *     .oauthAccessToken(token.accessToken())
 *     .oauthRefreshToken(token.refreshToken())
 *     .build();
 * }</pre>
 */
public final class CredentialUpdate {

	enum Field {

		USER_ACCESS_TOKEN, USER_REFRESH_TOKEN, CLIENT_ID, CLIENT_NAME, CLIENT_REDIRECT_URIS, OAUTH_ACCESS_TOKEN,
		OAUTH_REFRESH_TOKEN, REGISTRATION_ACCESS_TOKEN, REGISTRATION_CLIENT_URI, REGISTRATION_CLIENT_PAYLOAD

	}

	private final Map<Field, Object> values;

	private CredentialUpdate(Map<Field, Object> values) {
		this.values = values;
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean isEmpty() {
		return values.isEmpty();
	}

	boolean isSet(Field field) {
		return values.containsKey(field);
	}

	/**
	 * Apply this update to the current credentials.
	 * @param current the stored credentials
	 * @return the merged credentials
	 */
	public AppCredentials applyTo(AppCredentials current) {
		return new AppCredentials(pick(Field.USER_ACCESS_TOKEN, current.userAccessToken()),
				pick(Field.USER_REFRESH_TOKEN, current.userRefreshToken()), pick(Field.CLIENT_ID, current.clientId()),
				pick(Field.CLIENT_NAME, current.clientName()),
				pick(Field.CLIENT_REDIRECT_URIS, current.clientRedirectUris()),
				pick(Field.OAUTH_ACCESS_TOKEN, current.oauthAccessToken()),
				pick(Field.OAUTH_REFRESH_TOKEN, current.oauthRefreshToken()),
				pick(Field.REGISTRATION_ACCESS_TOKEN, current.registrationAccessToken()),
				pick(Field.REGISTRATION_CLIENT_URI, current.registrationClientUri()),
				pick(Field.REGISTRATION_CLIENT_PAYLOAD, current.registrationClientPayload()));
	}

	@SuppressWarnings("unchecked")
	private <T> T pick(Field field, T currentValue) {
		return values.containsKey(field) ? (T) values.get(field) : currentValue;
	}

	@Override
	public String toString() {
		return "CredentialUpdate" + values.keySet();
	}

	public static final class Builder {

		private final Map<Field, Object> values = new EnumMap<>(Field.class);

		private Builder() {
		}

		public Builder userAccessToken(@Nullable String userAccessToken) {
			values.put(Field.USER_ACCESS_TOKEN, userAccessToken);
			return this;
		}

		public Builder userRefreshToken(@Nullable String userRefreshToken) {
			values.put(Field.USER_REFRESH_TOKEN, userRefreshToken);
			return this;
		}

		public Builder clientId(@Nullable String clientId) {
			values.put(Field.CLIENT_ID, clientId);
			return this;
		}

		public Builder clientName(@Nullable String clientName) {
			values.put(Field.CLIENT_NAME, clientName);
			return this;
		}

		public Builder clientRedirectUris(@Nullable List<String> clientRedirectUris) {
			values.put(Field.CLIENT_REDIRECT_URIS, clientRedirectUris);
			return this;
		}

		public Builder oauthAccessToken(@Nullable String oauthAccessToken) {
			values.put(Field.OAUTH_ACCESS_TOKEN, oauthAccessToken);
			return this;
		}

		public Builder oauthRefreshToken(@Nullable String oauthRefreshToken) {
			values.put(Field.OAUTH_REFRESH_TOKEN, oauthRefreshToken);
			return this;
		}

		public Builder registrationAccessToken(@Nullable String registrationAccessToken) {
			values.put(Field.REGISTRATION_ACCESS_TOKEN, registrationAccessToken);
			return this;
		}

		public Builder registrationClientUri(@Nullable String registrationClientUri) {
			values.put(Field.REGISTRATION_CLIENT_URI, registrationClientUri);
			return this;
		}

		public Builder registrationClientPayload(@Nullable Map<String, Object> registrationClientPayload) {
			values.put(Field.REGISTRATION_CLIENT_PAYLOAD, registrationClientPayload);
			return this;
		}

		public CredentialUpdate build() {
			return new CredentialUpdate(new EnumMap<>(values));
		}

	}

}
