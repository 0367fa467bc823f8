/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.client;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mybooks.oauth.OAuthClientSettings;
import io.mybooks.oauth.discovery.DiscoveryException;
import io.mybooks.oauth.discovery.MetadataDiscoverer;
import io.mybooks.oauth.flow.AuthorizationFlow;
import io.mybooks.oauth.flow.AuthorizationFlowManager;
import io.mybooks.oauth.flow.FlowException;
import io.mybooks.oauth.flow.FlowType;
import io.mybooks.oauth.http.OAuthHttpClients;
import io.mybooks.oauth.metadata.OAuthMetadata;
import io.mybooks.oauth.registration.ClientRegistration;
import io.mybooks.oauth.registration.DynamicClientRegistrar;
import io.mybooks.oauth.store.AppCredentials;
import io.mybooks.oauth.store.CredentialStore;
import io.mybooks.oauth.store.CredentialUpdate;
import io.mybooks.oauth.store.FileCredentialStore;
import io.mybooks.oauth.store.FileFlowStateStore;
import io.mybooks.oauth.store.FlowStateStore;
import io.mybooks.oauth.store.InMemoryCredentialStore;
import io.mybooks.oauth.store.InMemoryFlowStateStore;
import io.mybooks.oauth.token.OAuthToken;
import io.mybooks.oauth.token.TokenExchangeClient;
import io.mybooks.oauth.util.Assert;
import io.mybooks.oauth.util.Utils;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * OAuth client state of one logical user: discovered metadata, the registered client,
 * pending authorization flows and the resulting tokens.
 *
 * <p>
 * A session holds no process-wide state; create one per user with
 * {@link #builder(OAuthClientSettings)}. Flow state and credentials live in the
 * configured stores, so a callback may be handled by a different session instance
 * sharing those stores.
 *
 * <pre>{@code
 * OAuthClientSession session = OAuthClientSession.builder(settings)
 *     .userKey("alice")
 *     .storageDirectory(Path.of(".oauth"))
 *     .build();
 *
 * session.registerClient(null).block();
 * String url = session.authorizationUrl(FlowType.APP_AUTHORIZE).block();
 * // redirect the browser to url, then on the callback:
 * AppCredentials credentials = session.handleCallback(code, state).block();
 * }</pre>
 */
public class OAuthClientSession {

	private static final Logger logger = LoggerFactory.getLogger(OAuthClientSession.class);

	private final OAuthClientSettings settings;

	private final String userKey;

	private final MetadataDiscoverer discoverer;

	private final DynamicClientRegistrar registrar;

	private final TokenExchangeClient tokenClient;

	private final AuthorizationFlowManager flows;

	private final CredentialStore credentialStore;

	private final AtomicReference<OAuthMetadata> metadata = new AtomicReference<>();

	OAuthClientSession(Builder builder) {
		this.settings = builder.settings;
		this.userKey = builder.userKey;
		this.discoverer = builder.discoverer;
		this.registrar = builder.registrar;
		this.tokenClient = builder.tokenClient;
		this.flows = new AuthorizationFlowManager(builder.flowStateStore, builder.tokenClient);
		this.credentialStore = builder.credentialStore;
	}

	public static Builder builder(OAuthClientSettings settings) {
		return new Builder(settings);
	}

	public OAuthClientSettings getSettings() {
		return settings;
	}

	public String getUserKey() {
		return userKey;
	}

	public AuthorizationFlowManager getFlows() {
		return flows;
	}

	/**
	 * The stored credentials of this session's user.
	 * @return the credentials
	 */
	public AppCredentials credentials() {
		return credentialStore.load(userKey);
	}

	/**
	 * Metadata of the configured server, discovered on first use.
	 * @return the metadata
	 */
	public Mono<OAuthMetadata> metadata() {
		return metadata(null, false);
	}

	/**
	 * Metadata of the configured server. A {@code WWW-Authenticate} header from a 401
	 * response, or {@code force}, triggers a fresh discovery.
	 * @param wwwAuthenticate the header of a 401 response, if one was received
	 * @param force discover again even when metadata is known
	 * @return the metadata
	 */
	public Mono<OAuthMetadata> metadata(@Nullable String wwwAuthenticate, boolean force) {
		return Mono.defer(() -> {
			OAuthMetadata current = metadata.get();
			if (current != null && !force && wwwAuthenticate == null) {
				return Mono.just(current);
			}
			Mono<OAuthMetadata> discovery = wwwAuthenticate != null
					? discoverer.discover(settings.getServerUrl(), wwwAuthenticate)
					: discoverer.discover(settings.getServerUrl(), force);
			return discovery.doOnNext(metadata::set);
		});
	}

	/**
	 * Register a client with the discovered registration endpoint and store it. Tokens
	 * of a previously registered client are cleared.
	 * @param clientName the client name, the configured one when {@code null}
	 * @return the updated credentials
	 */
	public Mono<AppCredentials> registerClient(@Nullable String clientName) {
		String name = Utils.hasText(clientName) ? clientName.strip() : settings.getClientName();
		return metadata().flatMap(current -> {
			String registrationEndpoint = current.registrationEndpoint()
				.orElseThrow(() -> new DiscoveryException(DiscoveryException.Reason.MISSING_FIELD,
						current.authorizationServerMetadataUrl(),
						"Authorization server does not advertise a registration_endpoint."));
			return registrar.register(registrationEndpoint, name, settings.getRedirectUri(), settings.getScope(),
					List.of());
		}).map(this::storeRegistration);
	}

	private AppCredentials storeRegistration(ClientRegistration registration) {
		List<String> redirectUris = registration.redirectUris().isEmpty() ? List.of(settings.getRedirectUri())
				: registration.redirectUris();
		String clientName = registration.clientName() != null ? registration.clientName() : settings.getClientName();
		return credentialStore.update(userKey,
				CredentialUpdate.builder()
					.clientId(registration.clientId())
					.clientName(clientName)
					.clientRedirectUris(redirectUris)
					.registrationAccessToken(registration.registrationAccessToken())
					.registrationClientUri(registration.registrationClientUri())
					.registrationClientPayload(registration.payload())
					.oauthAccessToken(null)
					.oauthRefreshToken(null)
					.build());
	}

	/**
	 * The authorization URL for a flow, reusing the PKCE material of a pending flow of
	 * the same type.
	 * @param flowType the flow
	 * @return the URL to send the user agent to
	 */
	public Mono<String> authorizationUrl(FlowType flowType) {
		Assert.notNull(flowType, "flowType must not be null");
		return metadata().map(current -> {
			String clientId = credentials().clientId();
			if (!Utils.hasText(clientId)) {
				throw new FlowException(FlowException.Reason.CLIENT_ID_MISSING,
						"Register an OAuth client before starting the " + flowType.value() + " flow.");
			}
			return flows.start(flowType, new AuthorizationFlow.StartRequest(clientId, settings.getScope(),
					settings.getRedirectUri(), current.authorizationEndpoint(), true));
		});
	}

	/**
	 * Handle the redirect back from the authorization endpoint.
	 * @param code the {@code code} query parameter
	 * @param state the {@code state} query parameter
	 * @return the updated credentials; empty when there is no code
	 */
	public Mono<AppCredentials> handleCallback(@Nullable String code, @Nullable String state) {
		return Mono.defer(() -> {
			if (!Utils.hasText(code)) {
				return Mono.empty();
			}
			if (!Utils.hasText(state)) {
				flows.clearAll();
				return Mono.error(new FlowException(FlowException.Reason.CALLBACK_STATE_MISSING,
						"OAuth callback missing state; restart the flow."));
			}
			FlowType flowType = flows.findFlowByState(state).orElse(null);
			if (flowType == null) {
				flows.clearAll();
				return Mono.error(new FlowException(FlowException.Reason.NO_ACTIVE_FLOW,
						"Received OAuth callback without an active flow. Start over."));
			}
			return metadata()
				.flatMap(current -> flows.complete(flowType,
						new AuthorizationFlow.CompleteRequest(code, state, current.tokenEndpoint())))
				.map(token -> storeTokens(flowType, token));
		});
	}

	private AppCredentials storeTokens(FlowType flowType, OAuthToken token) {
		if (!token.hasAccessToken()) {
			throw new FlowException(FlowException.Reason.ACCESS_TOKEN_MISSING,
					"Token response missing access token; restart the flow.");
		}
		CredentialUpdate.Builder update = CredentialUpdate.builder();
		if (flowType == FlowType.USER_LOGIN) {
			update.userAccessToken(token.accessToken()).userRefreshToken(token.refreshToken());
		}
		else {
			update.oauthAccessToken(token.accessToken()).oauthRefreshToken(token.refreshToken());
		}
		AppCredentials updated = credentialStore.update(userKey, update.build());
		logger.info("Stored tokens of the {} flow for {}", flowType.value(), userKey);
		return updated;
	}

	/**
	 * Obtain a new access token for the registered client with the stored refresh
	 * token. A response without a refresh token keeps the stored one.
	 * @return the updated credentials
	 */
	public Mono<AppCredentials> refreshAppToken() {
		return Mono.defer(() -> {
			AppCredentials current = credentials();
			if (!Utils.hasText(current.clientId())) {
				return Mono.error(new FlowException(FlowException.Reason.CLIENT_ID_MISSING,
						"No registered OAuth client to refresh tokens for."));
			}
			if (!Utils.hasText(current.oauthRefreshToken())) {
				return Mono.error(new FlowException(FlowException.Reason.REFRESH_TOKEN_MISSING,
						"No refresh token stored; authorize the client again."));
			}
			return metadata()
				.flatMap(md -> tokenClient.refresh(md.tokenEndpoint(), current.oauthRefreshToken(),
						current.clientId(), settings.getScope()))
				.map(token -> {
					if (!token.hasAccessToken()) {
						throw new FlowException(FlowException.Reason.ACCESS_TOKEN_MISSING,
								"Token response missing access token; authorize the client again.");
					}
					CredentialUpdate.Builder update = CredentialUpdate.builder()
						.oauthAccessToken(token.accessToken());
					if (Utils.hasText(token.refreshToken())) {
						update.oauthRefreshToken(token.refreshToken());
					}
					return credentialStore.update(userKey, update.build());
				});
		});
	}

	/**
	 * Clear the tokens of the registered client and its pending flow.
	 * @param clearRegistration also forget the registered client
	 * @return the updated credentials
	 */
	public AppCredentials resetAuthorization(boolean clearRegistration) {
		CredentialUpdate.Builder update = CredentialUpdate.builder().oauthAccessToken(null).oauthRefreshToken(null);
		if (clearRegistration) {
			update.clientId(null)
				.clientName(null)
				.clientRedirectUris(null)
				.registrationAccessToken(null)
				.registrationClientUri(null)
				.registrationClientPayload(null);
		}
		AppCredentials updated = credentialStore.update(userKey, update.build());
		flows.clear(FlowType.APP_AUTHORIZE);
		logger.info("Cleared authorization of {} (registration cleared: {})", userKey, clearRegistration);
		return updated;
	}

	/**
	 * Abandon every pending flow and delete the stored credentials.
	 */
	public void signOut() {
		flows.clearAll();
		credentialStore.delete(userKey);
		logger.info("Signed out {}", userKey);
	}

	/**
	 * Builder for {@link OAuthClientSession}. Components not set explicitly are created
	 * from the settings; stores default to memory unless a storage directory is given.
	 */
	public static final class Builder {

		private final OAuthClientSettings settings;

		private String userKey = "default";

		private ObjectMapper objectMapper;

		private MetadataDiscoverer discoverer;

		private DynamicClientRegistrar registrar;

		private TokenExchangeClient tokenClient;

		private FlowStateStore flowStateStore;

		private CredentialStore credentialStore;

		private Path storageDirectory;

		private Builder(OAuthClientSettings settings) {
			Assert.notNull(settings, "settings must not be null");
			this.settings = settings;
		}

		public Builder userKey(String userKey) {
			Assert.hasText(userKey, "userKey must not be empty");
			this.userKey = userKey;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder discoverer(MetadataDiscoverer discoverer) {
			this.discoverer = discoverer;
			return this;
		}

		public Builder registrar(DynamicClientRegistrar registrar) {
			this.registrar = registrar;
			return this;
		}

		public Builder tokenClient(TokenExchangeClient tokenClient) {
			this.tokenClient = tokenClient;
			return this;
		}

		public Builder flowStateStore(FlowStateStore flowStateStore) {
			this.flowStateStore = flowStateStore;
			return this;
		}

		public Builder credentialStore(CredentialStore credentialStore) {
			this.credentialStore = credentialStore;
			return this;
		}

		/**
		 * Keep flow state and credentials as files in this directory, namespaced by
		 * the user key. Ignored for a store set explicitly.
		 * @param storageDirectory the directory
		 * @return this builder
		 */
		public Builder storageDirectory(Path storageDirectory) {
			this.storageDirectory = storageDirectory;
			return this;
		}

		public OAuthClientSession build() {
			ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper();
			if (discoverer == null || registrar == null || tokenClient == null) {
				HttpClient httpClient = OAuthHttpClients.create(settings);
				if (discoverer == null) {
					discoverer = new MetadataDiscoverer(httpClient, mapper, settings.getRequestTimeout());
				}
				if (registrar == null) {
					registrar = new DynamicClientRegistrar(httpClient, mapper, settings.getRequestTimeout());
				}
				if (tokenClient == null) {
					tokenClient = new TokenExchangeClient(httpClient, mapper, settings.getRequestTimeout(),
							settings.isForwardStateToTokenEndpoint());
				}
			}
			if (flowStateStore == null) {
				flowStateStore = storageDirectory != null ? new FileFlowStateStore(storageDirectory, userKey, mapper)
						: new InMemoryFlowStateStore();
			}
			if (credentialStore == null) {
				credentialStore = storageDirectory != null ? new FileCredentialStore(storageDirectory, mapper)
						: new InMemoryCredentialStore();
			}
			return new OAuthClientSession(this);
		}

	}

}
