/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.examples.auth;

import java.awt.Desktop;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mybooks.oauth.OAuthClientSettings;
import io.mybooks.oauth.OAuthException;
import io.mybooks.oauth.client.OAuthClientSession;
import io.mybooks.oauth.flow.FlowType;
import io.mybooks.oauth.metadata.OAuthMetadata;
import io.mybooks.oauth.store.AppCredentials;

/**
 * Command line client that discovers the MyBooks authorization server, registers
 * itself, sends the user through the browser and stores the resulting tokens.
 */
public class AuthorizationCodeExample {

	private static final Logger logger = LoggerFactory.getLogger(AuthorizationCodeExample.class);

	static final Duration CALLBACK_TIMEOUT = Duration.ofMinutes(5);

	private final OAuthClientSession session;

	private final int callbackPort;

	private final Duration callbackTimeout;

	private final PrintStream out;

	public AuthorizationCodeExample(OAuthClientSession session) {
		this(session, Constants.CALLBACK_PORT, CALLBACK_TIMEOUT, System.out);
	}

	AuthorizationCodeExample(OAuthClientSession session, int callbackPort, Duration callbackTimeout,
			PrintStream out) {
		this.session = session;
		this.callbackPort = callbackPort;
		this.callbackTimeout = callbackTimeout;
		this.out = out;
	}

	static OAuthClientSettings settings(Map<String, String> environment) {
		Map<String, String> values = new HashMap<>(environment);
		values.putIfAbsent("MCP_SERVER_URL", Constants.SERVER_URL);
		values.putIfAbsent("OAUTH_REDIRECT_URI", Constants.REDIRECT_URI);
		values.putIfAbsent("OAUTH_SCOPES", Constants.SCOPE);
		values.putIfAbsent("OAUTH_CLIENT_NAME", "MyBooks CLI Example");
		return OAuthClientSettings.fromEnvironment(values);
	}

	/**
	 * Register when needed, then run the authorization code flow once.
	 * @param flowType the flow to run
	 * @throws IOException if the callback listener cannot be started
	 * @throws TimeoutException if the callback does not arrive in time
	 * @throws ExecutionException if the callback listener failed
	 * @throws InterruptedException if interrupted while waiting for the callback
	 */
	public void authorize(FlowType flowType)
			throws IOException, TimeoutException, ExecutionException, InterruptedException {
		try (CallbackListener listener = new CallbackListener(callbackPort, Constants.CALLBACK_PATH)) {
			OAuthMetadata metadata = session.metadata().block();
			out.println("Authorization server: " + metadata.authorizationServerMetadata().issuer());

			if (!session.credentials().appAuthState().isRegistered()) {
				AppCredentials registered = session.registerClient(null).block();
				out.println("Registered client " + registered.clientId());
			}

			String url = session.authorizationUrl(flowType).block();
			openBrowser(url);

			CallbackListener.Callback callback = listener.callback()
				.get(callbackTimeout.toMillis(), TimeUnit.MILLISECONDS);
			if (callback.error() != null) {
				session.getFlows().clear(flowType);
				out.println("Authorization refused: " + callback.error()
						+ (callback.errorDescription() != null ? " (" + callback.errorDescription() + ")" : ""));
				return;
			}
			AppCredentials credentials = session.handleCallback(callback.code(), callback.state()).block();
			out.println("Authorized: " + credentials);
		}
	}

	private void openBrowser(String url) {
		out.println("Opening browser to: " + url);
		try {
			if (Desktop.isDesktopSupported() && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
				Desktop.getDesktop().browse(URI.create(url));
				return;
			}
		}
		catch (Exception e) {
			logger.debug("Could not open a browser", e);
		}
		out.println("Please navigate to the URL above.");
	}

	/**
	 * Runs an interactive command loop until {@code quit} or end of input. A failed
	 * command is reported and the loop continues.
	 * @param reader the console input
	 * @throws IOException if reading the console fails
	 * @throws InterruptedException if interrupted while waiting for a callback
	 */
	public void runInteractiveLoop(BufferedReader reader) throws IOException, InterruptedException {
		out.println("Commands:");
		out.println(" login     - sign in the user");
		out.println(" authorize - authorize the registered client");
		out.println(" refresh   - refresh the client's access token");
		out.println(" status    - show stored credentials");
		out.println(" reset     - forget the client's tokens");
		out.println(" signout   - forget everything");
		out.println(" quit      - exit");

		while (true) {
			out.print("oauth> ");
			String line = reader.readLine();
			if (line == null) {
				break;
			}
			String command = line.trim();
			if (command.isEmpty()) {
				continue;
			}
			if (command.equals("quit")) {
				break;
			}
			try {
				switch (command) {
					case "login" -> authorize(FlowType.USER_LOGIN);
					case "authorize" -> authorize(FlowType.APP_AUTHORIZE);
					case "refresh" -> out.println("Refreshed: " + session.refreshAppToken().block());
					case "status" -> out.println(session.credentials());
					case "reset" -> out.println("Reset: " + session.resetAuthorization(false));
					case "signout" -> {
						session.signOut();
						out.println("Signed out.");
					}
					default -> out.println("Unknown command: " + command);
				}
			}
			catch (OAuthException e) {
				out.println("Failed: " + e.getMessage());
			}
			catch (TimeoutException e) {
				logger.debug("Callback not received", e);
				out.println("Failed: no callback received in time; start the flow again.");
			}
			catch (IOException | ExecutionException e) {
				logger.debug("Callback listener failed", e);
				out.println("Failed: could not receive the callback on port " + callbackPort + ": " + e.getMessage());
			}
		}
		out.println("Goodbye!");
	}

	public static void main(String[] args) {
		try {
			OAuthClientSettings settings = settings(System.getenv());
			System.out.println("MyBooks OAuth example, server " + settings.getServerUrl());

			OAuthClientSession session = OAuthClientSession.builder(settings)
				.userKey(System.getProperty("user.name", "default"))
				.storageDirectory(Path.of(Constants.STORAGE_DIRECTORY))
				.build();
			new AuthorizationCodeExample(session)
				.runInteractiveLoop(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
		}
		catch (Exception e) {
			logger.error("Example failed", e);
			System.exit(1);
		}
	}

}
