/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.examples.auth;

/**
 * Defaults for the auth example, used when the environment does not set them.
 */
public class Constants {

	public static final String SERVER_URL = "http://localhost:8000/mcp";

	public static final int CALLBACK_PORT = 3000;

	public static final String CALLBACK_PATH = "/callback";

	public static final String REDIRECT_URI = "http://localhost:" + CALLBACK_PORT + CALLBACK_PATH;

	public static final String SCOPE = "read write";

	public static final String STORAGE_DIRECTORY = ".mybooks-oauth";

}
