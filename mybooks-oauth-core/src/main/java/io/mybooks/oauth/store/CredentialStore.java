/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.store;

/**
 * Storage for {@link AppCredentials}, scoped per user key.
 */
public interface CredentialStore {

	/**
	 * Load the credentials of a user.
	 * @param userKey the user key
	 * @return the credentials, {@link AppCredentials#empty()} when nothing is stored
	 */
	AppCredentials load(String userKey);

	/**
	 * Apply a partial update and persist the result.
	 * @param userKey the user key
	 * @param update the fields to change
	 * @return the merged credentials
	 */
	AppCredentials update(String userKey, CredentialUpdate update);

	void delete(String userKey);

}
