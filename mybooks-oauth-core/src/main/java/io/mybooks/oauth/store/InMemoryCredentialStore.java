/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.store;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.mybooks.oauth.util.Assert;

/**
 * {@link CredentialStore} kept in memory.
 */
public class InMemoryCredentialStore implements CredentialStore {

	private final Map<String, AppCredentials> credentials = new ConcurrentHashMap<>();

	@Override
	public AppCredentials load(String userKey) {
		Assert.hasText(userKey, "userKey must not be empty");
		return credentials.getOrDefault(userKey, AppCredentials.empty());
	}

	@Override
	public AppCredentials update(String userKey, CredentialUpdate update) {
		Assert.hasText(userKey, "userKey must not be empty");
		Assert.notNull(update, "update must not be null");
		return credentials.merge(userKey, update.applyTo(AppCredentials.empty()),
				(current, ignored) -> update.applyTo(current));
	}

	@Override
	public void delete(String userKey) {
		Assert.hasText(userKey, "userKey must not be empty");
		credentials.remove(userKey);
	}

}
