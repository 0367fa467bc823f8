/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mybooks.oauth.util.Assert;

/**
 * {@link CredentialStore} keeping one JSON file per user key in a directory. An
 * unreadable file is treated as empty and replaced on the next update.
 */
public class FileCredentialStore implements CredentialStore {

	private static final Logger logger = LoggerFactory.getLogger(FileCredentialStore.class);

	private final Path directory;

	private final ObjectMapper objectMapper;

	public FileCredentialStore(Path directory) {
		this(directory, new ObjectMapper());
	}

	public FileCredentialStore(Path directory, ObjectMapper objectMapper) {
		Assert.notNull(directory, "directory must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.directory = directory;
		this.objectMapper = objectMapper;
	}

	@Override
	public AppCredentials load(String userKey) {
		Assert.hasText(userKey, "userKey must not be empty");
		Path file = fileFor(userKey);
		byte[] content;
		try {
			content = Files.readAllBytes(file);
		}
		catch (NoSuchFileException e) {
			return AppCredentials.empty();
		}
		catch (IOException e) {
			throw new StoreException("Cannot read credentials from " + file, e);
		}

		try {
			AppCredentials credentials = objectMapper.readValue(content, AppCredentials.class);
			return credentials != null ? credentials : AppCredentials.empty();
		}
		catch (IOException e) {
			String detail = e instanceof JsonProcessingException ? ((JsonProcessingException) e).getOriginalMessage()
					: e.getMessage();
			logger.warn("Ignoring unreadable credentials file {}: {}", file, detail);
			return AppCredentials.empty();
		}
	}

	@Override
	public synchronized AppCredentials update(String userKey, CredentialUpdate update) {
		Assert.notNull(update, "update must not be null");
		AppCredentials updated = update.applyTo(load(userKey));
		Path file = fileFor(userKey);
		try {
			JsonFiles.write(objectMapper, file, updated);
		}
		catch (IOException e) {
			throw new StoreException("Cannot write credentials to " + file, e);
		}
		return updated;
	}

	@Override
	public void delete(String userKey) {
		Assert.hasText(userKey, "userKey must not be empty");
		Path file = fileFor(userKey);
		try {
			Files.deleteIfExists(file);
		}
		catch (IOException e) {
			throw new StoreException("Cannot delete credentials " + file, e);
		}
	}

	Path fileFor(String userKey) {
		return directory.resolve("credentials-" + JsonFiles.safeName(userKey.strip()) + ".json");
	}

}
