/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mybooks.oauth.flow.FlowType;
import io.mybooks.oauth.flow.OAuthFlowState;
import io.mybooks.oauth.util.Assert;
import io.mybooks.oauth.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * {@link FlowStateStore} keeping one JSON file per flow in a directory. Files are
 * readable by the owner only where the file system supports POSIX permissions and
 * are replaced atomically.
 *
 * <p>
 * An optional namespace, typically a session or user id, keeps the flows of several
 * users apart in the same directory. A file that cannot be decoded, or that lacks a
 * member, is deleted and reported as absent.
 */
public class FileFlowStateStore implements FlowStateStore {

	private static final Logger logger = LoggerFactory.getLogger(FileFlowStateStore.class);

	private final Path directory;

	private final String namespace;

	private final ObjectMapper objectMapper;

	public FileFlowStateStore(Path directory) {
		this(directory, null);
	}

	public FileFlowStateStore(Path directory, @Nullable String namespace) {
		this(directory, namespace, new ObjectMapper());
	}

	public FileFlowStateStore(Path directory, @Nullable String namespace, ObjectMapper objectMapper) {
		Assert.notNull(directory, "directory must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.directory = directory;
		this.namespace = Utils.hasText(namespace) ? JsonFiles.safeName(namespace.strip()) : null;
		this.objectMapper = objectMapper;
	}

	@Override
	public void save(FlowType flowType, OAuthFlowState flowState) {
		Assert.notNull(flowType, "flowType must not be null");
		Assert.notNull(flowState, "flowState must not be null");
		Path file = fileFor(flowType);
		try {
			JsonFiles.write(objectMapper, file, flowState);
		}
		catch (IOException e) {
			throw new StoreException("Cannot save " + flowType.value() + " flow state to " + file, e);
		}
	}

	@Override
	public Optional<OAuthFlowState> load(FlowType flowType) {
		Assert.notNull(flowType, "flowType must not be null");
		Path file = fileFor(flowType);
		byte[] content;
		try {
			content = Files.readAllBytes(file);
		}
		catch (NoSuchFileException e) {
			return Optional.empty();
		}
		catch (IOException e) {
			throw new StoreException("Cannot read " + flowType.value() + " flow state from " + file, e);
		}

		OAuthFlowState flowState;
		try {
			flowState = objectMapper.readValue(content, OAuthFlowState.class);
		}
		catch (IOException e) {
			String detail = e instanceof JsonProcessingException ? ((JsonProcessingException) e).getOriginalMessage()
					: e.getMessage();
			logger.warn("Discarding unreadable {} flow state {}: {}", flowType.value(), file, detail);
			clear(flowType);
			return Optional.empty();
		}
		if (flowState == null || !flowState.isComplete()) {
			logger.warn("Discarding incomplete {} flow state {}", flowType.value(), file);
			clear(flowType);
			return Optional.empty();
		}
		return Optional.of(flowState);
	}

	@Override
	public void clear(FlowType flowType) {
		Assert.notNull(flowType, "flowType must not be null");
		Path file = fileFor(flowType);
		try {
			Files.deleteIfExists(file);
		}
		catch (IOException e) {
			throw new StoreException("Cannot delete " + flowType.value() + " flow state " + file, e);
		}
	}

	Path fileFor(FlowType flowType) {
		String name = namespace == null ? flowType.value() : namespace + "-" + flowType.value();
		return directory.resolve(name + ".json");
	}

}
