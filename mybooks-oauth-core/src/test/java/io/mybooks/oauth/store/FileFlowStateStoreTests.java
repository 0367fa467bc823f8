/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.store;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.mybooks.oauth.flow.FlowType;
import io.mybooks.oauth.flow.OAuthFlowState;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileFlowStateStoreTests {

	@TempDir
	Path directory;

	@Test
	void savedStateIsReadBackByAnotherInstance() {
		OAuthFlowState flowState = OAuthFlowState.create("abc123", "https://app/cb", "read write");
		new FileFlowStateStore(directory).save(FlowType.APP_AUTHORIZE, flowState);

		assertThat(new FileFlowStateStore(directory).load(FlowType.APP_AUTHORIZE)).contains(flowState);
		assertThat(new FileFlowStateStore(directory).load(FlowType.USER_LOGIN)).isEmpty();
	}

	@Test
	void fileUsesSnakeCaseMembers() throws Exception {
		FileFlowStateStore store = new FileFlowStateStore(directory);
		store.save(FlowType.USER_LOGIN, OAuthFlowState.create("abc123", "https://app/cb", "read"));

		String json = Files.readString(directory.resolve("user_login.json"));
		assertThat(json).contains("\"code_verifier\"", "\"code_challenge_method\" : \"S256\"", "\"client_id\"");
	}

	@Test
	void namespacesKeepUsersApart() {
		FileFlowStateStore alice = new FileFlowStateStore(directory, "alice@example.com");
		FileFlowStateStore bob = new FileFlowStateStore(directory, "bob");
		alice.save(FlowType.APP_AUTHORIZE, OAuthFlowState.create("abc123", "https://app/cb", "read"));

		assertThat(bob.load(FlowType.APP_AUTHORIZE)).isEmpty();
		assertThat(alice.load(FlowType.APP_AUTHORIZE)).isPresent();
		assertThat(directory.resolve("alice_example.com-app_authorize.json")).exists();
	}

	@Test
	void corruptFileIsDeletedAndReportedAbsent() throws Exception {
		Path file = directory.resolve("app_authorize.json");
		Files.writeString(file, "{not json", StandardCharsets.UTF_8);

		assertThat(new FileFlowStateStore(directory).load(FlowType.APP_AUTHORIZE)).isEmpty();
		assertThat(file).doesNotExist();
	}

	@Test
	void incompleteStateIsDeletedAndReportedAbsent() throws Exception {
		Path file = directory.resolve("app_authorize.json");
		Files.writeString(file, "{\"client_id\":\"abc123\",\"state\":\"s\",\"code_verifier\":\"\"}",
				StandardCharsets.UTF_8);

		assertThat(new FileFlowStateStore(directory).load(FlowType.APP_AUTHORIZE)).isEmpty();
		assertThat(file).doesNotExist();
	}

	@Test
	void clearRemovesFileAndToleratesAbsence() {
		FileFlowStateStore store = new FileFlowStateStore(directory);
		store.save(FlowType.APP_AUTHORIZE, OAuthFlowState.create("abc123", "https://app/cb", "read"));

		store.clear(FlowType.APP_AUTHORIZE);
		store.clear(FlowType.APP_AUTHORIZE);

		assertThat(store.load(FlowType.APP_AUTHORIZE)).isEmpty();
	}

	@Test
	void fileIsOwnerOnly() throws Exception {
		assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
		FileFlowStateStore store = new FileFlowStateStore(directory);
		store.save(FlowType.APP_AUTHORIZE, OAuthFlowState.create("abc123", "https://app/cb", "read"));

		assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(directory.resolve("app_authorize.json"))))
			.isEqualTo("rw-------");
	}

}
