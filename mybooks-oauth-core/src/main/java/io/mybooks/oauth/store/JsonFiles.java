/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * File helpers shared by the file backed stores: owner-only files written through a
 * temporary file and an atomic move.
 */
final class JsonFiles {

	private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

	private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

	private JsonFiles() {
	}

	static void write(ObjectMapper objectMapper, Path file, Object value) throws IOException {
		Path directory = file.toAbsolutePath().getParent();
		Files.createDirectories(directory);
		Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
		try {
			if (supportsPosix(directory)) {
				Files.setPosixFilePermissions(temp, OWNER_ONLY);
			}
			Files.write(temp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value));
			try {
				Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			}
			catch (AtomicMoveNotSupportedException e) {
				Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
			}
		}
		finally {
			Files.deleteIfExists(temp);
		}
	}

	/**
	 * Reduce a key to characters that are safe in a file name.
	 * @param key the key
	 * @return the file name part
	 */
	static String safeName(String key) {
		return UNSAFE_NAME_CHARS.matcher(key).replaceAll("_");
	}

	private static boolean supportsPosix(Path path) {
		return path.getFileSystem().supportedFileAttributeViews().contains("posix");
	}

}
