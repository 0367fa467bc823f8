/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.pkce;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

import io.mybooks.oauth.util.Assert;

/**
 * Utility class for PKCE (Proof Key for Code Exchange) operations.
 *
 * <p>
 * Verifiers are drawn from upper case letters and digits only. RFC 7636 also allows
 * lower case letters and {@code -._~}; the narrower alphabet is what the MyBooks
 * clients have always sent and every verifier produced here is still valid under the
 * RFC.
 */
public final class PkceUtils {

	public static final String CODE_CHALLENGE_METHOD = "S256";

	public static final int MIN_VERIFIER_LENGTH = 43;

	public static final int MAX_VERIFIER_LENGTH = 128;

	static final String ALLOWED_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

	private static final SecureRandom secureRandom = new SecureRandom();

	private PkceUtils() {
	}

	/**
	 * Generates a cryptographically random code verifier for PKCE. The length is chosen
	 * uniformly between {@value #MIN_VERIFIER_LENGTH} and {@value #MAX_VERIFIER_LENGTH}.
	 * @return A random code verifier string.
	 */
	public static String generateCodeVerifier() {
		int length = MIN_VERIFIER_LENGTH + secureRandom.nextInt(MAX_VERIFIER_LENGTH - MIN_VERIFIER_LENGTH + 1);
		StringBuilder codeVerifier = new StringBuilder(length);
		for (int i = 0; i < length; i++) {
			codeVerifier.append(ALLOWED_CHARS.charAt(secureRandom.nextInt(ALLOWED_CHARS.length())));
		}
		return codeVerifier.toString();
	}

	/**
	 * Generates a code challenge from a code verifier using SHA-256.
	 * @param codeVerifier The code verifier to hash.
	 * @return The base64url encoded digest, without padding.
	 */
	public static String generateCodeChallenge(String codeVerifier) {
		Assert.notNull(codeVerifier, "codeVerifier must not be null");
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.UTF_8));
			return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 algorithm not available", e);
		}
	}

	/**
	 * Generates a fresh verifier together with its {@code S256} challenge.
	 * @return the pair
	 */
	public static PkcePair generatePair() {
		String verifier = generateCodeVerifier();
		return new PkcePair(verifier, generateCodeChallenge(verifier), CODE_CHALLENGE_METHOD);
	}

	/**
	 * Generates an opaque URL-safe token of {@code byteLength} random bytes, used for the
	 * {@code state} parameter.
	 * @param byteLength number of random bytes
	 * @return the base64url encoded token, without padding
	 */
	public static String generateState(int byteLength) {
		byte[] stateBytes = new byte[byteLength];
		secureRandom.nextBytes(stateBytes);
		return Base64.getUrlEncoder().withoutPadding().encodeToString(stateBytes);
	}

}
