/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.pkce;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PkceUtilsTests {

	@RepeatedTest(200)
	void verifierLengthAndCharsetAreWithinBounds() {
		String verifier = PkceUtils.generateCodeVerifier();

		assertThat(verifier.length()).isBetween(PkceUtils.MIN_VERIFIER_LENGTH, PkceUtils.MAX_VERIFIER_LENGTH);
		assertThat(verifier.chars()).allMatch(c -> PkceUtils.ALLOWED_CHARS.indexOf(c) >= 0);
	}

	@Test
	void verifierLengthVaries() {
		Set<Integer> lengths = new HashSet<>();
		for (int i = 0; i < 500; i++) {
			lengths.add(PkceUtils.generateCodeVerifier().length());
		}
		assertThat(lengths).hasSizeGreaterThan(10);
	}

	@Test
	void challengeMatchesRfc7636Example() {
		assertThat(PkceUtils.generateCodeChallenge("dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk"))
			.isEqualTo("E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM");
	}

	@Test
	void challengeIsDeterministicAndUnpadded() {
		String verifier = PkceUtils.generateCodeVerifier();

		String challenge = PkceUtils.generateCodeChallenge(verifier);

		assertThat(PkceUtils.generateCodeChallenge(verifier)).isEqualTo(challenge);
		assertThat(challenge).hasSize(43).doesNotContain("=", "+", "/");
	}

	@Test
	void pairChallengeIsDerivedFromItsVerifier() {
		PkcePair pair = PkceUtils.generatePair();

		assertThat(pair.codeChallenge()).isEqualTo(PkceUtils.generateCodeChallenge(pair.codeVerifier()));
		assertThat(pair.codeChallengeMethod()).isEqualTo("S256");
		assertThat(pair.toString()).doesNotContain(pair.codeVerifier());
	}

	@Test
	void stateIsUrlSafeAndUnique() {
		String first = PkceUtils.generateState(24);
		String second = PkceUtils.generateState(24);

		assertThat(first).hasSize(32).matches("[A-Za-z0-9_-]+");
		assertThat(first).isNotEqualTo(second);
	}

}
