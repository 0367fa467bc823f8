/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.util;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private static final Set<String> TRUTHY_VALUES = Set.of("y", "yes", "t", "true", "on", "1");

	private static final String ELLIPSIS = "…";

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * <p>
	 * More specifically, this method returns {@code true} if the {@code String} is not
	 * {@code null}, its length is greater than 0, and it contains at least one
	 * non-whitespace character.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Return {@code true} if the supplied Collection is {@code null} or empty. Otherwise,
	 * return {@code false}.
	 * @param collection the Collection to check
	 * @return whether the given Collection is empty
	 */
	public static boolean isEmpty(@Nullable Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	/**
	 * Return {@code true} if the supplied Map is {@code null} or empty. Otherwise, return
	 * {@code false}.
	 * @param map the Map to check
	 * @return whether the given Map is empty
	 */
	public static boolean isEmpty(@Nullable Map<?, ?> map) {
		return (map == null || map.isEmpty());
	}

	/**
	 * Interpret an environment style flag. {@code y}, {@code yes}, {@code t},
	 * {@code true}, {@code on} and {@code 1} (case-insensitive) are {@code true},
	 * anything else is {@code false}.
	 * @param value the raw value
	 * @return the boolean reading of the value
	 */
	public static boolean parseFlag(@Nullable String value) {
		return value != null && TRUTHY_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
	}

	/**
	 * Trim the text and cut it to {@code maxLength} characters, appending an ellipsis
	 * when something was removed.
	 * @param text the text, may be {@code null}
	 * @param maxLength the maximum number of characters kept
	 * @return the snippet, never {@code null}
	 */
	public static String snippet(@Nullable String text, int maxLength) {
		if (text == null) {
			return "";
		}
		String trimmed = text.strip();
		if (trimmed.length() <= maxLength) {
			return trimmed;
		}
		return trimmed.substring(0, maxLength) + ELLIPSIS;
	}

	/**
	 * Format parameters as {@code application/x-www-form-urlencoded} content, keeping
	 * the iteration order of the map.
	 * @param params the parameters
	 * @return the encoded string
	 */
	public static String formEncode(Map<String, String> params) {
		StringBuilder result = new StringBuilder();
		boolean first = true;

		for (Map.Entry<String, String> entry : params.entrySet()) {
			if (!first) {
				result.append("&");
			}
			first = false;

			result.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8));
			result.append("=");
			result.append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
		}

		return result.toString();
	}

	/**
	 * Normalize a URL for use as a cache key: trims whitespace and trailing slashes.
	 * @param url the URL
	 * @return the normalized URL
	 */
	public static String normalizeUrl(String url) {
		String normalized = url.strip();
		while (normalized.endsWith("/")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return normalized;
	}

}
