/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mybooks.oauth.discovery;

/**
 * A metadata document together with the URL that served it.
 *
 * @param url the well-known URL that answered
 * @param metadata the parsed document
 * @param <T> the metadata type
 */
public record DiscoveredDocument<T>(String url, T metadata) {
}
