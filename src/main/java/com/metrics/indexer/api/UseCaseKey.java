package com.metrics.indexer.api;

import java.util.Arrays;

/**
 * Namespace a string is indexed under. The same string gets independent ids
 * in different use cases.
 */
public enum UseCaseKey {
    RELEASE_HEALTH("release-health"),
    PERFORMANCE("performance");

    private final String value;

    UseCaseKey(String value) {
        this.value = value;
    }

    /**
     * Returns the wire value stored alongside each entry.
     */
    public String value() {
        return value;
    }

    /**
     * Parses a wire value such as {@code "release-health"}.
     *
     * @throws IllegalArgumentException if the value names no use case
     */
    public static UseCaseKey fromValue(String value) {
        return Arrays.stream(values())
                .filter(k -> k.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown use case: " + value));
    }
}
