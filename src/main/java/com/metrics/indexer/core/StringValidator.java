package com.metrics.indexer.core;

/**
 * Validation for strings submitted to the indexer.
 */
public final class StringValidator {

    /** Longest metric name, tag key or tag value the indexer accepts. */
    public static final int MAX_STRING_LENGTH = 200;

    private StringValidator() {
        // utility class
    }

    /**
     * Validates a string for indexing.
     *
     * @throws IllegalArgumentException if the string is null or longer than {@link #MAX_STRING_LENGTH}
     */
    public static void validateIndexedString(String string) {
        if (string == null) {
            throw new IllegalArgumentException("Indexed string must not be null");
        }
        if (string.length() > MAX_STRING_LENGTH) {
            throw new IllegalArgumentException(
                    "Indexed string exceeds maximum length of " + MAX_STRING_LENGTH +
                            " characters (was " + string.length() + ")");
        }
    }

    /**
     * Returns true if {@link #validateIndexedString} would accept the string.
     */
    public static boolean isIndexable(String string) {
        return string != null && string.length() <= MAX_STRING_LENGTH;
    }
}
