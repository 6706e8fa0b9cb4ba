package com.metrics.indexer.cache;

/**
 * Configuration for the indexer cache.
 *
 * @param maxSize      maximum number of entries per direction
 * @param ttlSeconds   time-to-live in seconds for each entry
 * @param enabled      whether caching is enabled
 * @param partitionKey prefix separating this indexer's keys from other users of a shared cache
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled, String partitionKey) {

    public static final int DEFAULT_MAX_SIZE = 100_000;
    public static final int DEFAULT_TTL_SECONDS = 7200;
    public static final String DEFAULT_PARTITION_KEY = "fs";

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
        if (partitionKey == null || partitionKey.isBlank() || partitionKey.contains(":")) {
            throw new IllegalArgumentException("partitionKey must be non-blank and contain no ':'");
        }
    }

    /**
     * 100,000 entries, 2h TTL, enabled, partition {@code "fs"}.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_MAX_SIZE, DEFAULT_TTL_SECONDS, true, DEFAULT_PARTITION_KEY);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false, DEFAULT_PARTITION_KEY);
    }

    public CacheConfig withPartitionKey(String partitionKey) {
        return new CacheConfig(maxSize, ttlSeconds, enabled, partitionKey);
    }
}
