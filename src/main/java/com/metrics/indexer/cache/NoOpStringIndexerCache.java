package com.metrics.indexer.cache;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled.
 */
public class NoOpStringIndexerCache implements StringIndexerCache {

    @Override
    public Optional<Long> get(String key) {
        return Optional.empty();
    }

    @Override
    public Map<String, Long> getMany(Collection<String> keys) {
        return Map.of();
    }

    @Override
    public void set(String key, long id) {
        // no-op
    }

    @Override
    public void setMany(Map<String, Long> entries) {
        // no-op
    }

    @Override
    public Optional<String> getReverse(String key) {
        return Optional.empty();
    }

    @Override
    public void setReverse(String key, String string) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
