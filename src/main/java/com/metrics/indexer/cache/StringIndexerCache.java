package com.metrics.indexer.cache;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value cache in front of the indexer. Keys are built by {@link CacheKeys}.
 *
 * <p>Entries are advisory: the backing store stays authoritative, so an
 * implementation may drop entries at any time. Implementations backed by a
 * remote service may throw on any call; {@link CachingIndexer} treats that as
 * a miss.</p>
 */
public interface StringIndexerCache {

    Optional<Long> get(String key);

    /**
     * Returns the entries present for {@code keys}; absent keys are omitted.
     */
    Map<String, Long> getMany(Collection<String> keys);

    void set(String key, long id);

    void setMany(Map<String, Long> entries);

    Optional<String> getReverse(String key);

    void setReverse(String key, String string);

    void invalidateAll();

    CacheStats getStats();
}
