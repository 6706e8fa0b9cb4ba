package com.metrics.indexer.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Caffeine-backed indexer cache with write-based expiry. Forward and reverse
 * entries live in separate caches of the same size and TTL.
 */
public class CaffeineStringIndexerCache implements StringIndexerCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineStringIndexerCache.class);

    private final Cache<String, Long> ids;
    private final Cache<String, String> strings;

    public CaffeineStringIndexerCache(CacheConfig config) {
        this(config, Ticker.systemTicker());
    }

    CaffeineStringIndexerCache(CacheConfig config, Ticker ticker) {
        this.ids = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .ticker(ticker)
                .recordStats()
                .build();
        this.strings = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .ticker(ticker)
                .recordStats()
                .build();
        log.info("CaffeineStringIndexerCache initialized: partition={}, maxSize={}, ttl={}s",
                config.partitionKey(), config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<Long> get(String key) {
        return Optional.ofNullable(ids.getIfPresent(key));
    }

    @Override
    public Map<String, Long> getMany(Collection<String> keys) {
        return ids.getAllPresent(keys);
    }

    @Override
    public void set(String key, long id) {
        ids.put(key, id);
    }

    @Override
    public void setMany(Map<String, Long> entries) {
        ids.putAll(entries);
    }

    @Override
    public Optional<String> getReverse(String key) {
        return Optional.ofNullable(strings.getIfPresent(key));
    }

    @Override
    public void setReverse(String key, String string) {
        strings.put(key, string);
    }

    @Override
    public void invalidateAll() {
        ids.invalidateAll();
        strings.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats forward = ids.stats();
        com.github.benmanes.caffeine.cache.stats.CacheStats reverse = strings.stats();
        return new CacheStats(
                forward.hitCount() + reverse.hitCount(),
                forward.missCount() + reverse.missCount(),
                forward.evictionCount() + reverse.evictionCount(),
                ids.estimatedSize() + strings.estimatedSize()
        );
    }
}
