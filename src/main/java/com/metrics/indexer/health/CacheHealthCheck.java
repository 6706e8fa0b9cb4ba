package com.metrics.indexer.health;

import com.metrics.indexer.cache.CacheConfig;
import com.metrics.indexer.cache.CacheStats;
import com.metrics.indexer.cache.StringIndexerCache;

/**
 * Reports cache statistics. A disabled cache is DEGRADED: lookups still work
 * but every one of them reaches the store.
 */
public class CacheHealthCheck implements HealthCheck {

    private final StringIndexerCache cache;
    private final CacheConfig config;

    public CacheHealthCheck(StringIndexerCache cache, CacheConfig config) {
        this.cache = cache;
        this.config = config;
    }

    @Override
    public String getName() {
        return "cache";
    }

    @Override
    public HealthStatus check() {
        if (!config.enabled()) {
            return HealthStatus.degraded("Cache disabled")
                    .withDetail("partitionKey", config.partitionKey());
        }
        try {
            CacheStats stats = cache.getStats();
            return HealthStatus.up()
                    .withDetail("size", stats.size())
                    .withDetail("maxSize", config.maxSize())
                    .withDetail("hitRate", Math.round(stats.hitRate() * 1000.0) / 1000.0)
                    .withDetail("evictions", stats.evictionCount())
                    .withDetail("partitionKey", config.partitionKey());
        } catch (Exception e) {
            return HealthStatus.degraded("Cache stats unavailable", e);
        }
    }
}
