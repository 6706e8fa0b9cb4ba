package com.metrics.indexer.health;

import com.metrics.indexer.store.IndexStore;

/**
 * Pings the backing store and reports its round-trip latency.
 */
public class IndexStoreHealthCheck implements HealthCheck {

    private final IndexStore store;

    public IndexStoreHealthCheck(IndexStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return "indexStore";
    }

    @Override
    public HealthStatus check() {
        try {
            long startMs = System.currentTimeMillis();
            store.ping();
            long latencyMs = System.currentTimeMillis() - startMs;

            return HealthStatus.up()
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("store", store.getName());
        } catch (Exception e) {
            return HealthStatus.down("Index store unreachable", e)
                    .withDetail("store", store.getName());
        }
    }
}
