package com.metrics.indexer.health;

/**
 * A single component check (store, cache) returning a {@link HealthStatus}.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
