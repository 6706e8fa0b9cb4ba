package com.metrics.indexer.api;

import com.metrics.indexer.cache.CacheConfig;
import com.metrics.indexer.cache.CachingIndexer;
import com.metrics.indexer.cache.CaffeineStringIndexerCache;
import com.metrics.indexer.cache.NoOpStringIndexerCache;
import com.metrics.indexer.cache.StringIndexerCache;
import com.metrics.indexer.codec.IdCodec;
import com.metrics.indexer.codec.IdGenerator;
import com.metrics.indexer.core.StaticStringIndexer;
import com.metrics.indexer.core.StoreBackedStringIndexer;
import com.metrics.indexer.graph.FalkorDBConnection;
import com.metrics.indexer.graph.GraphConnection;
import com.metrics.indexer.graph.GraphIndexStore;
import com.metrics.indexer.health.CacheHealthCheck;
import com.metrics.indexer.health.HealthCheckRegistry;
import com.metrics.indexer.health.HealthStatus;
import com.metrics.indexer.health.IndexStoreHealthCheck;
import com.metrics.indexer.metrics.MetricsService;
import com.metrics.indexer.metrics.NoOpMetricsService;
import com.metrics.indexer.store.IndexStore;
import com.metrics.indexer.tracing.NoOpTracingService;
import com.metrics.indexer.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Main entry point of the string indexer.
 *
 * <p>Builds the usual stack of indexers around a store:</p>
 * <pre>
 * StaticStringIndexer            shared strings, no I/O
 *   CachingIndexer               read-through / write-through cache
 *     StoreBackedStringIndexer   id generation, codec, store calls
 * </pre>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (MetricsIndexer indexer = MetricsIndexer.builder()
 *         .falkorDB("localhost", 6379, "metrics-indexer")
 *         .cacheConfig(CacheConfig.defaults())
 *         .build()) {
 *
 *     KeyResults results = indexer.bulkRecord(UseCaseKey.PERFORMANCE,
 *             KeyCollection.builder().add(1L, "transaction").add(1L, "/checkout").build());
 *     OptionalLong id = results.getId(1L, "/checkout");
 *
 *     Optional&lt;String&gt; string = indexer.reverseResolve(UseCaseKey.PERFORMANCE, 1L, id.getAsLong());
 * }
 * </pre>
 */
public class MetricsIndexer implements StringIndexer, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MetricsIndexer.class);

    private final IndexStore store;
    private final boolean ownsStore;
    private final StoreBackedStringIndexer storeIndexer;
    private final StringIndexerCache cache;
    private final StringIndexer indexer;
    private final HealthCheckRegistry healthCheckRegistry;

    private MetricsIndexer(Builder builder) {
        this.store = builder.store;
        this.ownsStore = builder.ownsStore;

        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        IdGenerator idGenerator = builder.idGenerator != null
                ? builder.idGenerator : new IdGenerator();

        this.storeIndexer = new StoreBackedStringIndexer(
                store, new IdCodec(), idGenerator, metricsService, tracingService);

        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (builder.cacheConfig.enabled()) {
            this.cache = new CaffeineStringIndexerCache(builder.cacheConfig);
        } else {
            this.cache = new NoOpStringIndexerCache();
        }

        StringIndexer stack = new CachingIndexer(
                cache, storeIndexer, builder.cacheConfig.partitionKey(), metricsService);
        if (builder.staticStrings) {
            stack = new StaticStringIndexer(stack);
        }
        this.indexer = stack;

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new IndexStoreHealthCheck(store));
        healthCheckRegistry.register(new CacheHealthCheck(cache, builder.cacheConfig));

        if (builder.validateOnStart) {
            try {
                storeIndexer.validate();
            } catch (RuntimeException e) {
                releaseOwnedStore(store, ownsStore, e);
                throw e;
            }
        }

        log.info("MetricsIndexer initialized with store {} (cache enabled={}, static strings={})",
                store.getName(), builder.cacheConfig.enabled(), builder.staticStrings);
    }

    // ========== Indexing API ==========

    @Override
    public KeyResults bulkRecord(UseCaseKey useCase, KeyCollection strings) {
        return indexer.bulkRecord(useCase, strings);
    }

    @Override
    public OptionalLong record(UseCaseKey useCase, long tenantId, String string) {
        return indexer.record(useCase, tenantId, string);
    }

    @Override
    public OptionalLong resolve(UseCaseKey useCase, long tenantId, String string) {
        return indexer.resolve(useCase, tenantId, string);
    }

    @Override
    public Optional<String> reverseResolve(UseCaseKey useCase, long tenantId, long id) {
        return indexer.reverseResolve(useCase, tenantId, id);
    }

    // ========== Operations ==========

    /**
     * Checks that the store is reachable. Transient connection errors are only logged.
     */
    public void validate() {
        storeIndexer.validate();
    }

    /**
     * Aggregate health of the store and the cache.
     */
    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public StringIndexer getIndexer() {
        return indexer;
    }

    public StringIndexerCache getCache() {
        return cache;
    }

    public IndexStore getStore() {
        return store;
    }

    @Override
    public void close() {
        if (ownsStore) {
            try {
                store.close();
            } catch (Exception e) {
                log.warn("Error closing store {}", store.getName(), e);
            }
        }
    }

    /**
     * Closes a store the indexer would have owned when construction fails,
     * keeping {@code failure} as the primary error.
     */
    private static void releaseOwnedStore(IndexStore store, boolean ownsStore, RuntimeException failure) {
        if (!ownsStore) {
            return;
        }
        try {
            store.close();
            log.info("Closed store {} after failed start", store.getName());
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IndexStore store;
        private boolean ownsStore = false;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private StringIndexerCache cache;
        private MetricsService metricsService;
        private TracingService tracingService;
        private IdGenerator idGenerator;
        private boolean staticStrings = true;
        private boolean validateOnStart = false;

        /**
         * Uses an existing store. The caller keeps ownership and closes it.
         */
        public Builder store(IndexStore store) {
            this.store = store;
            this.ownsStore = false;
            return this;
        }

        /**
         * Stores entries in a graph reachable through {@code connection}.
         * The connection is closed together with the indexer.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.store = new GraphIndexStore(connection);
            this.ownsStore = true;
            return this;
        }

        /**
         * Creates a FalkorDB connection and its indexes.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            FalkorDBConnection connection = new FalkorDBConnection(host, port, graphName);
            connection.createIndexes();
            return graphConnection(connection);
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * Sets a custom cache, used even when {@link CacheConfig#enabled()} is false.
         */
        public Builder cache(StringIndexerCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService}.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Defaults to {@link NoOpTracingService}.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder idGenerator(IdGenerator idGenerator) {
            this.idGenerator = idGenerator;
            return this;
        }

        /**
         * Whether shared strings are answered with their reserved ids. Enabled by default.
         */
        public Builder staticStrings(boolean staticStrings) {
            this.staticStrings = staticStrings;
            return this;
        }

        /**
         * Pings the store while building. If the ping fails for any reason other
         * than a transient connection error, a store created by this builder is
         * closed again before the error is rethrown.
         */
        public Builder validateOnStart(boolean validateOnStart) {
            this.validateOnStart = validateOnStart;
            return this;
        }

        public MetricsIndexer build() {
            if (store == null) {
                throw new IllegalStateException("IndexStore is required");
            }
            if (cacheConfig == null) {
                IllegalStateException e = new IllegalStateException("CacheConfig is required");
                releaseOwnedStore(store, ownsStore, e);
                throw e;
            }
            return new MetricsIndexer(this);
        }
    }
}
