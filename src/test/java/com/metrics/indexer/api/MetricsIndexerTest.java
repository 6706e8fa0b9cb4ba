package com.metrics.indexer.api;

import com.metrics.indexer.cache.CacheConfig;
import com.metrics.indexer.cache.CachingIndexer;
import com.metrics.indexer.cache.CaffeineStringIndexerCache;
import com.metrics.indexer.cache.NoOpStringIndexerCache;
import com.metrics.indexer.chaos.ChaosIndexStore;
import com.metrics.indexer.core.SharedStrings;
import com.metrics.indexer.core.StaticStringIndexer;
import com.metrics.indexer.graph.GraphConnection;
import com.metrics.indexer.health.HealthStatus;
import com.metrics.indexer.metrics.MicrometerMetricsService;
import com.metrics.indexer.store.InMemoryIndexStore;
import com.metrics.indexer.store.IndexStore;
import com.metrics.indexer.store.IndexStoreException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MetricsIndexerTest {

    private InMemoryIndexStore memoryStore;
    private ChaosIndexStore store;
    private MetricsIndexer indexer;

    @BeforeEach
    void setUp() {
        memoryStore = new InMemoryIndexStore();
        store = new ChaosIndexStore(memoryStore);
        indexer = MetricsIndexer.builder()
                .store(store)
                .build();
    }

    @AfterEach
    void tearDown() {
        indexer.close();
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("A store is required")
        void storeRequired() {
            assertThrows(IllegalStateException.class, () -> MetricsIndexer.builder().build());
        }

        @Test
        @DisplayName("A failed start closes the graph connection it was given")
        void failedValidationClosesOwnedConnection() {
            GraphConnection connection = mock(GraphConnection.class);
            when(connection.getGraphName()).thenReturn("metrics");
            when(connection.query("RETURN 1")).thenThrow(new IndexStoreException("graph missing"));

            MetricsIndexer.Builder builder = MetricsIndexer.builder()
                    .graphConnection(connection)
                    .validateOnStart(true);

            assertThrows(IndexStoreException.class, builder::build);
            verify(connection).close();
        }

        @Test
        @DisplayName("A missing cache config closes the graph connection it was given")
        void missingCacheConfigClosesOwnedConnection() {
            GraphConnection connection = mock(GraphConnection.class);
            when(connection.getGraphName()).thenReturn("metrics");

            MetricsIndexer.Builder builder = MetricsIndexer.builder()
                    .graphConnection(connection)
                    .cacheConfig(null);

            assertThrows(IllegalStateException.class, builder::build);
            verify(connection).close();
        }

        @Test
        @DisplayName("A failed start leaves a borrowed store open")
        void failedValidationKeepsBorrowedStore() {
            IndexStore borrowed = mock(IndexStore.class);
            when(borrowed.getName()).thenReturn("borrowed");
            doThrow(new IndexStoreException("unreachable")).when(borrowed).ping();

            MetricsIndexer.Builder builder = MetricsIndexer.builder()
                    .store(borrowed)
                    .validateOnStart(true);

            assertThrows(IndexStoreException.class, builder::build);
            verify(borrowed, never()).close();
        }

        @Test
        @DisplayName("Default stack is static strings over a Caffeine cache over the store")
        void defaultStack() {
            StaticStringIndexer top = assertInstanceOf(StaticStringIndexer.class, indexer.getIndexer());
            CachingIndexer caching = assertInstanceOf(CachingIndexer.class, top.getIndexer());
            assertInstanceOf(CaffeineStringIndexerCache.class, caching.getCache());
            assertSame(store, indexer.getStore());
        }

        @Test
        @DisplayName("Static strings and the cache can be switched off")
        void switchedOff() {
            try (MetricsIndexer plain = MetricsIndexer.builder()
                    .store(memoryStore)
                    .cacheConfig(CacheConfig.disabled())
                    .staticStrings(false)
                    .build()) {

                assertInstanceOf(CachingIndexer.class, plain.getIndexer());
                assertInstanceOf(NoOpStringIndexerCache.class, plain.getCache());
                long id = plain.record(UseCaseKey.PERFORMANCE, 1L, "environment").getAsLong();
                assertNotEquals(SharedStrings.idOf("environment").getAsLong(), id);
            }
        }

        @Test
        @DisplayName("validateOnStart surfaces non-transient store errors")
        void validateOnStart() {
            store.setFailAll(true);

            assertThrows(IndexStoreException.class, () -> MetricsIndexer.builder()
                    .store(store)
                    .validateOnStart(true)
                    .build());
        }

        @Test
        @DisplayName("The indexer closes graph connections it created")
        void closesOwnedConnection() {
            GraphConnection connection = mock(GraphConnection.class);
            when(connection.getGraphName()).thenReturn("metrics");

            MetricsIndexer graphIndexer = MetricsIndexer.builder().graphConnection(connection).build();
            graphIndexer.close();

            verify(connection).close();
        }

        @Test
        @DisplayName("The indexer leaves caller-owned stores open")
        void leavesBorrowedStoreOpen() {
            InMemoryIndexStore borrowed = spy(new InMemoryIndexStore());
            MetricsIndexer.builder().store(borrowed).build().close();

            verify(borrowed, never()).close();
        }
    }

    @Nested
    @DisplayName("Indexing through the full stack")
    class Indexing {

        @Test
        @DisplayName("Mixed shared and dynamic strings resolve and reverse-resolve")
        void mixedStrings() {
            KeyCollection keys = KeyCollection.builder()
                    .add(1L, "transaction").add(1L, "/api/checkout")
                    .add(2L, "/api/checkout")
                    .build();

            KeyResults results = indexer.bulkRecord(UseCaseKey.PERFORMANCE, keys);

            assertFalse(results.hasFailures());
            assertEquals(SharedStrings.idOf("transaction"), results.getId(1L, "transaction"));
            for (KeyResult result : results.all()) {
                assertEquals(result.string(),
                        indexer.reverseResolve(UseCaseKey.PERFORMANCE, result.tenantId(), result.id()).orElseThrow());
                assertEquals(result.resolvedId(),
                        indexer.resolve(UseCaseKey.PERFORMANCE, result.tenantId(), result.string()));
            }
            assertEquals(2, memoryStore.size());
        }

        @Test
        @DisplayName("Ids are stable across calls and cache flushes")
        void stableIds() {
            long id = indexer.record(UseCaseKey.RELEASE_HEALTH, 5L, "my-release@1.0").getAsLong();
            indexer.getCache().invalidateAll();

            assertEquals(id, indexer.record(UseCaseKey.RELEASE_HEALTH, 5L, "my-release@1.0").getAsLong());
        }

        @Test
        @DisplayName("Failed keys can be retried with getUnmappedKeys")
        void retryUnmapped() {
            store.poison("flaky");
            KeyCollection keys = KeyCollection.of(1L, Set.of("stable", "flaky"));

            KeyResults first = indexer.bulkRecord(UseCaseKey.PERFORMANCE, keys);
            KeyCollection retry = first.getUnmappedKeys(keys);
            assertEquals(KeyCollection.of(1L, Set.of("flaky")), retry);

            store.reset();
            KeyResults second = indexer.bulkRecord(UseCaseKey.PERFORMANCE, retry);
            assertTrue(first.merge(second).getUnmappedKeys(keys).isEmpty());
        }

        @Test
        @DisplayName("Metrics flow from every layer")
        void metrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            try (MetricsIndexer metered = MetricsIndexer.builder()
                    .store(memoryStore)
                    .metricsService(new MicrometerMetricsService(registry))
                    .build()) {

                metered.record(UseCaseKey.PERFORMANCE, 1L, "a");
                metered.record(UseCaseKey.PERFORMANCE, 1L, "a");

                assertEquals(1.0, registry.find("indexer.cache.hit").counter().count());
                assertEquals(1.0, registry.find("indexer.strings.created")
                        .tag("useCase", "performance").counter().count());
                assertNotNull(registry.find("indexer.store.duration").tag("operation", "lookupMany").timer());
            }
        }
    }

    @Nested
    @DisplayName("Operations")
    class Operations {

        @Test
        @DisplayName("Health is UP with a reachable store and an enabled cache")
        void healthy() {
            HealthStatus health = indexer.health();

            assertTrue(health.isUp());
            assertTrue(health.details().containsKey("indexStore"));
            assertTrue(health.details().containsKey("cache"));
        }

        @Test
        @DisplayName("Health is DOWN when the store is unreachable")
        void storeDown() {
            store.setFailAll(true);
            assertTrue(indexer.health().isDown());
        }

        @Test
        @DisplayName("validate tolerates transient errors only")
        void validate() {
            store.setFailAll(true);
            store.setTransientFailures(true);
            assertDoesNotThrow(() -> indexer.validate());

            store.setTransientFailures(false);
            assertThrows(IndexStoreException.class, () -> indexer.validate());
        }
    }
}
