package com.metrics.indexer.cache;

import com.metrics.indexer.api.KeyCollection;
import com.metrics.indexer.api.KeyResult;
import com.metrics.indexer.api.KeyResults;
import com.metrics.indexer.api.StringIndexer;
import com.metrics.indexer.api.UseCaseKey;
import com.metrics.indexer.core.StringValidator;
import com.metrics.indexer.metrics.MetricsService;
import com.metrics.indexer.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Read-through, write-through cache around another {@link StringIndexer}.
 *
 * <p>Lookups try the cache first and fall back to the wrapped indexer,
 * caching whatever it resolves. Only resolved ids are cached; failed keys are
 * always retried against the wrapped indexer. A cache that throws is treated
 * as empty, so callers never see cache failures.</p>
 */
public class CachingIndexer implements StringIndexer {
    private static final Logger log = LoggerFactory.getLogger(CachingIndexer.class);

    private final StringIndexerCache cache;
    private final StringIndexer indexer;
    private final CacheKeys keys;
    private final MetricsService metricsService;

    public CachingIndexer(StringIndexerCache cache, StringIndexer indexer, String partitionKey) {
        this(cache, indexer, partitionKey, new NoOpMetricsService());
    }

    public CachingIndexer(StringIndexerCache cache, StringIndexer indexer, String partitionKey,
                          MetricsService metricsService) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.indexer = Objects.requireNonNull(indexer, "indexer");
        this.keys = new CacheKeys(Objects.requireNonNull(partitionKey, "partitionKey"));
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
    }

    @Override
    public KeyResults bulkRecord(UseCaseKey useCase, KeyCollection strings) {
        Map<String, KeyCollection.Key> byCacheKey = new LinkedHashMap<>();
        for (KeyCollection.Key key : strings.asTuples()) {
            byCacheKey.put(keys.forward(useCase, key.tenantId(), key.string()), key);
        }
        Map<String, Long> cached = absorb("getMany", () -> cache.getMany(byCacheKey.keySet()), Map.of());

        KeyResults cachedResults = new KeyResults();
        KeyCollection.Builder misses = KeyCollection.builder();
        byCacheKey.forEach((cacheKey, key) -> {
            Long id = cached.get(cacheKey);
            if (id != null) {
                cachedResults.addKeyResult(KeyResult.resolved(key.tenantId(), key.string(), id));
            } else {
                misses.add(key.tenantId(), key.string());
            }
        });

        KeyCollection missing = misses.build();
        metricsService.recordCacheHits(strings.size() - missing.size());
        metricsService.recordCacheMisses(missing.size());
        if (missing.isEmpty()) {
            return cachedResults;
        }

        KeyResults recorded = indexer.bulkRecord(useCase, missing);
        Map<String, Long> toCache = new LinkedHashMap<>();
        for (KeyResult result : recorded.all()) {
            if (result.isResolved()) {
                toCache.put(keys.forward(useCase, result.tenantId(), result.string()), result.id());
            }
        }
        if (!toCache.isEmpty()) {
            absorb("setMany", () -> {
                cache.setMany(toCache);
                return null;
            }, null);
        }
        return cachedResults.merge(recorded);
    }

    @Override
    public OptionalLong record(UseCaseKey useCase, long tenantId, String string) {
        Objects.requireNonNull(string, "string");
        return bulkRecord(useCase, KeyCollection.of(tenantId, Set.of(string))).getId(tenantId, string);
    }

    @Override
    public OptionalLong resolve(UseCaseKey useCase, long tenantId, String string) {
        if (!StringValidator.isIndexable(string)) {
            // never recorded, and null would share a key with "null"
            return OptionalLong.empty();
        }
        String cacheKey = keys.forward(useCase, tenantId, string);
        Optional<Long> cached = absorb("get", () -> cache.get(cacheKey), Optional.empty());
        if (cached.isPresent()) {
            metricsService.recordCacheHits(1);
            return OptionalLong.of(cached.get());
        }
        metricsService.recordCacheMisses(1);

        OptionalLong id = indexer.resolve(useCase, tenantId, string);
        if (id.isPresent()) {
            absorb("set", () -> {
                cache.set(cacheKey, id.getAsLong());
                return null;
            }, null);
        }
        return id;
    }

    @Override
    public Optional<String> reverseResolve(UseCaseKey useCase, long tenantId, long id) {
        String cacheKey = keys.reverse(useCase, tenantId, id);
        Optional<String> cached = absorb("getReverse", () -> cache.getReverse(cacheKey), Optional.empty());
        if (cached.isPresent()) {
            metricsService.recordCacheHits(1);
            return cached;
        }
        metricsService.recordCacheMisses(1);

        Optional<String> string = indexer.reverseResolve(useCase, tenantId, id);
        string.ifPresent(s -> absorb("setReverse", () -> {
            cache.setReverse(cacheKey, s);
            return null;
        }, null));
        return string;
    }

    public StringIndexer getIndexer() {
        return indexer;
    }

    public StringIndexerCache getCache() {
        return cache;
    }

    private <T> T absorb(String operation, Supplier<T> call, T fallback) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            metricsService.recordCacheError(operation);
            log.warn("Cache {} failed, falling back to the indexer: {}", operation, e.getMessage());
            return fallback;
        }
    }
}
