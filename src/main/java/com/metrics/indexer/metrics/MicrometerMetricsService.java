package com.metrics.indexer.metrics;

import com.metrics.indexer.api.UseCaseKey;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code indexer.cache.hit} / {@code indexer.cache.miss}: Counter</li>
 *   <li>{@code indexer.cache.error}: Counter (tag: operation)</li>
 *   <li>{@code indexer.strings.created}: Counter (tag: useCase)</li>
 *   <li>{@code indexer.record.failed}: Counter (tag: useCase)</li>
 *   <li>{@code indexer.batch.size}: DistributionSummary</li>
 *   <li>{@code indexer.store.duration}: Timer (tag: operation)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary batchSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.batchSizeSummary = DistributionSummary.builder("indexer.batch.size")
                .description("Number of (tenant, string) pairs per bulk record call")
                .register(registry);
        this.cacheHitCounter = Counter.builder("indexer.cache.hit")
                .description("Number of indexer cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("indexer.cache.miss")
                .description("Number of indexer cache misses")
                .register(registry);
    }

    @Override
    public void recordCacheHits(int count) {
        cacheHitCounter.increment(count);
    }

    @Override
    public void recordCacheMisses(int count) {
        cacheMissCounter.increment(count);
    }

    @Override
    public void recordCacheError(String operation) {
        counter("cacheError:" + operation, "indexer.cache.error", "Cache operations that failed",
                "operation", operation).increment();
    }

    @Override
    public void incrementStringsCreated(UseCaseKey useCase, int count) {
        counter("created:" + useCase.name(), "indexer.strings.created", "Strings assigned a new id",
                "useCase", useCase.value()).increment(count);
    }

    @Override
    public void incrementRecordFailures(UseCaseKey useCase, int count) {
        counter("failed:" + useCase.name(), "indexer.record.failed", "Keys that failed to record",
                "useCase", useCase.value()).increment(count);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordStoreDuration(String operation, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(operation, k ->
                Timer.builder("indexer.store.duration")
                        .description("Duration of backing store calls")
                        .tag("operation", operation)
                        .register(registry));
        timer.record(duration);
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
