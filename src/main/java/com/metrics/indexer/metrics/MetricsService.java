package com.metrics.indexer.metrics;

import com.metrics.indexer.api.UseCaseKey;

import java.time.Duration;

/**
 * Interface for recording indexer metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics backend on the classpath.
 */
public interface MetricsService {

    void recordCacheHits(int count);

    void recordCacheMisses(int count);

    void recordCacheError(String operation);

    void incrementStringsCreated(UseCaseKey useCase, int count);

    void incrementRecordFailures(UseCaseKey useCase, int count);

    void recordBatchSize(int size);

    void recordStoreDuration(String operation, Duration duration);
}
