package com.metrics.indexer.metrics;

import com.metrics.indexer.api.UseCaseKey;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheHits(int count) {
    }

    @Override
    public void recordCacheMisses(int count) {
    }

    @Override
    public void recordCacheError(String operation) {
    }

    @Override
    public void incrementStringsCreated(UseCaseKey useCase, int count) {
    }

    @Override
    public void incrementRecordFailures(UseCaseKey useCase, int count) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordStoreDuration(String operation, Duration duration) {
    }
}
