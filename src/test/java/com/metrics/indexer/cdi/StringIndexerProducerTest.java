package com.metrics.indexer.cdi;

import com.metrics.indexer.cache.CacheConfig;
import com.metrics.indexer.metrics.MicrometerMetricsService;
import com.metrics.indexer.metrics.NoOpMetricsService;
import com.metrics.indexer.tracing.NoOpTracingService;
import com.metrics.indexer.tracing.OpenTelemetryTracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StringIndexerProducerTest {

    private StringIndexerProducer producer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        producer = new StringIndexerProducer();
        producer.cacheEnabled = true;
        producer.cacheMaxSize = 500;
        producer.cacheTtlSeconds = 60;
        producer.cachePartitionKey = "rh";
        producer.meterRegistry = mock(Instance.class);
        producer.tracer = mock(Instance.class);
    }

    @Test
    @DisplayName("Cache settings map onto CacheConfig")
    void cacheConfig() {
        assertEquals(new CacheConfig(500, 60, true, "rh"), producer.cacheConfig());
    }

    @Test
    @DisplayName("Invalid cache settings fail fast")
    void invalidCacheConfig() {
        producer.cachePartitionKey = "a:b";
        assertThrows(IllegalArgumentException.class, () -> producer.cacheConfig());
    }

    @Test
    @DisplayName("Without observability beans the no-op services are used")
    void noOpServices() {
        when(producer.meterRegistry.isResolvable()).thenReturn(false);
        when(producer.tracer.isResolvable()).thenReturn(false);

        assertInstanceOf(NoOpMetricsService.class, producer.metricsService());
        assertInstanceOf(NoOpTracingService.class, producer.tracingService());
    }

    @Test
    @DisplayName("A MeterRegistry and a Tracer are picked up when present")
    void observabilityBeans() {
        MeterRegistry registry = new SimpleMeterRegistry();
        when(producer.meterRegistry.isResolvable()).thenReturn(true);
        when(producer.meterRegistry.get()).thenReturn(registry);
        when(producer.tracer.isResolvable()).thenReturn(true);
        when(producer.tracer.get()).thenReturn(mock(Tracer.class));

        assertInstanceOf(MicrometerMetricsService.class, producer.metricsService());
        assertInstanceOf(OpenTelemetryTracingService.class, producer.tracingService());
        assertNotNull(registry.find("indexer.batch.size").summary());
    }
}
