package com.metrics.indexer.cdi;

import com.metrics.indexer.api.MetricsIndexer;
import com.metrics.indexer.cache.CacheConfig;
import com.metrics.indexer.metrics.MetricsService;
import com.metrics.indexer.metrics.MicrometerMetricsService;
import com.metrics.indexer.metrics.NoOpMetricsService;
import com.metrics.indexer.tracing.NoOpTracingService;
import com.metrics.indexer.tracing.OpenTelemetryTracingService;
import com.metrics.indexer.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires a {@link MetricsIndexer} from MicroProfile Config properties.
 *
 * <pre>
 * metrics-indexer:
 *   falkordb:
 *     host: localhost
 *     port: 6379
 *     graph-name: metrics-indexer
 *   cache:
 *     enabled: true
 *     max-size: 100000
 *     ttl-seconds: 7200
 *     partition-key: fs
 *   static-strings:
 *     enabled: true
 * </pre>
 *
 * <p>The produced bean also satisfies injection points of type
 * {@link com.metrics.indexer.api.StringIndexer}. A {@link MeterRegistry} or an
 * OpenTelemetry {@link Tracer} bean, when the container has one, is picked up
 * for metrics and tracing.</p>
 */
@ApplicationScoped
public class StringIndexerProducer {

    private static final Logger log = LoggerFactory.getLogger(StringIndexerProducer.class);

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "metrics-indexer.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "metrics-indexer.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "metrics-indexer.falkordb.graph-name", defaultValue = "metrics-indexer")
    String falkordbGraphName;

    @Inject
    @ConfigProperty(name = "metrics-indexer.falkordb.validate-on-start", defaultValue = "true")
    boolean validateOnStart;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "metrics-indexer.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "metrics-indexer.cache.max-size", defaultValue = "100000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "metrics-indexer.cache.ttl-seconds", defaultValue = "7200")
    int cacheTtlSeconds;

    @Inject
    @ConfigProperty(name = "metrics-indexer.cache.partition-key", defaultValue = "fs")
    String cachePartitionKey;

    // ── Static strings ────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "metrics-indexer.static-strings.enabled", defaultValue = "true")
    boolean staticStringsEnabled;

    // ── Observability ─────────────────────────────────────────

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<Tracer> tracer;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public MetricsIndexer metricsIndexer() {
        log.info("Producing MetricsIndexer: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
        return MetricsIndexer.builder()
                .falkorDB(falkordbHost, falkordbPort, falkordbGraphName)
                .cacheConfig(cacheConfig())
                .staticStrings(staticStringsEnabled)
                .metricsService(metricsService())
                .tracingService(tracingService())
                .validateOnStart(validateOnStart)
                .build();
    }

    public void closeIndexer(@Disposes MetricsIndexer indexer) {
        log.info("Closing MetricsIndexer");
        indexer.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    CacheConfig cacheConfig() {
        return new CacheConfig(cacheMaxSize, cacheTtlSeconds, cacheEnabled, cachePartitionKey);
    }

    MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Recording indexer metrics with Micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }

    TracingService tracingService() {
        if (tracer != null && tracer.isResolvable()) {
            log.info("Tracing indexer operations with OpenTelemetry");
            return new OpenTelemetryTracingService(tracer.get());
        }
        return new NoOpTracingService();
    }
}
