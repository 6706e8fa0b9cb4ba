package com.metrics.indexer.tracing;

import com.metrics.indexer.api.KeyCollection;
import com.metrics.indexer.api.UseCaseKey;
import com.metrics.indexer.codec.IdCodec;
import com.metrics.indexer.codec.IdGenerator;
import com.metrics.indexer.core.StoreBackedStringIndexer;
import com.metrics.indexer.metrics.NoOpMetricsService;
import com.metrics.indexer.store.InMemoryIndexStore;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan("indexer.bulk_record", Map.of("useCase", "performance"))) {
                    span.setAttribute("size", 42L);
                    span.setStatus(Span.SpanStatus.OK);
                    span.recordException(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("Should return same singleton span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan("op1"), noOp.startSpan("op2"));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private io.opentelemetry.api.trace.Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Should pass initial attributes to the span builder")
        void initialAttributes() {
            service.startSpan("indexer.validate", Map.of("store", "in-memory"));

            verify(tracer).spanBuilder("indexer.validate");
            verify(builder).setAttribute("store", "in-memory");
        }

        @Test
        @DisplayName("Should map span status and end on close")
        void statusAndClose() {
            try (Span span = service.startSpan("op")) {
                span.setAttribute("size", 3L);
                span.setStatus(Span.SpanStatus.ERROR);
            }

            verify(otelSpan).setAttribute("size", 3L);
            verify(otelSpan).setStatus(StatusCode.ERROR);
            verify(otelSpan).end();
        }

        @Test
        @DisplayName("Should record exceptions")
        void recordException() {
            RuntimeException ex = new RuntimeException("boom");
            service.startSpan("op").recordException(ex);

            verify(otelSpan).recordException(ex);
        }
    }

    @Test
    @DisplayName("bulkRecord runs inside a span that is closed with OK status")
    void bulkRecordIsTraced() {
        TracingService tracing = mock(TracingService.class);
        Span span = mock(Span.class);
        when(tracing.startSpan(eq("indexer.bulk_record"), anyMap())).thenReturn(span);

        StoreBackedStringIndexer indexer = new StoreBackedStringIndexer(new InMemoryIndexStore(),
                new IdCodec(), new IdGenerator(), new NoOpMetricsService(), tracing);
        indexer.bulkRecord(UseCaseKey.PERFORMANCE, KeyCollection.of(1L, Set.of("a", "b")));

        verify(span).setAttribute("size", 2L);
        verify(span).setStatus(Span.SpanStatus.OK);
        verify(span).close();
    }
}
