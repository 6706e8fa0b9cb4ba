package com.metrics.indexer.tracing;

/**
 * A unit of work in a distributed trace. Ends when closed, so it fits
 * try-with-resources:
 *
 * <pre>
 * try (Span span = tracingService.startSpan("indexer.bulk_record")) {
 *     span.setAttribute("useCase", "performance");
 *     // ... do work ...
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
