package com.metrics.indexer.logging;

import com.metrics.indexer.api.UseCaseKey;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable wrapper around SLF4J MDC. Entries are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forBulkRecord(LogContext.newBatchId(), UseCaseKey.PERFORMANCE)) {
 *     log.info("indexer.bulk_record size={}", size);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forBulkRecord(String batchId, UseCaseKey useCase) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("useCase", useCase.value());
        ctx.put("operation", "bulk_record");
        return ctx;
    }

    public static LogContext forLookup(String operation, UseCaseKey useCase, long tenantId) {
        LogContext ctx = new LogContext();
        ctx.put("useCase", useCase.value());
        ctx.put("tenantId", Long.toString(tenantId));
        ctx.put("operation", operation);
        return ctx;
    }

    public static String newBatchId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
