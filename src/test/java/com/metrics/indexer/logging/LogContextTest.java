package com.metrics.indexer.logging;

import com.metrics.indexer.api.UseCaseKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forBulkRecord should set batchId, useCase and operation in MDC")
    void forBulkRecordSetsMDC() {
        try (LogContext ctx = LogContext.forBulkRecord("batch-1", UseCaseKey.RELEASE_HEALTH)) {
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("release-health", MDC.get("useCase"));
            assertEquals("bulk_record", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forLookup should set tenantId and the given operation")
    void forLookupSetsMDC() {
        try (LogContext ctx = LogContext.forLookup("resolve", UseCaseKey.PERFORMANCE, 42L)) {
            assertEquals("42", MDC.get("tenantId"));
            assertEquals("performance", MDC.get("useCase"));
            assertEquals("resolve", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("close should remove every key it added, including with() ones")
    void closeRemovesKeys() {
        try (LogContext ctx = LogContext.forBulkRecord("batch-2", UseCaseKey.PERFORMANCE).with("store", "in-memory")) {
            assertEquals("in-memory", MDC.get("store"));
        }

        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("useCase"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("store"));
    }

    @Test
    @DisplayName("Keys set outside the context survive close")
    void foreignKeysSurvive() {
        MDC.put("requestId", "r-1");
        try (LogContext ctx = LogContext.forLookup("reverse_resolve", UseCaseKey.PERFORMANCE, 1L)) {
            assertEquals("r-1", MDC.get("requestId"));
        }
        assertEquals("r-1", MDC.get("requestId"));
    }

    @Test
    @DisplayName("newBatchId should produce unique ids")
    void uniqueBatchIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.newBatchId());
        }
        assertEquals(100, ids.size());
    }
}
