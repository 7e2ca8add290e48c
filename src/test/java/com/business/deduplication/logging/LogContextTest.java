package com.business.deduplication.logging;

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
    @DisplayName("forSearch should set correlationId, recordId and operation in MDC")
    void forSearchSetsMDC() {
        try (LogContext ctx = LogContext.forSearch("corr-123", "b-1")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("b-1", MDC.get("recordId"));
            assertEquals("findDuplicates", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forBatch should set batchId, batchSize and operation in MDC")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch("batch-456", 250)) {
            assertEquals("batch-456", MDC.get("batchId"));
            assertEquals("250", MDC.get("batchSize"));
            assertEquals("deduplicateBatch", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forMerge should set primaryId, mergeStrategy and operation in MDC")
    void forMergeSetsMDC() {
        try (LogContext ctx = LogContext.forMerge("corr-789", "b-1", "quality")) {
            assertEquals("corr-789", MDC.get("correlationId"));
            assertEquals("b-1", MDC.get("primaryId"));
            assertEquals("quality", MDC.get("mergeStrategy"));
            assertEquals("merge", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        try (LogContext ctx = LogContext.forSearch("corr-123", null)) {
            assertEquals("null", MDC.get("recordId"));
        }

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("recordId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Closing a nested scope should restore the enclosing values")
    void nestedScopesRestore() {
        try (LogContext batch = LogContext.forBatch("batch-1", 10)) {
            try (LogContext merge = LogContext.forMerge("corr-1", "b-1", "comprehensive")) {
                assertEquals("merge", MDC.get("operation"));
                assertEquals("batch-1", MDC.get("batchId"));
            }
            assertEquals("deduplicateBatch", MDC.get("operation"));
            assertNull(MDC.get("primaryId"));
        }
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with() should add additional keys to MDC")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forSearch("corr-123", "b-1").with("candidateCount", "7")) {
            assertEquals("7", MDC.get("candidateCount"));
        }
        assertNull(MDC.get("candidateCount"));
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique values")
    void uniqueCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
