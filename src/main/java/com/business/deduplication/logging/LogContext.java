package com.business.deduplication.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC scope for structured logging.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forBatch(batchId, records.size())) {
 *     log.info("batch.completed groups={}", groups.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final List<String> previous = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a single-record duplicate search.
     */
    public static LogContext forSearch(String correlationId, String recordId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("recordId", String.valueOf(recordId));
        ctx.put("operation", "findDuplicates");
        return ctx;
    }

    public static LogContext forBatch(String batchId, int size) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("batchSize", Integer.toString(size));
        ctx.put("operation", "deduplicateBatch");
        return ctx;
    }

    public static LogContext forMerge(String correlationId, String primaryId, String strategy) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("primaryId", primaryId);
        ctx.put("mergeStrategy", strategy);
        ctx.put("operation", "merge");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        previous.add(MDC.get(key));
        MDC.put(key, value);
    }

    /**
     * Removes the keys added by this scope, restoring values of an enclosing scope.
     */
    @Override
    public void close() {
        for (int i = keys.size() - 1; i >= 0; i--) {
            String earlier = previous.get(i);
            if (earlier != null) {
                MDC.put(keys.get(i), earlier);
            } else {
                MDC.remove(keys.get(i));
            }
        }
        keys.clear();
        previous.clear();
    }
}
