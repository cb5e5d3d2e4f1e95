package com.property.reconciliation.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging. On close every key gets
 * back the value it had before, so contexts can nest on one thread.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forBatch(batchId, "BOOKINGS", "create")) {
 *     log.info("import.started rows={}", rows.size());
 * }
 * </pre>
 *
 * <p>MDC is thread-local: chunk workers open their own context with
 * {@link #forRow(Map, int)} from a copy taken on the batch thread.</p>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forBatch(String batchId, String importTarget, String mode) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("importTarget", importTarget);
        ctx.put("importMode", mode);
        ctx.put("operation", "import");
        return ctx;
    }

    /**
     * Restores the batch entries captured by {@link #capture()} on a worker
     * thread and adds the row number.
     */
    public static LogContext forRow(Map<String, String> batchContext, int rowNumber) {
        LogContext ctx = new LogContext();
        if (batchContext != null) {
            batchContext.forEach(ctx::put);
        }
        ctx.put("rowNumber", Integer.toString(rowNumber));
        return ctx;
    }

    public static LogContext forBooking(String bookingId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("bookingId", bookingId != null ? bookingId : "new");
        ctx.put("operation", operation);
        return ctx;
    }

    public static Map<String, String> capture() {
        Map<String, String> copy = MDC.getCopyOfContextMap();
        return copy != null ? copy : Map.of();
    }

    public static String generateBatchId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value != null) {
                MDC.put(key, value);
            } else {
                MDC.remove(key);
            }
        });
        previous.clear();
    }
}
