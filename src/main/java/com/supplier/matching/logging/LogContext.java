package com.supplier.matching.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * AutoCloseable MDC wrapper. Entries added here are removed again on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId, "HYBRID")) {
 *     log.info("matching.run.completed groups={}", groups.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole matching run.
     */
    public static LogContext forRun(String runId, String mode) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("mode", mode);
        ctx.put("operation", "match");
        return ctx;
    }

    /**
     * Creates a log context for report export.
     */
    public static LogContext forExport(String runId, String format) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("format", format);
        ctx.put("operation", "export");
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Captures the caller's MDC so that a task run on another thread logs with the same
     * context. The worker's own MDC is restored when the task finishes.
     */
    public static <T> Callable<T> wrap(Callable<T> task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            setContext(captured);
            try {
                return task.call();
            } finally {
                setContext(previous);
            }
        };
    }

    private static void setContext(Map<String, String> context) {
        if (context != null) {
            MDC.setContextMap(context);
        } else {
            MDC.clear();
        }
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
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
