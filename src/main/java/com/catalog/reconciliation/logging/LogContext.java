package com.catalog.reconciliation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close. Contexts nest: a key
 * that was already set when this context opened gets its outer value back on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCollection(runId, "services")) {
 *     log.info("reconcile.collection.completed matched={} new={}", matched, created);
 * }
 * </pre>
 *
 * <p>MDC is thread-local; concurrent collection passes each open their own context.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final Map<String, String> previous = new HashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole reconciliation run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "reconcile");
        return ctx;
    }

    /**
     * Creates a log context for reconciling one collection.
     */
    public static LogContext forCollection(String runId, String collection) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("collection", collection);
        ctx.put("operation", "reconcile-collection");
        return ctx;
    }

    /**
     * Creates a log context for the cascading reference rewrite.
     */
    public static LogContext forRewrite(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "rewrite");
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!keys.contains(key)) {
            keys.add(key);
            String outer = MDC.get(key);
            if (outer != null) {
                previous.put(key, outer);
            }
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            String outer = previous.get(key);
            if (outer != null) {
                MDC.put(key, outer);
            } else {
                MDC.remove(key);
            }
        }
        keys.clear();
        previous.clear();
    }
}
