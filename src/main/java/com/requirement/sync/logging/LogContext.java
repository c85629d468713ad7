package com.requirement.sync.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forModule(correlationId, moduleId)) {
 *     log.info("changeset.module.finished actions={}", actions.size());
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String MODULE_ID = "moduleId";
    public static final String OPERATION = "operation";
    public static final String TRACKER_NAME = "trackerName";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for the reconciliation of one module.
     */
    public static LogContext forModule(String correlationId, String moduleId) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(MODULE_ID, moduleId);
        ctx.put(OPERATION, "reconcile");
        return ctx;
    }

    public static String generateCorrelationId() {
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
