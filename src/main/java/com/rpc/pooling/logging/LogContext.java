package com.rpc.pooling.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forRepair(target, slot)) {
 *     log.warn("connection.repair.failed state={}", state);
 * } // MDC entries are cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for operations on a named service pool.
     */
    public static LogContext forPool(String serviceName, String target) {
        LogContext ctx = new LogContext();
        ctx.put("service", serviceName);
        ctx.put("target", target);
        ctx.put("operation", "pool");
        return ctx;
    }

    /**
     * Creates a log context for the repair of one pool slot.
     */
    public static LogContext forRepair(String target, int slot) {
        LogContext ctx = new LogContext();
        ctx.put("target", target);
        ctx.put("slot", Integer.toString(slot));
        ctx.put("operation", "repair");
        return ctx;
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
