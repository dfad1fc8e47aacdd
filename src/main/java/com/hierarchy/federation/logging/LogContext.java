package com.hierarchy.federation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCycle(cycleId)) {
 *     log.info("cycle.published version={}", version);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for one ingestion and resolution cycle.
     */
    public static LogContext forCycle(String cycleId) {
        LogContext ctx = new LogContext();
        ctx.put("cycleId", cycleId);
        ctx.put("operation", "cycle");
        return ctx;
    }

    /**
     * Context for pulling and normalizing one source snapshot.
     * Meant to be opened inside a cycle context, whose keys it leaves in place.
     */
    public static LogContext forSource(String sourceSystem) {
        LogContext ctx = new LogContext();
        ctx.put("sourceSystem", sourceSystem);
        return ctx;
    }

    public static String generateCycleId() {
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
