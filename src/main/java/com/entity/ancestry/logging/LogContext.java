package com.entity.ancestry.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them again on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(correlationId, "shapes", "Circle")) {
 *     log.info("ancestors.resolved chainLength={}", chain.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for ancestor resolution against a catalog.
     */
    public static LogContext forResolution(String correlationId, String catalog, String entity) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("catalog", catalog);
        ctx.put("entity", entity);
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Context for catalog registrations.
     */
    public static LogContext forRegistration(String catalog) {
        LogContext ctx = new LogContext();
        ctx.put("catalog", catalog);
        ctx.put("operation", "register");
        return ctx;
    }

    /**
     * Context for per-ancestor dispatch of one instance.
     */
    public static LogContext forDispatch(String entity) {
        LogContext ctx = new LogContext();
        ctx.put("entity", entity);
        ctx.put("operation", "dispatch");
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
