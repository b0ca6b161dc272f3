package com.prime.client.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and restores the previous values on close,
 * so contexts can be nested.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forFetch(correlationId, "Devices")) {
 *     log.info("fetch.completed records={}", count);
 * } // MDC entries are restored
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a paginated data fetch.
     */
    public static LogContext forFetch(String correlationId, String resource) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("resource", resource);
        ctx.put("operation", "fetch");
        return ctx;
    }

    /**
     * Creates a log context for a single service call.
     */
    public static LogContext forService(String correlationId, String resource) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("resource", resource);
        ctx.put("operation", "service");
        return ctx;
    }

    /**
     * Creates a log context for catalog discovery.
     */
    public static LogContext forCatalog(String listing) {
        LogContext ctx = new LogContext();
        ctx.put("listing", listing);
        ctx.put("operation", "catalog");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Wraps a task so it runs with the MDC of the thread that created it.
     * Used to carry the caller's context onto page worker threads.
     */
    public static <T> Callable<T> propagate(Callable<T> task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> original = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            } else {
                MDC.clear();
            }
            try {
                return task.call();
            } finally {
                if (original != null) {
                    MDC.setContextMap(original);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
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
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() != null) {
                MDC.put(entry.getKey(), entry.getValue());
            } else {
                MDC.remove(entry.getKey());
            }
        }
        previous.clear();
    }
}
