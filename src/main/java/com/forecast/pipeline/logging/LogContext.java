package com.forecast.pipeline.logging;

import com.forecast.pipeline.core.model.CompositeKey;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and restores the previous values on close,
 * so contexts opened by nested stage computations do not clobber the outer one.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forStage("forecastScaleCap", "capped_forecast", key)) {
 *     log.debug("stage.computed size={}", series.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    // Previous MDC value per key, null where the key was unset
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one stage output computation.
     */
    public static LogContext forStage(String stageName, String attribute, CompositeKey key) {
        LogContext ctx = new LogContext();
        ctx.put("stage", stageName);
        ctx.put("attribute", attribute);
        ctx.put("key", key.toString());
        ctx.put("operation", "compute");
        return ctx;
    }

    /**
     * Creates a log context for a cache invalidation.
     */
    public static LogContext forInvalidation(String scope) {
        LogContext ctx = new LogContext();
        ctx.put("invalidationId", UUID.randomUUID().toString());
        ctx.put("scope", scope);
        ctx.put("operation", "invalidate");
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
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}
