package com.libran.dictionary.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and, on close, restores whatever values those
 * keys had before, so a stage context nested in a run context leaves the run keys intact.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId)) {
 *     try (LogContext stage = LogContext.forStage(runId, "qa")) {
 *         log.info("qa.completed overallScore={}", score);
 *     }
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    // key -> value before this context, null if absent
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole pipeline run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "pipeline");
        return ctx;
    }

    /**
     * Creates a log context for one stage of a run (merge, qa, audit, lifecycle, report).
     */
    public static LogContext forStage(String runId, String stage) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("stage", stage);
        return ctx;
    }

    /**
     * Creates a log context for processing one fragment.
     */
    public static LogContext forFragment(String fragmentName) {
        LogContext ctx = new LogContext();
        ctx.put("fragment", fragmentName);
        return ctx;
    }

    /**
     * Generates a unique run id.
     */
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
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> e : previous.entrySet()) {
            if (e.getValue() == null) {
                MDC.remove(e.getKey());
            } else {
                MDC.put(e.getKey(), e.getValue());
            }
        }
        previous.clear();
    }
}
