package com.property.linkage.logging;

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
 * try (LogContext ctx = LogContext.forDataset("liens.csv", "niche")) {
 *     log.info("linkage.completed matched={} inserted={}", matched, inserted);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole region run.
     */
    public static LogContext forRun(String runId, String regionKey) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("region", regionKey);
        ctx.put("operation", "run");
        return ctx;
    }

    /**
     * Creates a log context for one secondary dataset pass.
     */
    public static LogContext forDataset(String datasetName, String kind) {
        LogContext ctx = new LogContext();
        ctx.put("dataset", datasetName);
        ctx.put("datasetKind", kind);
        ctx.put("operation", "link");
        return ctx;
    }

    /**
     * Creates a log context for a registry import.
     */
    public static LogContext forImport(String inputName) {
        LogContext ctx = new LogContext();
        ctx.put("input", inputName);
        ctx.put("operation", "import");
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
