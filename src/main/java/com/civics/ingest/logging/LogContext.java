package com.civics.ingest.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable wrapper over the SLF4J MDC. Keys added through this context are removed
 * again on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forProvider(runId, "federal")) {
 *     log.info("provider.fetch.completed records={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId, String mode) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("mode", mode);
        ctx.put("operation", "ingest");
        return ctx;
    }

    public static LogContext forProvider(String runId, String provider) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("provider", provider);
        ctx.put("operation", "fetch");
        return ctx;
    }

    public static LogContext forEntity(String runId, String canonicalId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("canonicalId", canonicalId);
        ctx.put("operation", "write");
        return ctx;
    }

    public static String generateRunId() {
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
