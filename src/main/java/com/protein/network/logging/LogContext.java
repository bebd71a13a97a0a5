package com.protein.network.logging;

import com.protein.network.core.model.AnalysisStage;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable wrapper around the SLF4J MDC for structured logging of analysis runs.
 * Keys added through a context are removed again when it is closed.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forAnalysis(runId)) {
 *     log.info("analysis.started proteins={}", proteins.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forAnalysis(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "analyze");
        return ctx;
    }

    /**
     * Adds only the stage key, so it can be nested inside {@link #forAnalysis(String)}
     * without clearing the run id on close.
     */
    public static LogContext forStage(AnalysisStage stage) {
        LogContext ctx = new LogContext();
        ctx.put("stage", stage.tagValue());
        return ctx;
    }

    public static LogContext forImport(String source) {
        LogContext ctx = new LogContext();
        ctx.put("source", source);
        ctx.put("operation", "import");
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
