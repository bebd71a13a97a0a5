package com.protein.network.tracing;

/**
 * A traced unit of work, typically one pipeline stage. Closing the span ends it.
 *
 * <pre>
 * try (Span span = tracingService.startStage(AnalysisStage.BUILD_GROUPS, runId)) {
 *     span.setAttribute("groups", groups.size());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
