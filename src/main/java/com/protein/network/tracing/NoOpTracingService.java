package com.protein.network.tracing;

import com.protein.network.core.model.AnalysisStage;

import java.util.Map;

/**
 * Default {@link TracingService} for runs without a tracer. Stage spans are the same
 * inert instance, so a run allocates nothing for tracing.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return InertSpan.INSTANCE;
    }

    @Override
    public Span startStage(AnalysisStage stage, String runId) {
        return InertSpan.INSTANCE;
    }

    private enum InertSpan implements Span {
        INSTANCE;

        @Override
        public void setAttribute(String key, String value) {
            // no-op
        }

        @Override
        public void setAttribute(String key, long value) {
            // no-op
        }

        @Override
        public void setStatus(SpanStatus status) {
            // no-op
        }

        @Override
        public void recordException(Throwable t) {
            // no-op
        }

        @Override
        public void close() {
            // no-op
        }
    }
}
