package com.protein.network.tracing;

import com.protein.network.core.model.AnalysisStage;

import java.util.Map;

/**
 * Tracing integration for analysis runs.
 * The default {@link NoOpTracingService} does nothing.
 */
public interface TracingService {

    String SPAN_PREFIX = "network.";

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Opens the span of one pipeline stage, named {@code network.<stage>} and tagged
     * with the run id.
     */
    default Span startStage(AnalysisStage stage, String runId) {
        return startSpan(SPAN_PREFIX + stage.tagValue(), Map.of("runId", runId, "stage", stage.name()));
    }
}
