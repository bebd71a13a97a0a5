package com.protein.network.metrics;

import com.protein.network.core.model.AnalysisStage;

import java.time.Duration;

/**
 * Records metrics for analysis runs.
 * The default {@link NoOpMetricsService} does nothing, so the analyzer runs without
 * any metrics backend configured.
 */
public interface MetricsService {

    void recordStageDuration(AnalysisStage stage, Duration duration);

    void recordInputSize(int proteins, int interactions);

    void recordGroupCount(int groups);

    void recordClassifiedPairs(String classification, int count);

    void incrementAnalysisFailure(String reason);
}
