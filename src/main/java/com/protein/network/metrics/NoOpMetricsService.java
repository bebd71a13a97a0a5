package com.protein.network.metrics;

import com.protein.network.core.model.AnalysisStage;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStageDuration(AnalysisStage stage, Duration duration) {
    }

    @Override
    public void recordInputSize(int proteins, int interactions) {
    }

    @Override
    public void recordGroupCount(int groups) {
    }

    @Override
    public void recordClassifiedPairs(String classification, int count) {
    }

    @Override
    public void incrementAnalysisFailure(String reason) {
    }
}
