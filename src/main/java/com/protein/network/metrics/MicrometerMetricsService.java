package com.protein.network.metrics;

import com.protein.network.core.model.AnalysisStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code network.stage.duration} - Timer (tag: stage)</li>
 *   <li>{@code network.input.proteins} - DistributionSummary</li>
 *   <li>{@code network.input.interactions} - DistributionSummary</li>
 *   <li>{@code network.groups.count} - DistributionSummary</li>
 *   <li>{@code network.pairs.classified} - Counter (tag: classification)</li>
 *   <li>{@code network.analysis.failures} - Counter (tag: reason)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<AnalysisStage, Timer> stageTimers = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary proteinSummary;
    private final DistributionSummary interactionSummary;
    private final DistributionSummary groupSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.proteinSummary = DistributionSummary.builder("network.input.proteins")
                .description("Number of proteins per analysis run")
                .register(registry);
        this.interactionSummary = DistributionSummary.builder("network.input.interactions")
                .description("Number of raw interactions per analysis run")
                .register(registry);
        this.groupSummary = DistributionSummary.builder("network.groups.count")
                .description("Number of connectivity groups per analysis run")
                .register(registry);
    }

    @Override
    public void recordStageDuration(AnalysisStage stage, Duration duration) {
        Timer timer = stageTimers.computeIfAbsent(stage, s ->
                Timer.builder("network.stage.duration")
                        .description("Duration of one analysis pipeline stage")
                        .tag("stage", s.tagValue())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordInputSize(int proteins, int interactions) {
        proteinSummary.record(proteins);
        interactionSummary.record(interactions);
    }

    @Override
    public void recordGroupCount(int groups) {
        groupSummary.record(groups);
    }

    @Override
    public void recordClassifiedPairs(String classification, int count) {
        Counter counter = counterCache.computeIfAbsent("classified:" + classification, k ->
                Counter.builder("network.pairs.classified")
                        .description("Number of pairs placed in a classified table")
                        .tag("classification", classification)
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void incrementAnalysisFailure(String reason) {
        Counter counter = counterCache.computeIfAbsent("failure:" + reason, k ->
                Counter.builder("network.analysis.failures")
                        .description("Number of analysis runs aborted")
                        .tag("reason", reason)
                        .register(registry));
        counter.increment();
    }
}
