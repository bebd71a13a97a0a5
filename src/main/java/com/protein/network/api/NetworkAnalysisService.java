package com.protein.network.api;

import com.protein.network.core.DuplicateProteinException;
import com.protein.network.core.InvalidInteractionException;
import com.protein.network.core.MalformedIdentifierException;
import com.protein.network.core.PairUniverseTooLargeException;
import com.protein.network.core.model.AnalysisStage;
import com.protein.network.core.model.ConnectivityGroups;
import com.protein.network.core.model.InteractionEdge;
import com.protein.network.core.model.JoinedPair;
import com.protein.network.core.model.ProteinPair;
import com.protein.network.graph.ConnectivityEngine;
import com.protein.network.graph.EdgeNormalizer;
import com.protein.network.logging.LogContext;
import com.protein.network.metrics.MetricsService;
import com.protein.network.metrics.NoOpMetricsService;
import com.protein.network.pairs.AttributeJoiner;
import com.protein.network.pairs.KnownInteractions;
import com.protein.network.pairs.PairClassifier;
import com.protein.network.pairs.PairUniverseGenerator;
import com.protein.network.tracing.NoOpTracingService;
import com.protein.network.tracing.Span;
import com.protein.network.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs the analysis pipeline start to finish:
 * raw interactions, canonical edges, connectivity groups, pair universe,
 * joined pair table, classified subsets.
 *
 * <p>Each stage consumes the previous stage's immutable output and produces a new one.
 * Every run gets a fresh run id that is put in the MDC and on each stage span.</p>
 */
public class NetworkAnalysisService {
    private static final Logger log = LoggerFactory.getLogger(NetworkAnalysisService.class);

    static final String UNOBSERVED_CROSS_COMPARTMENT = "unobserved-cross-compartment";
    static final String CROSS_GROUP_CROSS_COMPARTMENT = "cross-group-cross-compartment";
    static final String UNOBSERVED = "unobserved";
    static final String CROSS_COMPARTMENT = "cross-compartment";

    private final AnalysisOptions options;
    private final EdgeNormalizer normalizer;
    private final ConnectivityEngine connectivityEngine;
    private final PairUniverseGenerator pairGenerator;
    private final AttributeJoiner attributeJoiner;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public NetworkAnalysisService(AnalysisOptions options) {
        this(options, new NoOpMetricsService(), new NoOpTracingService());
    }

    public NetworkAnalysisService(AnalysisOptions options,
                                  MetricsService metricsService,
                                  TracingService tracingService) {
        this.options = Objects.requireNonNull(options, "options is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.tracingService = Objects.requireNonNull(tracingService, "tracingService is required");
        this.normalizer = new EdgeNormalizer(options.getEdgeValidationPolicy());
        this.connectivityEngine = new ConnectivityEngine();
        this.pairGenerator = new PairUniverseGenerator(options.getMaxPairs());
        this.attributeJoiner = new AttributeJoiner();
    }

    /**
     * Analyzes the input with the configured options.
     *
     * @throws MalformedIdentifierException   if an interaction names a protein without digits
     * @throws InvalidInteractionException    on self or duplicate edges under strict validation
     * @throws DuplicateProteinException      if the protein list repeats an identifier
     * @throws PairUniverseTooLargeException  if the pair universe exceeds the configured limit
     */
    public AnalysisResult analyze(AnalysisInput input) {
        Objects.requireNonNull(input, "input is required");
        String runId = LogContext.generateRunId();

        try (LogContext ctx = LogContext.forAnalysis(runId)) {
            log.info("analysis.started proteins={} interactions={} compartments={} options={}",
                    input.proteins().size(), input.interactions().size(),
                    input.compartments().size(), options);
            metricsService.recordInputSize(input.proteins().size(), input.interactions().size());

            try {
                AnalysisResult result = runPipeline(runId, input);
                log.info("analysis.completed result={}", result);
                return result;
            } catch (MalformedIdentifierException e) {
                metricsService.incrementAnalysisFailure("malformed-identifier");
                log.error("analysis.failed reason=malformed-identifier identifier='{}'", e.getIdentifier());
                throw e;
            } catch (InvalidInteractionException e) {
                metricsService.incrementAnalysisFailure("invalid-interaction");
                log.error("analysis.failed reason=invalid-interaction error={}", e.getMessage());
                throw e;
            } catch (DuplicateProteinException e) {
                metricsService.incrementAnalysisFailure("duplicate-protein");
                log.error("analysis.failed reason=duplicate-protein protein='{}'", e.getProtein());
                throw e;
            } catch (PairUniverseTooLargeException e) {
                metricsService.incrementAnalysisFailure("pair-universe-too-large");
                log.error("analysis.failed reason=pair-universe-too-large pairs={} limit={}",
                        e.getRequestedPairs(), e.getMaxPairs());
                throw e;
            }
        }
    }

    private AnalysisResult runPipeline(String runId, AnalysisInput input) {
        List<InteractionEdge> edges = runStage(AnalysisStage.NORMALIZE_EDGES, runId,
                () -> normalizer.normalizeAll(input.interactions()));

        ConnectivityGroups groups = runStage(AnalysisStage.BUILD_GROUPS, runId,
                () -> connectivityEngine.build(edges));
        metricsService.recordGroupCount(groups.size());
        log.debug("analysis.groups count={} entities={}", groups.size(), groups.entities().size());

        List<ProteinPair> pairs = runStage(AnalysisStage.GENERATE_PAIRS, runId,
                () -> pairGenerator.generate(input.proteins()));

        List<JoinedPair> joined = runStage(AnalysisStage.JOIN_ATTRIBUTES, runId,
                () -> attributeJoiner.join(pairs, input.compartments(), groups.groupIdMap()));

        PairClassifier classifier = new PairClassifier(
                new KnownInteractions(edges), options.isParallelClassification());
        AnalysisResult.ClassifiedPairs tables = runStage(AnalysisStage.CLASSIFY_PAIRS, runId,
                () -> new AnalysisResult.ClassifiedPairs(
                        classifier.unobservedCrossCompartment(joined),
                        classifier.crossGroupCrossCompartment(joined),
                        classifier.unobserved(joined),
                        classifier.crossCompartment(joined)));
        metricsService.recordClassifiedPairs(UNOBSERVED_CROSS_COMPARTMENT, tables.unobservedCrossCompartment().size());
        metricsService.recordClassifiedPairs(CROSS_GROUP_CROSS_COMPARTMENT, tables.crossGroupCrossCompartment().size());
        metricsService.recordClassifiedPairs(UNOBSERVED, tables.unobserved().size());
        metricsService.recordClassifiedPairs(CROSS_COMPARTMENT, tables.crossCompartment().size());

        return new AnalysisResult(runId, input.proteins().size(), edges, groups, joined, tables);
    }

    private <T> T runStage(AnalysisStage stage, String runId, Supplier<T> work) {
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forStage(stage);
             Span span = tracingService.startStage(stage, runId)) {
            try {
                T result = work.get();
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            } finally {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                metricsService.recordStageDuration(stage, elapsed);
                log.debug("stage.completed stage={} elapsedMs={}", stage.tagValue(), elapsed.toMillis());
            }
        }
    }

    public AnalysisOptions getOptions() {
        return options;
    }
}
