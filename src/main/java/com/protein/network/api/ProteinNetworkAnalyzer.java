package com.protein.network.api;

import com.protein.network.metrics.MetricsService;
import com.protein.network.metrics.NoOpMetricsService;
import com.protein.network.tracing.NoOpTracingService;
import com.protein.network.tracing.TracingService;

/**
 * Main entry point of the library.
 *
 * <pre>
 * ProteinNetworkAnalyzer analyzer = ProteinNetworkAnalyzer.builder()
 *     .options(AnalysisOptions.strict())
 *     .metricsService(new MicrometerMetricsService(registry))
 *     .build();
 *
 * AnalysisResult result = analyzer.analyze(input);
 * List&lt;JoinedPair&gt; candidates = result.getUnobservedCrossCompartment();
 * List&lt;JoinedPair&gt; unlikely = result.getCrossGroupCrossCompartment();
 * </pre>
 */
public class ProteinNetworkAnalyzer {

    private final AnalysisOptions defaultOptions;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final NetworkAnalysisService service;

    private ProteinNetworkAnalyzer(Builder builder) {
        this.defaultOptions = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.service = new NetworkAnalysisService(defaultOptions, metricsService, tracingService);
    }

    public AnalysisResult analyze(AnalysisInput input) {
        return service.analyze(input);
    }

    /**
     * Analyzes with options that override the defaults for this call only.
     */
    public AnalysisResult analyze(AnalysisInput input, AnalysisOptions options) {
        if (options == null || options == defaultOptions) {
            return service.analyze(input);
        }
        return new NetworkAnalysisService(options, metricsService, tracingService).analyze(input);
    }

    public AnalysisOptions getOptions() {
        return defaultOptions;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public TracingService getTracingService() {
        return tracingService;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AnalysisOptions options = AnalysisOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;

        public Builder options(AnalysisOptions options) {
            if (options == null) {
                throw new IllegalArgumentException("options is required");
            }
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public ProteinNetworkAnalyzer build() {
            return new ProteinNetworkAnalyzer(this);
        }
    }
}
