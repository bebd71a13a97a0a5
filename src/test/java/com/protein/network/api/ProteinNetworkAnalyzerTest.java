package com.protein.network.api;

import com.protein.network.core.InvalidInteractionException;
import com.protein.network.core.model.RawInteraction;
import com.protein.network.metrics.MetricsService;
import com.protein.network.metrics.NoOpMetricsService;
import com.protein.network.tracing.NoOpTracingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@DisplayName("ProteinNetworkAnalyzer Tests")
class ProteinNetworkAnalyzerTest {

    private static final AnalysisInput SELF_EDGE = new AnalysisInput(
            List.of("P1", "P2"),
            Map.of("P1", "X", "P2", "Y"),
            List.of(new RawInteraction("P1", "P1")));

    @Test
    @DisplayName("Builder should fall back to no-op services")
    void builderDefaults() {
        ProteinNetworkAnalyzer analyzer = ProteinNetworkAnalyzer.builder().build();

        assertInstanceOf(NoOpMetricsService.class, analyzer.getMetricsService());
        assertInstanceOf(NoOpTracingService.class, analyzer.getTracingService());
        assertEquals(AnalysisOptions.defaults().getMaxPairs(), analyzer.getOptions().getMaxPairs());
    }

    @Test
    @DisplayName("Builder should reject null options")
    void nullOptions() {
        assertThrows(IllegalArgumentException.class, () -> ProteinNetworkAnalyzer.builder().options(null));
    }

    @Test
    @DisplayName("Per-call options should override the defaults for that call only")
    void perCallOverride() {
        ProteinNetworkAnalyzer analyzer = ProteinNetworkAnalyzer.builder().build();

        assertThrows(InvalidInteractionException.class, () -> analyzer.analyze(SELF_EDGE, AnalysisOptions.strict()));

        AnalysisResult result = analyzer.analyze(SELF_EDGE);
        assertEquals(1, result.getUnobservedCrossCompartment().size());
    }

    @Test
    @DisplayName("Should pass the configured metrics service to every run")
    void usesMetricsService() {
        MetricsService metrics = mock(MetricsService.class);
        ProteinNetworkAnalyzer analyzer = ProteinNetworkAnalyzer.builder().metricsService(metrics).build();

        analyzer.analyze(SELF_EDGE);
        analyzer.analyze(SELF_EDGE, AnalysisOptions.builder().parallelClassification(true).build());

        verify(metrics, times(2)).recordInputSize(2, 1);
        verify(metrics, times(2)).recordGroupCount(anyInt());
    }
}
