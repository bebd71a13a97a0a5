package com.protein.network.api;

import com.protein.network.graph.EdgeValidationPolicy;

import java.util.Locale;
import java.util.Properties;

/**
 * Options for an analysis run.
 * Configures the pair-universe size guard, edge validation and parallel classification.
 */
public class AnalysisOptions {

    public static final String MAX_PAIRS_KEY = "protein-network.pairs.max-count";
    public static final String EDGE_VALIDATION_KEY = "protein-network.edges.validation";
    public static final String PARALLEL_KEY = "protein-network.classification.parallel";

    private static final long DEFAULT_MAX_PAIRS = 50_000_000L;

    private final long maxPairs;
    private final EdgeValidationPolicy edgeValidationPolicy;
    private final boolean parallelClassification;

    private AnalysisOptions(Builder builder) {
        this.maxPairs = builder.maxPairs;
        this.edgeValidationPolicy = builder.edgeValidationPolicy;
        this.parallelClassification = builder.parallelClassification;
    }

    public long getMaxPairs() {
        return maxPairs;
    }

    public EdgeValidationPolicy getEdgeValidationPolicy() {
        return edgeValidationPolicy;
    }

    public boolean isParallelClassification() {
        return parallelClassification;
    }

    public static AnalysisOptions defaults() {
        return builder().build();
    }

    /**
     * Creates strict options: self-edges and duplicate edges abort the run.
     */
    public static AnalysisOptions strict() {
        return builder().edgeValidationPolicy(EdgeValidationPolicy.REJECT).build();
    }

    /**
     * Reads options from properties; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a present value cannot be parsed
     */
    public static AnalysisOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String maxPairs = properties.getProperty(MAX_PAIRS_KEY);
        if (maxPairs != null && !maxPairs.isBlank()) {
            try {
                builder.maxPairs(Long.parseLong(maxPairs.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + MAX_PAIRS_KEY + ": " + maxPairs, e);
            }
        }
        String validation = properties.getProperty(EDGE_VALIDATION_KEY);
        if (validation != null && !validation.isBlank()) {
            try {
                builder.edgeValidationPolicy(
                        EdgeValidationPolicy.valueOf(validation.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Invalid value for " + EDGE_VALIDATION_KEY + ": " + validation, e);
            }
        }
        String parallel = properties.getProperty(PARALLEL_KEY);
        if (parallel != null && !parallel.isBlank()) {
            builder.parallelClassification(Boolean.parseBoolean(parallel.trim()));
        }
        return builder.build();
    }

    public Builder toBuilder() {
        return builder()
                .maxPairs(maxPairs)
                .edgeValidationPolicy(edgeValidationPolicy)
                .parallelClassification(parallelClassification);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long maxPairs = DEFAULT_MAX_PAIRS;
        private EdgeValidationPolicy edgeValidationPolicy = EdgeValidationPolicy.TOLERATE;
        private boolean parallelClassification = false;

        public Builder maxPairs(long maxPairs) {
            if (maxPairs <= 0) {
                throw new IllegalArgumentException("maxPairs must be positive");
            }
            this.maxPairs = maxPairs;
            return this;
        }

        public Builder edgeValidationPolicy(EdgeValidationPolicy edgeValidationPolicy) {
            if (edgeValidationPolicy == null) {
                throw new IllegalArgumentException("edgeValidationPolicy is required");
            }
            this.edgeValidationPolicy = edgeValidationPolicy;
            return this;
        }

        public Builder parallelClassification(boolean parallelClassification) {
            this.parallelClassification = parallelClassification;
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }
    }

    @Override
    public String toString() {
        return "AnalysisOptions{" +
                "maxPairs=" + maxPairs +
                ", edgeValidationPolicy=" + edgeValidationPolicy +
                ", parallelClassification=" + parallelClassification +
                '}';
    }
}
