package com.protein.network.core.model;

import java.util.Locale;

/**
 * The forward stages of one analysis run, in execution order.
 */
public enum AnalysisStage {
    NORMALIZE_EDGES,
    BUILD_GROUPS,
    GENERATE_PAIRS,
    JOIN_ATTRIBUTES,
    CLASSIFY_PAIRS;

    /**
     * Name used for spans and metric tags, e.g. {@code build-groups}.
     */
    public String tagValue() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
