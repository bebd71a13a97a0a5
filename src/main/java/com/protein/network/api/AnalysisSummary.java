package com.protein.network.api;

import java.util.List;

/**
 * Headline counts of one analysis run, as written to the JSON summary.
 */
public record AnalysisSummary(
        int proteins,
        int interactions,
        int distinctEdges,
        int entitiesWithEdges,
        int groups,
        List<Integer> groupSizes,
        long pairUniverse,
        int unobserved,
        int crossCompartment,
        int unobservedCrossCompartment,
        int crossGroupCrossCompartment
) {
    public AnalysisSummary {
        groupSizes = groupSizes != null ? List.copyOf(groupSizes) : List.of();
    }
}
