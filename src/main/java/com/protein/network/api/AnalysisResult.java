package com.protein.network.api;

import com.protein.network.core.model.ConnectivityGroups;
import com.protein.network.core.model.InteractionEdge;
import com.protein.network.core.model.JoinedPair;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of one analysis run.
 *
 * <p>Equality covers every table but not the run id, so two runs over identical input
 * compare equal.</p>
 */
public final class AnalysisResult {

    private final String runId;
    private final int proteinCount;
    private final List<InteractionEdge> edges;
    private final ConnectivityGroups groups;
    private final List<JoinedPair> joinedPairs;
    private final ClassifiedPairs classified;

    public AnalysisResult(String runId,
                          int proteinCount,
                          List<InteractionEdge> edges,
                          ConnectivityGroups groups,
                          List<JoinedPair> joinedPairs,
                          ClassifiedPairs classified) {
        this.runId = Objects.requireNonNull(runId, "runId is required");
        this.proteinCount = proteinCount;
        this.edges = List.copyOf(edges);
        this.groups = Objects.requireNonNull(groups, "groups is required");
        this.joinedPairs = List.copyOf(joinedPairs);
        this.classified = Objects.requireNonNull(classified, "classified is required");
    }

    public String getRunId() {
        return runId;
    }

    public int getProteinCount() {
        return proteinCount;
    }

    /**
     * Canonical edges in input order, duplicates included.
     */
    public List<InteractionEdge> getEdges() {
        return edges;
    }

    public ConnectivityGroups getGroups() {
        return groups;
    }

    /**
     * The full pair universe with attributes attached, in pair-universe order.
     */
    public List<JoinedPair> getJoinedPairs() {
        return joinedPairs;
    }

    public List<JoinedPair> getUnobservedCrossCompartment() {
        return classified.unobservedCrossCompartment();
    }

    public List<JoinedPair> getCrossGroupCrossCompartment() {
        return classified.crossGroupCrossCompartment();
    }

    /**
     * Every pair that is not a known interaction, compartments ignored.
     */
    public List<JoinedPair> getUnobserved() {
        return classified.unobserved();
    }

    /**
     * Every cross-compartment pair, known interactions included.
     */
    public List<JoinedPair> getCrossCompartment() {
        return classified.crossCompartment();
    }

    public AnalysisSummary summary() {
        return new AnalysisSummary(
                proteinCount,
                edges.size(),
                new HashSet<>(edges).size(),
                groups.entities().size(),
                groups.size(),
                groups.groupSizes(),
                joinedPairs.size(),
                classified.unobserved().size(),
                classified.crossCompartment().size(),
                classified.unobservedCrossCompartment().size(),
                classified.crossGroupCrossCompartment().size());
    }

    /**
     * The filtered subsets of the joined pair table, each in pair-universe order.
     */
    public record ClassifiedPairs(
            List<JoinedPair> unobservedCrossCompartment,
            List<JoinedPair> crossGroupCrossCompartment,
            List<JoinedPair> unobserved,
            List<JoinedPair> crossCompartment
    ) {
        public ClassifiedPairs {
            unobservedCrossCompartment = List.copyOf(unobservedCrossCompartment);
            crossGroupCrossCompartment = List.copyOf(crossGroupCrossCompartment);
            unobserved = List.copyOf(unobserved);
            crossCompartment = List.copyOf(crossCompartment);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AnalysisResult that = (AnalysisResult) o;
        return proteinCount == that.proteinCount
                && edges.equals(that.edges)
                && groups.equals(that.groups)
                && joinedPairs.equals(that.joinedPairs)
                && classified.equals(that.classified);
    }

    @Override
    public int hashCode() {
        return Objects.hash(proteinCount, edges, groups, joinedPairs, classified);
    }

    @Override
    public String toString() {
        return "AnalysisResult{runId='" + runId + '\'' +
                ", proteins=" + proteinCount +
                ", edges=" + edges.size() +
                ", groups=" + groups.size() +
                ", pairs=" + joinedPairs.size() +
                ", unobserved=" + classified.unobserved().size() +
                ", crossCompartment=" + classified.crossCompartment().size() +
                ", unobservedCrossCompartment=" + classified.unobservedCrossCompartment().size() +
                ", crossGroupCrossCompartment=" + classified.crossGroupCrossCompartment().size() +
                '}';
    }
}
