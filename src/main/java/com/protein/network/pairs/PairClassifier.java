package com.protein.network.pairs;

import com.protein.network.core.model.JoinedPair;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filters a joined pair table into its named subsets. All filters are pure and keep
 * pair-universe order.
 *
 * <p>When parallel filtering is enabled the table is split along the pair axis; the
 * classification of one pair never depends on another, and the ordered collector
 * restores pair-universe order.</p>
 */
public class PairClassifier {

    private final KnownInteractions knownInteractions;
    private final boolean parallel;

    public PairClassifier(KnownInteractions knownInteractions) {
        this(knownInteractions, false);
    }

    public PairClassifier(KnownInteractions knownInteractions, boolean parallel) {
        this.knownInteractions = Objects.requireNonNull(knownInteractions, "knownInteractions is required");
        this.parallel = parallel;
    }

    /**
     * Cross-compartment pairs that are not a known interaction in either order:
     * candidates for new, not yet observed interactions.
     */
    public List<JoinedPair> unobservedCrossCompartment(List<JoinedPair> joined) {
        return filter(joined, p -> p.compartmentsDiffer() && !isKnown(p));
    }

    /**
     * Cross-compartment pairs whose sides sit in different connectivity groups: no
     * direct or transitive interaction evidence. Always a subset of
     * {@link #unobservedCrossCompartment(List)}.
     */
    public List<JoinedPair> crossGroupCrossCompartment(List<JoinedPair> joined) {
        return filter(joined, p -> p.compartmentsDiffer() && p.groupsDiffer());
    }

    /**
     * Every pair that is not a known interaction, regardless of compartment.
     */
    public List<JoinedPair> unobserved(List<JoinedPair> joined) {
        return filter(joined, p -> !isKnown(p));
    }

    /**
     * Every cross-compartment pair, known interactions included.
     */
    public List<JoinedPair> crossCompartment(List<JoinedPair> joined) {
        return filter(joined, JoinedPair::compartmentsDiffer);
    }

    public boolean isParallel() {
        return parallel;
    }

    private boolean isKnown(JoinedPair pair) {
        return knownInteractions.contains(pair.entityA(), pair.entityB());
    }

    private List<JoinedPair> filter(List<JoinedPair> joined, Predicate<JoinedPair> predicate) {
        Objects.requireNonNull(joined, "joined is required");
        Stream<JoinedPair> stream = parallel ? joined.parallelStream() : joined.stream();
        return stream.filter(predicate).collect(Collectors.toUnmodifiableList());
    }
}
