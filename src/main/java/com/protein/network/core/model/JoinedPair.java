package com.protein.network.core.model;

import java.util.Objects;

/**
 * A protein pair with the compartment and connectivity group of both sides attached.
 *
 * <p>A {@code null} compartment or group is the "missing" sentinel. A missing value
 * never equals anything, including another missing value, so two proteins with an
 * unknown compartment are treated as being in different compartments.</p>
 *
 * @param entityA      first protein of the pair
 * @param entityB      second protein of the pair
 * @param compartmentA compartment of {@code entityA}, or {@code null} if unknown
 * @param compartmentB compartment of {@code entityB}, or {@code null} if unknown
 * @param groupA       connectivity group of {@code entityA}, or {@code null} if it has no edges
 * @param groupB       connectivity group of {@code entityB}, or {@code null} if it has no edges
 */
public record JoinedPair(
        String entityA,
        String entityB,
        String compartmentA,
        String compartmentB,
        Integer groupA,
        Integer groupB
) {
    public JoinedPair {
        Objects.requireNonNull(entityA, "entityA is required");
        Objects.requireNonNull(entityB, "entityB is required");
    }

    public boolean compartmentsDiffer() {
        return differs(compartmentA, compartmentB);
    }

    public boolean groupsDiffer() {
        return differs(groupA, groupB);
    }

    public ProteinPair pair() {
        return new ProteinPair(entityA, entityB);
    }

    private static boolean differs(Object a, Object b) {
        if (a == null || b == null) {
            return true;
        }
        return !a.equals(b);
    }
}
