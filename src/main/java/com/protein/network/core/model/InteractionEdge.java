package com.protein.network.core.model;

import java.util.Objects;

/**
 * A known direct interaction in canonical order: {@code first} carries the smaller
 * numeric token. Instances are produced by
 * {@link com.protein.network.graph.EdgeNormalizer}; equality is exact tuple equality.
 *
 * @param first  protein with the smaller numeric token
 * @param second protein with the larger numeric token
 */
public record InteractionEdge(String first, String second) {

    public InteractionEdge {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
    }

    public boolean isSelfEdge() {
        return first.equals(second);
    }

    public boolean touches(String protein) {
        return first.equals(protein) || second.equals(protein);
    }

    @Override
    public String toString() {
        return first + "-" + second;
    }
}
