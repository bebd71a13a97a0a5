package com.protein.network.pairs;

import com.protein.network.core.model.InteractionEdge;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Membership index over the known interaction edges.
 *
 * <p>Pairs come in protein-list order while edges are in numeric-token order, so a
 * lookup tries both orientations of the tuple. No numeric parsing happens here, which
 * lets pairs of proteins without digits be tested safely.</p>
 */
public final class KnownInteractions {

    private final Set<InteractionEdge> edges;

    public KnownInteractions(Collection<InteractionEdge> edges) {
        Objects.requireNonNull(edges, "edges is required");
        this.edges = Set.copyOf(new HashSet<>(edges));
    }

    public boolean contains(String a, String b) {
        return edges.contains(new InteractionEdge(a, b)) || edges.contains(new InteractionEdge(b, a));
    }

    /**
     * Number of distinct canonical edges.
     */
    public int size() {
        return edges.size();
    }
}
