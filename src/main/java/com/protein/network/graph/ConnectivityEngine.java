package com.protein.network.graph;

import com.protein.network.core.model.ConnectivityGroup;
import com.protein.network.core.model.ConnectivityGroups;
import com.protein.network.core.model.InteractionEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Discovers connectivity groups from canonical interaction edges.
 *
 * <p>The entity universe is taken from the edge list alone. Proteins without any
 * edge get no group at all; callers see them as "no known connectivity group".</p>
 *
 * <p>Group ids are assigned densely from 0 in the order in which each group's first
 * member appears in the edge list. Which protein ends up as a group's root depends on
 * edge order; the partition itself does not.</p>
 */
public class ConnectivityEngine {
    private static final Logger log = LoggerFactory.getLogger(ConnectivityEngine.class);

    /**
     * Builds the disjoint set for the given edges: every endpoint registered as its own
     * root, then one union per edge in input order.
     */
    public DisjointSet<String> buildDisjointSet(List<InteractionEdge> edges) {
        Objects.requireNonNull(edges, "edges is required");
        DisjointSet<String> disjointSet = new DisjointSet<>();
        for (InteractionEdge edge : edges) {
            disjointSet.add(edge.first());
            disjointSet.add(edge.second());
        }
        for (InteractionEdge edge : edges) {
            disjointSet.union(edge.first(), edge.second());
        }
        return disjointSet;
    }

    /**
     * Computes the connectivity groups of the given edges.
     */
    public ConnectivityGroups build(List<InteractionEdge> edges) {
        DisjointSet<String> disjointSet = buildDisjointSet(edges);
        List<List<String>> sets = disjointSet.sets();

        List<ConnectivityGroup> groups = new ArrayList<>(sets.size());
        for (List<String> members : sets) {
            String root = disjointSet.find(members.get(0));
            Set<String> memberSet = new LinkedHashSet<>(members);
            groups.add(new ConnectivityGroup(groups.size(), root, memberSet));
        }

        ConnectivityGroups result = new ConnectivityGroups(groups);
        log.debug("connectivity.built edges={} entities={} groups={}",
                edges.size(), disjointSet.size(), result.size());
        return result;
    }
}
