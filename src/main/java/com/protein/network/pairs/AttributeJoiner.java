package com.protein.network.pairs;

import com.protein.network.core.model.JoinedPair;
import com.protein.network.core.model.ProteinPair;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Attaches compartment and connectivity group of both sides to every pair.
 * Lookups never fail: a protein absent from a map gets the {@code null} sentinel.
 */
public class AttributeJoiner {

    public List<JoinedPair> join(List<ProteinPair> pairs,
                                 Map<String, String> compartments,
                                 Map<String, Integer> groupIds) {
        Objects.requireNonNull(pairs, "pairs is required");
        Objects.requireNonNull(compartments, "compartments is required");
        Objects.requireNonNull(groupIds, "groupIds is required");

        List<JoinedPair> joined = new ArrayList<>(pairs.size());
        for (ProteinPair pair : pairs) {
            joined.add(new JoinedPair(
                    pair.first(),
                    pair.second(),
                    compartments.get(pair.first()),
                    compartments.get(pair.second()),
                    groupIds.get(pair.first()),
                    groupIds.get(pair.second())));
        }
        return List.copyOf(joined);
    }
}
