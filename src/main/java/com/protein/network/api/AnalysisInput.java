package com.protein.network.api;

import com.protein.network.core.model.RawInteraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The three already-parsed collections an analysis consumes.
 *
 * @param proteins     ordered protein identifiers; the order defines pair identity
 * @param compartments protein to compartment identifier
 * @param interactions raw interactions, not yet canonical, duplicates allowed
 */
public record AnalysisInput(
        List<String> proteins,
        Map<String, String> compartments,
        List<RawInteraction> interactions
) {
    public AnalysisInput {
        Objects.requireNonNull(proteins, "proteins is required");
        Objects.requireNonNull(compartments, "compartments is required");
        Objects.requireNonNull(interactions, "interactions is required");
        proteins = List.copyOf(proteins);
        compartments = Collections.unmodifiableMap(new LinkedHashMap<>(compartments));
        interactions = List.copyOf(interactions);
    }
}
