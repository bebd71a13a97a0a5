package com.protein.network.core.model;

import java.util.Objects;

/**
 * An interaction exactly as it was read from the source, before canonical ordering.
 *
 * @param proteinA first identifier as listed
 * @param proteinB second identifier as listed
 */
public record RawInteraction(String proteinA, String proteinB) {

    public RawInteraction {
        Objects.requireNonNull(proteinA, "proteinA is required");
        Objects.requireNonNull(proteinB, "proteinB is required");
    }
}
