package com.protein.network.core.model;

import java.util.Objects;

/**
 * One element of the pair universe. Order follows the protein list, not the
 * numeric token, so {@code (first, second)} is a positional key.
 */
public record ProteinPair(String first, String second) {

    public ProteinPair {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
        if (first.equals(second)) {
            throw new IllegalArgumentException("A protein cannot be paired with itself: " + first);
        }
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
