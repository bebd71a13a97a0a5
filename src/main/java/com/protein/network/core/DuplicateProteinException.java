package com.protein.network.core;

/**
 * Thrown when the protein list names the same identifier twice. Proteins are the
 * unique keys of the pair universe, so a repeated one would produce a self pair.
 */
public class DuplicateProteinException extends IllegalArgumentException {

    private final String protein;

    public DuplicateProteinException(String protein) {
        super("Protein listed more than once: " + protein);
        this.protein = protein;
    }

    public String getProtein() {
        return protein;
    }
}
