package com.protein.network.core;

/**
 * Runtime exception thrown when a protein identifier carries no numeric token
 * and therefore cannot be placed in canonical edge order.
 */
public class MalformedIdentifierException extends RuntimeException {

    private final String identifier;

    public MalformedIdentifierException(String identifier) {
        super("Protein identifier has no numeric token: '" + identifier + "'");
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
