package com.protein.network.core;

/**
 * Runtime exception thrown when a connectivity query names a protein that was
 * never registered, i.e. one that appears in no interaction edge.
 */
public class UnknownEntityException extends RuntimeException {

    public UnknownEntityException(String entity) {
        super("Protein is not part of the interaction graph: '" + entity + "'");
    }
}
