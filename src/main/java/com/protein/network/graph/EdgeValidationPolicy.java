package com.protein.network.graph;

/**
 * How self-edges and repeated edges in the interaction list are treated.
 */
public enum EdgeValidationPolicy {

    /**
     * Accept them. They never change the connectivity partition.
     */
    TOLERATE,

    /**
     * Abort the run on the first self-edge or duplicate edge.
     */
    REJECT
}
