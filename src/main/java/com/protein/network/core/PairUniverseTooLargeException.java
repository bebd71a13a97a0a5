package com.protein.network.core;

/**
 * Runtime exception thrown when the number of unordered protein pairs would exceed
 * the configured limit. Raised before any pair is materialized.
 */
public class PairUniverseTooLargeException extends RuntimeException {

    private final long requestedPairs;
    private final long maxPairs;

    public PairUniverseTooLargeException(long requestedPairs, long maxPairs) {
        super("Pair universe of " + requestedPairs + " pairs exceeds the limit of " + maxPairs);
        this.requestedPairs = requestedPairs;
        this.maxPairs = maxPairs;
    }

    public long getRequestedPairs() {
        return requestedPairs;
    }

    public long getMaxPairs() {
        return maxPairs;
    }
}
