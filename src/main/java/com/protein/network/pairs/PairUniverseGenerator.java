package com.protein.network.pairs;

import com.protein.network.core.DuplicateProteinException;
import com.protein.network.core.PairUniverseTooLargeException;
import com.protein.network.core.model.ProteinPair;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Generates every unordered pair of proteins, as combinations in list order.
 *
 * <p>For a list {@code [a, b, c]} the output is {@code (a,b), (a,c), (b,c)}. The whole
 * universe is materialized, so its size is checked against a limit before any pair is
 * allocated.</p>
 */
public class PairUniverseGenerator {

    public static final long UNLIMITED = Long.MAX_VALUE;

    private final long maxPairs;

    public PairUniverseGenerator() {
        this(UNLIMITED);
    }

    public PairUniverseGenerator(long maxPairs) {
        if (maxPairs <= 0) {
            throw new IllegalArgumentException("maxPairs must be positive");
        }
        this.maxPairs = maxPairs;
    }

    /**
     * Number of unordered pairs over {@code n} proteins, n*(n-1)/2.
     */
    public static long pairCount(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0");
        }
        return (long) n * (n - 1) / 2;
    }

    /**
     * @throws DuplicateProteinException      if a protein is listed more than once
     * @throws PairUniverseTooLargeException  if the pair count exceeds the limit
     */
    public List<ProteinPair> generate(List<String> proteins) {
        Objects.requireNonNull(proteins, "proteins is required");
        checkUnique(proteins);

        long count = pairCount(proteins.size());
        if (count > maxPairs || count > Integer.MAX_VALUE - 8) {
            throw new PairUniverseTooLargeException(count, Math.min(maxPairs, Integer.MAX_VALUE - 8));
        }

        List<ProteinPair> pairs = new ArrayList<>((int) count);
        for (int i = 0; i < proteins.size(); i++) {
            String first = proteins.get(i);
            for (int j = i + 1; j < proteins.size(); j++) {
                pairs.add(new ProteinPair(first, proteins.get(j)));
            }
        }
        return List.copyOf(pairs);
    }

    public long getMaxPairs() {
        return maxPairs;
    }

    private static void checkUnique(List<String> proteins) {
        Set<String> seen = new HashSet<>();
        for (String protein : proteins) {
            Objects.requireNonNull(protein, "protein identifiers must not be null");
            if (!seen.add(protein)) {
                throw new DuplicateProteinException(protein);
            }
        }
    }
}
