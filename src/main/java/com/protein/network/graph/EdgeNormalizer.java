package com.protein.network.graph;

import com.protein.network.core.InvalidInteractionException;
import com.protein.network.core.MalformedIdentifierException;
import com.protein.network.core.model.InteractionEdge;
import com.protein.network.core.model.RawInteraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Puts interaction edges in canonical order so that "A-B" and "B-A" compare equal.
 *
 * <p>The protein whose numeric token is smaller goes first. The numeric token is
 * the identifier with every non-digit character removed, e.g. {@code P23 -> 23},
 * {@code Q9-X1 -> 91}. When two tokens are equal (e.g. {@code P01} and {@code P1})
 * plain string order decides, which keeps the ordering total.</p>
 */
public class EdgeNormalizer {
    private static final Logger log = LoggerFactory.getLogger(EdgeNormalizer.class);

    private final EdgeValidationPolicy policy;

    public EdgeNormalizer() {
        this(EdgeValidationPolicy.TOLERATE);
    }

    public EdgeNormalizer(EdgeValidationPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
    }

    /**
     * Extracts the numeric token of a protein identifier. Tokens have no length limit.
     *
     * @throws MalformedIdentifierException if the identifier has no digits
     */
    public static BigInteger numericToken(String identifier) {
        Objects.requireNonNull(identifier, "identifier is required");
        StringBuilder digits = new StringBuilder(identifier.length());
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (Character.isDigit(c)) {
                digits.append(c);
            }
        }
        if (digits.length() == 0) {
            throw new MalformedIdentifierException(identifier);
        }
        return new BigInteger(digits.toString());
    }

    /**
     * Returns the canonical edge for an unordered pair of identifiers.
     */
    public static InteractionEdge canonicalize(String a, String b) {
        int byToken = numericToken(a).compareTo(numericToken(b));
        if (byToken > 0 || (byToken == 0 && a.compareTo(b) > 0)) {
            return new InteractionEdge(b, a);
        }
        return new InteractionEdge(a, b);
    }

    public static InteractionEdge canonicalize(InteractionEdge edge) {
        return canonicalize(edge.first(), edge.second());
    }

    public static InteractionEdge canonicalize(RawInteraction interaction) {
        return canonicalize(interaction.proteinA(), interaction.proteinB());
    }

    /**
     * Canonicalizes every interaction, preserving input order and multiplicity.
     *
     * @throws MalformedIdentifierException on the first identifier without digits
     * @throws InvalidInteractionException  under {@link EdgeValidationPolicy#REJECT}
     *                                      when a self-edge or duplicate edge is found
     */
    public List<InteractionEdge> normalizeAll(List<RawInteraction> interactions) {
        Objects.requireNonNull(interactions, "interactions is required");
        List<InteractionEdge> edges = new ArrayList<>(interactions.size());
        Set<InteractionEdge> seen = new HashSet<>();
        int selfEdges = 0;
        int duplicates = 0;

        for (RawInteraction interaction : interactions) {
            InteractionEdge edge = canonicalize(interaction);
            if (edge.isSelfEdge()) {
                selfEdges++;
                if (policy == EdgeValidationPolicy.REJECT) {
                    throw new InvalidInteractionException("Self-interaction is not allowed: " + edge);
                }
                log.debug("edges.self protein={}", edge.first());
            }
            if (!seen.add(edge)) {
                duplicates++;
                if (policy == EdgeValidationPolicy.REJECT) {
                    throw new InvalidInteractionException("Duplicate interaction: " + edge);
                }
                log.debug("edges.duplicate edge={}", edge);
            }
            edges.add(edge);
        }

        if (selfEdges > 0 || duplicates > 0) {
            log.info("edges.normalized total={} selfEdges={} duplicates={}", edges.size(), selfEdges, duplicates);
        }
        return List.copyOf(edges);
    }

    public EdgeValidationPolicy getPolicy() {
        return policy;
    }
}
