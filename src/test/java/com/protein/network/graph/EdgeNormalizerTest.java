package com.protein.network.graph;

import com.protein.network.core.InvalidInteractionException;
import com.protein.network.core.MalformedIdentifierException;
import com.protein.network.core.model.InteractionEdge;
import com.protein.network.core.model.RawInteraction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EdgeNormalizer Tests")
class EdgeNormalizerTest {

    @Nested
    @DisplayName("numericToken")
    class NumericTokenTests {

        @Test
        @DisplayName("Should strip every non-digit character")
        void stripsNonDigits() {
            assertEquals(BigInteger.valueOf(23), EdgeNormalizer.numericToken("P23"));
            assertEquals(BigInteger.valueOf(91), EdgeNormalizer.numericToken("Q9-X1"));
            assertEquals(BigInteger.valueOf(7), EdgeNormalizer.numericToken("007"));
        }

        @Test
        @DisplayName("Should fail fast on identifiers without digits")
        void failsWithoutDigits() {
            MalformedIdentifierException ex = assertThrows(MalformedIdentifierException.class,
                    () -> EdgeNormalizer.numericToken("ABC"));
            assertEquals("ABC", ex.getIdentifier());
            assertTrue(ex.getMessage().contains("ABC"));
        }

        @Test
        @DisplayName("Should fail on empty identifiers")
        void failsOnEmpty() {
            assertThrows(MalformedIdentifierException.class, () -> EdgeNormalizer.numericToken(""));
        }

        @Test
        @DisplayName("Should keep tokens longer than a long can hold")
        void unboundedTokens() {
            assertEquals(new BigInteger("12345678901234567890123"),
                    EdgeNormalizer.numericToken("P12345678901234567890123"));
        }
    }

    @Nested
    @DisplayName("canonicalize")
    class CanonicalizeTests {

        @Test
        @DisplayName("Should put the smaller numeric token first")
        void smallerFirst() {
            assertEquals(new InteractionEdge("P1", "P2"), EdgeNormalizer.canonicalize("P2", "P1"));
            assertEquals(new InteractionEdge("P1", "P2"), EdgeNormalizer.canonicalize("P1", "P2"));
        }

        @Test
        @DisplayName("Should compare numerically, not lexically")
        void numericNotLexical() {
            assertEquals(new InteractionEdge("P9", "P10"), EdgeNormalizer.canonicalize("P10", "P9"));
        }

        @Test
        @DisplayName("Should be idempotent")
        void idempotent() {
            InteractionEdge once = EdgeNormalizer.canonicalize("P40", "P3");
            assertEquals(once, EdgeNormalizer.canonicalize(once));
        }

        @Test
        @DisplayName("Should give the same edge for both orders when tokens tie")
        void tieBrokenByString() {
            InteractionEdge ab = EdgeNormalizer.canonicalize("P01", "P1");
            InteractionEdge ba = EdgeNormalizer.canonicalize("P1", "P01");
            assertEquals(ab, ba);
            assertEquals("P01", ab.first());
        }

        @Test
        @DisplayName("Should order very long tokens numerically")
        void longTokens() {
            InteractionEdge expected = new InteractionEdge("P3", "P12345678901234567890");
            assertEquals(expected, EdgeNormalizer.canonicalize("P12345678901234567890", "P3"));
            assertEquals(expected, EdgeNormalizer.canonicalize("P3", "P12345678901234567890"));
            assertEquals(new InteractionEdge("P99999999999999999999", "P100000000000000000000"),
                    EdgeNormalizer.canonicalize("P100000000000000000000", "P99999999999999999999"));
        }

        @Test
        @DisplayName("Should accept self-edges")
        void selfEdge() {
            InteractionEdge edge = EdgeNormalizer.canonicalize("P5", "P5");
            assertTrue(edge.isSelfEdge());
        }
    }

    @Nested
    @DisplayName("normalizeAll")
    class NormalizeAllTests {

        private final List<RawInteraction> messy = List.of(
                new RawInteraction("P2", "P1"),
                new RawInteraction("P1", "P2"),
                new RawInteraction("P3", "P3"),
                new RawInteraction("P7", "P4"));

        @Test
        @DisplayName("Should keep input order and multiplicity when tolerating")
        void toleratesDuplicatesAndSelfEdges() {
            List<InteractionEdge> edges = new EdgeNormalizer().normalizeAll(messy);

            assertEquals(List.of(
                    new InteractionEdge("P1", "P2"),
                    new InteractionEdge("P1", "P2"),
                    new InteractionEdge("P3", "P3"),
                    new InteractionEdge("P4", "P7")), edges);
        }

        @Test
        @DisplayName("Should reject duplicates in strict mode")
        void rejectsDuplicates() {
            EdgeNormalizer strict = new EdgeNormalizer(EdgeValidationPolicy.REJECT);
            List<RawInteraction> duplicates = List.of(
                    new RawInteraction("P2", "P1"),
                    new RawInteraction("P1", "P2"));

            InvalidInteractionException ex = assertThrows(InvalidInteractionException.class,
                    () -> strict.normalizeAll(duplicates));
            assertTrue(ex.getMessage().contains("Duplicate"));
        }

        @Test
        @DisplayName("Should reject self-edges in strict mode")
        void rejectsSelfEdges() {
            EdgeNormalizer strict = new EdgeNormalizer(EdgeValidationPolicy.REJECT);

            InvalidInteractionException ex = assertThrows(InvalidInteractionException.class,
                    () -> strict.normalizeAll(List.of(new RawInteraction("P3", "P3"))));
            assertTrue(ex.getMessage().contains("Self"));
        }

        @Test
        @DisplayName("Should abort on a malformed identifier")
        void abortsOnMalformed() {
            List<RawInteraction> bad = List.of(
                    new RawInteraction("P1", "P2"),
                    new RawInteraction("P1", "protein"));

            assertThrows(MalformedIdentifierException.class, () -> new EdgeNormalizer().normalizeAll(bad));
        }

        @Test
        @DisplayName("Should return an immutable list")
        void immutable() {
            List<InteractionEdge> edges = new EdgeNormalizer().normalizeAll(List.of(new RawInteraction("P1", "P2")));
            assertThrows(UnsupportedOperationException.class, () -> edges.add(new InteractionEdge("P3", "P4")));
        }
    }
}
