package com.protein.network.graph;

import com.protein.network.core.UnknownEntityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DisjointSet Tests")
class DisjointSetTest {

    private DisjointSet<String> set;

    @BeforeEach
    void setUp() {
        set = new DisjointSet<>();
        for (String s : List.of("a", "b", "c", "d", "e")) {
            set.add(s);
        }
    }

    @Test
    @DisplayName("Fresh elements should be their own roots")
    void selfRoots() {
        assertEquals("a", set.find("a"));
        assertEquals("e", set.find("e"));
        assertEquals(5, set.size());
    }

    @Test
    @DisplayName("add should report whether the element was new")
    void addReportsNovelty() {
        assertFalse(set.add("a"));
        assertTrue(set.add("f"));
        assertTrue(set.contains("f"));
    }

    @Test
    @DisplayName("union should attach the second root under the first")
    void unionAttachesSecondUnderFirst() {
        assertEquals("a", set.union("a", "b"));
        assertEquals("a", set.find("b"));

        assertEquals("c", set.union("c", "a"));
        assertEquals("c", set.find("a"));
        assertEquals("c", set.find("b"));
    }

    @Test
    @DisplayName("union of already connected elements should be a no-op")
    void unionNoOp() {
        set.union("a", "b");
        assertEquals("a", set.union("b", "a"));
        assertEquals("a", set.find("a"));
        assertEquals("a", set.find("b"));
    }

    @Test
    @DisplayName("find should be idempotent")
    void findIdempotent() {
        set.union("a", "b");
        set.union("b", "c");
        String first = set.find("c");
        assertEquals(first, set.find("c"));
    }

    @Test
    @DisplayName("find should compress the visited path")
    void pathCompression() {
        // Chain e -> d -> c -> b -> a, built so each union links two roots
        set.union("d", "e");
        set.union("c", "d");
        set.union("b", "c");
        set.union("a", "b");
        assertEquals("d", set.parentOf("e"));

        assertEquals("a", set.find("e"));

        assertEquals("a", set.parentOf("e"));
        assertEquals("a", set.parentOf("d"));
        assertEquals("a", set.parentOf("c"));
        assertEquals("a", set.parentOf("b"));
    }

    @Test
    @DisplayName("find should handle long chains without recursion")
    void longChain() {
        DisjointSet<Integer> chain = new DisjointSet<>();
        int n = 200_000;
        for (int i = 0; i < n; i++) {
            chain.add(i);
        }
        for (int i = n - 1; i > 0; i--) {
            chain.union(i - 1, i);
        }
        assertEquals(0, chain.find(n - 1));
        assertTrue(chain.connected(0, n - 1));
    }

    @Test
    @DisplayName("Querying an unknown element should fail")
    void unknownElement() {
        assertThrows(UnknownEntityException.class, () -> set.find("z"));
        assertThrows(UnknownEntityException.class, () -> set.union("a", "z"));
    }

    @Test
    @DisplayName("sets should partition all elements in insertion order")
    void setsPartition() {
        set.union("a", "c");
        set.union("b", "e");

        List<List<String>> sets = set.sets();

        assertEquals(List.of(List.of("a", "c"), List.of("b", "e"), List.of("d")), sets);
        assertEquals(Set.of("a", "b", "c", "d", "e"), set.elements());
    }
}
