package com.protein.network.pairs;

import com.protein.network.core.model.JoinedPair;
import com.protein.network.core.model.ProteinPair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AttributeJoiner Tests")
class AttributeJoinerTest {

    private final AttributeJoiner joiner = new AttributeJoiner();

    @Test
    @DisplayName("Should attach compartment and group to both sides")
    void joinsAttributes() {
        List<JoinedPair> joined = joiner.join(
                List.of(new ProteinPair("P1", "P2")),
                Map.of("P1", "X", "P2", "Y"),
                Map.of("P1", 0, "P2", 1));

        assertEquals(List.of(new JoinedPair("P1", "P2", "X", "Y", 0, 1)), joined);
    }

    @Test
    @DisplayName("Should use the missing sentinel for unknown proteins")
    void missingSentinel() {
        List<JoinedPair> joined = joiner.join(
                List.of(new ProteinPair("P1", "P3")),
                Map.of("P1", "X"),
                Map.of("P1", 0));

        JoinedPair pair = joined.get(0);
        assertEquals("X", pair.compartmentA());
        assertNull(pair.compartmentB());
        assertEquals(0, pair.groupA());
        assertNull(pair.groupB());
    }

    @Test
    @DisplayName("Should keep one row per pair in pair order")
    void rowPerPair() {
        List<ProteinPair> pairs = new PairUniverseGenerator().generate(List.of("P1", "P2", "P3", "P4"));
        List<JoinedPair> joined = joiner.join(pairs, Map.of(), Map.of());

        assertEquals(pairs.size(), joined.size());
        for (int i = 0; i < pairs.size(); i++) {
            assertEquals(pairs.get(i), joined.get(i).pair());
        }
    }
}
