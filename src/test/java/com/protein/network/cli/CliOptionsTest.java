package com.protein.network.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CliOptions Tests")
class CliOptionsTest {

    @Test
    @DisplayName("Should read four positional arguments")
    void positional() {
        CliOptions options = CliOptions.parse(new String[]{"p.txt", "c.csv", "i.txt", "out"});

        assertEquals(Path.of("p.txt"), options.proteinsFile());
        assertEquals(Path.of("c.csv"), options.compartmentsFile());
        assertEquals(Path.of("i.txt"), options.interactionsFile());
        assertEquals(Path.of("out"), options.outputDir());
        assertNull(options.maxPairs());
        assertFalse(options.rejectInvalidEdges());
        assertFalse(options.parallel());
    }

    @Test
    @DisplayName("Should read flags anywhere on the line")
    void flags() {
        CliOptions options = CliOptions.parse(new String[]{
                "--parallel", "p.txt", "c.csv", "--max-pairs", "100", "i.txt", "out", "--reject-invalid-edges"});

        assertEquals(100L, options.maxPairs());
        assertTrue(options.rejectInvalidEdges());
        assertTrue(options.parallel());
    }

    @Test
    @DisplayName("Should reject bad command lines")
    void rejects() {
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse(new String[]{"p.txt", "c.csv"}));
        assertThrows(IllegalArgumentException.class,
                () -> CliOptions.parse(new String[]{"p", "c", "i", "o", "--verbose"}));
        assertThrows(IllegalArgumentException.class,
                () -> CliOptions.parse(new String[]{"p", "c", "i", "o", "--max-pairs"}));
        assertThrows(IllegalArgumentException.class,
                () -> CliOptions.parse(new String[]{"p", "c", "i", "o", "--max-pairs", "many"}));
        assertThrows(IllegalArgumentException.class,
                () -> CliOptions.parse(new String[]{"p", "c", "i", "o", "--max-pairs", "-1"}));
    }
}
