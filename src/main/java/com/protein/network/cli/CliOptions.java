package com.protein.network.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

record CliOptions(
        Path proteinsFile,
        Path compartmentsFile,
        Path interactionsFile,
        Path outputDir,
        Long maxPairs,
        boolean rejectInvalidEdges,
        boolean parallel) {

    CliOptions {
        Objects.requireNonNull(proteinsFile, "proteinsFile");
        Objects.requireNonNull(compartmentsFile, "compartmentsFile");
        Objects.requireNonNull(interactionsFile, "interactionsFile");
        Objects.requireNonNull(outputDir, "outputDir");
        if (maxPairs != null && maxPairs <= 0) {
            throw new IllegalArgumentException("--max-pairs must be positive");
        }
    }

    static CliOptions parse(String[] args) {
        if (args == null) {
            throw new IllegalArgumentException("Missing arguments");
        }
        List<String> positional = new ArrayList<>();
        Long maxPairs = null;
        boolean reject = false;
        boolean parallel = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--max-pairs" -> maxPairs = parseLong(nextValue(args, ++i, arg), arg);
                case "--reject-invalid-edges" -> reject = true;
                case "--parallel" -> parallel = true;
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    positional.add(arg);
                }
            }
        }
        if (positional.size() != 4) {
            throw new IllegalArgumentException(
                    "Expected 4 positional arguments but got " + positional.size());
        }
        return new CliOptions(
                Path.of(positional.get(0)),
                Path.of(positional.get(1)),
                Path.of(positional.get(2)),
                Path.of(positional.get(3)),
                maxPairs,
                reject,
                parallel);
    }

    private static String nextValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static long parseLong(String raw, String option) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number for " + option + ": " + raw);
        }
    }
}
