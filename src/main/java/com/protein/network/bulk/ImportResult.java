package com.protein.network.bulk;

import com.protein.network.api.AnalysisInput;

import java.util.List;
import java.util.Objects;

/**
 * Result of importing the three input files.
 *
 * @param input            the parsed input, containing only rows that could be read
 * @param proteinsRead     protein identifiers accepted
 * @param compartmentsRead compartment assignments accepted
 * @param interactionsRead interactions accepted
 * @param errors           rows that were skipped
 */
public record ImportResult(
        AnalysisInput input,
        long proteinsRead,
        long compartmentsRead,
        long interactionsRead,
        List<ImportError> errors
) {
    public ImportResult {
        Objects.requireNonNull(input, "input is required");
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A row that was skipped during import.
     *
     * @param source     which input the row came from ("proteins", "compartments", "interactions")
     * @param lineNumber 1-based line number in that input
     * @param line       the raw line
     * @param message    why it was skipped
     */
    public record ImportError(String source, long lineNumber, String line, String message) {}

    @Override
    public String toString() {
        return "ImportResult{proteins=" + proteinsRead +
                ", compartments=" + compartmentsRead +
                ", interactions=" + interactionsRead +
                ", errors=" + errors.size() + '}';
    }
}
