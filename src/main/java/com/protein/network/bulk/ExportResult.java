package com.protein.network.bulk;

/**
 * Result of writing one classified pair table.
 *
 * @param rowsWritten data rows written, header excluded
 */
public record ExportResult(long rowsWritten) {

    @Override
    public String toString() {
        return "ExportResult{rows=" + rowsWritten + '}';
    }
}
