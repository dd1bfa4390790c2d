package com.property.linkage.bulk;

import java.util.List;

/**
 * Result of a registry import.
 *
 * @param totalRows      data rows read
 * @param recordsLoaded  rows turned into registry records
 * @param rowsSkipped    rows with no values at all
 * @param errors         rows that failed
 */
public record ImportResult(
        long totalRows,
        long recordsLoaded,
        long rowsSkipped,
        List<ImportError> errors
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Represents an error that occurred while importing a specific row.
     *
     * @param lineNumber the line number in the input (1-based, header is line 1)
     * @param address    the address of the failed row
     * @param message    the error message
     */
    public record ImportError(long lineNumber, String address, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRows +
                ", loaded=" + recordsLoaded +
                ", skipped=" + rowsSkipped +
                ", errors=" + errors.size() + '}';
    }
}
