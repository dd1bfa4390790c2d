package com.property.linkage.bulk;

/**
 * Result of a registry export.
 *
 * @param recordsWritten number of data rows written
 * @param columnCount    number of columns per row
 */
public record ExportResult(long recordsWritten, int columnCount) {
    @Override
    public String toString() {
        return "ExportResult{records=" + recordsWritten + ", columns=" + columnCount + '}';
    }
}
