package com.property.linkage.bulk;

import com.property.linkage.core.model.CanonicalPropertyRecord;

import java.util.List;

/**
 * Records and schema read from a registry export.
 *
 * @param inputName name of the input, usually the file name
 * @param columns   header columns in input order
 * @param records   loaded records in input order
 * @param result    import statistics
 */
public record RegistryImport(
        String inputName,
        List<String> columns,
        List<CanonicalPropertyRecord> records,
        ImportResult result
) {
    public RegistryImport {
        columns = columns != null ? List.copyOf(columns) : List.of();
        records = records != null ? List.copyOf(records) : List.of();
    }
}
