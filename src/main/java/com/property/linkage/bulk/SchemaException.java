package com.property.linkage.bulk;

import java.util.List;

/**
 * Runtime exception thrown when an input file lacks a required column.
 * Fatal for that dataset only; the orchestrator reports it and moves on.
 */
public class SchemaException extends RuntimeException {

    private final String datasetName;
    private final List<String> missingColumns;

    public SchemaException(String datasetName, List<String> missingColumns, List<String> foundColumns) {
        super("Dataset '" + datasetName + "' is missing required column(s) " + missingColumns
                + "; found " + foundColumns);
        this.datasetName = datasetName;
        this.missingColumns = List.copyOf(missingColumns);
    }

    public String getDatasetName() {
        return datasetName;
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
