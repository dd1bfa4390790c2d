package com.property.linkage.core.model;

/**
 * Kind of secondary dataset linked against the registry.
 * Niche lists may insert new records; skip-trace results only enrich existing ones.
 */
public enum DatasetKind {
    NICHE("niche"),
    SKIP_TRACE("skip-trace");

    private final String label;

    DatasetKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean allowsInsertion() {
        return this == NICHE;
    }
}
