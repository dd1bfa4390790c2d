package com.property.linkage.core.model;

/**
 * Strategy that produced a match, in decreasing order of specificity.
 */
public enum MatchStrategy {
    STRUCTURED_ID("StructuredId"),
    ADDRESS_CITY("AddressCity"),
    ADDRESS_ONLY("AddressOnly"),
    NONE("None");

    private final String label;

    MatchStrategy(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
