package com.property.linkage.rules;

/**
 * Field a normalization rule is scoped to.
 */
public enum KeyField {
    ADDRESS,
    CITY,
    STRUCTURED_ID
}
