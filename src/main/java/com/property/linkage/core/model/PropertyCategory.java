package com.property.linkage.core.model;

/**
 * Physical category of a property.
 */
public enum PropertyCategory {
    DEVELOPED,
    RAW_LAND
}
