package com.property.linkage.core.model;

/**
 * Verified mailing contact supplied by a skip-trace provider. Any field may be null.
 */
public record GoldenContact(String address, String city, String state, String zip) {

    public boolean isEmpty() {
        return isBlank(address) && isBlank(city) && isBlank(state) && isBlank(zip);
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
