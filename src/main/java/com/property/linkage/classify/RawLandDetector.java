package com.property.linkage.classify;

import com.property.linkage.core.model.PropertyCategory;

/**
 * Flags parcels without a street number as raw land.
 */
public class RawLandDetector {

    public PropertyCategory categorize(String address) {
        return isRawLand(address) ? PropertyCategory.RAW_LAND : PropertyCategory.DEVELOPED;
    }

    /**
     * True when the first token of a non-blank address contains no digit.
     */
    public boolean isRawLand(String address) {
        if (address == null || address.isBlank()) {
            return false;
        }
        String firstToken = address.trim().split("\\s+")[0];
        return firstToken.chars().noneMatch(Character::isDigit);
    }
}
