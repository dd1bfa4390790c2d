package com.property.linkage.core.model;

/**
 * Owner-based classification flags computed at registry load time.
 */
public record BaseClassification(
        boolean isTrust,
        boolean isChurch,
        boolean isBusiness,
        boolean isOwnerOccupied,
        boolean ownerGrantorMatch
) {
    private static final BaseClassification NONE = new BaseClassification(false, false, false, false, false);

    /**
     * Classification with every flag false.
     */
    public static BaseClassification none() {
        return NONE;
    }

    public BaseClassification withOwnerOccupied(boolean ownerOccupied) {
        return new BaseClassification(isTrust, isChurch, isBusiness, ownerOccupied, ownerGrantorMatch);
    }
}
