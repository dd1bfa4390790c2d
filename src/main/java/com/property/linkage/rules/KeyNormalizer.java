package com.property.linkage.rules;

import java.util.Set;

/**
 * Pure functions mapping raw address, city and parcel identifier strings to matching keys.
 * All functions are total: null or blank input yields {@code ""}.
 */
public final class KeyNormalizer {

    /** Separator between the address and city components of a key. */
    public static final String KEY_SEPARATOR = "|";

    private static final NormalizationEngine ENGINE = AddressNormalizationRules.createDefaultEngine();

    private static final Set<String> ID_PLACEHOLDERS = Set.of("NAN", "NULL", "NONE", "N/A", "#N/A", "NA");

    private KeyNormalizer() {
    }

    public static String normalizeAddress(String raw) {
        return ENGINE.normalize(raw, KeyField.ADDRESS);
    }

    public static String normalizeCity(String raw) {
        return ENGINE.normalize(raw, KeyField.CITY);
    }

    /**
     * {@code ADDRESS|CITY} when both parts are non-empty, the address alone when only the
     * city is missing, {@code ""} when the address is empty.
     */
    public static String makeAddressCityKey(String address, String city) {
        String normalizedAddress = normalizeAddress(address);
        if (normalizedAddress.isEmpty()) {
            return "";
        }
        String normalizedCity = normalizeCity(city);
        if (normalizedCity.isEmpty()) {
            return normalizedAddress;
        }
        return normalizedAddress + KEY_SEPARATOR + normalizedCity;
    }

    /**
     * Address component of a key produced by {@link #makeAddressCityKey}.
     */
    public static String addressComponent(String key) {
        int idx = key.indexOf(KEY_SEPARATOR);
        return idx < 0 ? key : key.substring(0, idx);
    }

    public static boolean hasCityComponent(String key) {
        return key.contains(KEY_SEPARATOR);
    }

    /**
     * Uppercased identifier without dashes or whitespace; {@code ""} for absent,
     * placeholder or unparseable values.
     */
    public static String normalizeStructuredId(String raw) {
        String normalized = ENGINE.normalize(raw, KeyField.STRUCTURED_ID);
        if (ID_PLACEHOLDERS.contains(normalized) || !containsAlphanumeric(normalized)) {
            return "";
        }
        return normalized;
    }

    /**
     * Identifier with its trailing alphabetic sub-parcel suffix removed ({@code 1234A -> 1234}).
     * Returns {@code ""} when nothing would remain.
     */
    public static String baseStructuredId(String normalizedId) {
        if (normalizedId == null) {
            return "";
        }
        int end = normalizedId.length();
        while (end > 0 && Character.isLetter(normalizedId.charAt(end - 1))) {
            end--;
        }
        return normalizedId.substring(0, end);
    }

    /**
     * True if a value was supplied but has nothing left after separator stripping ({@code ---}).
     * Spreadsheet placeholders such as {@code nan} or {@code #N/A} count as absent, not unparseable.
     */
    public static boolean isUnparseableStructuredId(String raw) {
        if (raw == null || raw.isBlank()) {
            return false;
        }
        String normalized = ENGINE.normalize(raw, KeyField.STRUCTURED_ID);
        return !ID_PLACEHOLDERS.contains(normalized) && !containsAlphanumeric(normalized);
    }

    private static boolean containsAlphanumeric(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isLetterOrDigit(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
