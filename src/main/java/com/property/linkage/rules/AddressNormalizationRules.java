package com.property.linkage.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rules for address, city and parcel identifier keys.
 */
public final class AddressNormalizationRules {

    private AddressNormalizationRules() {
    }

    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(addressRules());
        rules.addAll(cityRules());
        rules.addAll(structuredIdRules());
        return new NormalizationEngine(rules);
    }

    /**
     * Street-type comma artifacts ("123 MAIN ST, APT 2") and list-separator commas.
     */
    public static List<NormalizationRule> addressRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("street-suffix-comma")
                        .pattern("\\s(ST|AVE|RD|DR|BLVD),")
                        .replacement(" $1")
                        .applicableFields(KeyField.ADDRESS)
                        .priority(10)
                        .build(),
                NormalizationRule.builder()
                        .name("comma-separator")
                        .pattern(",")
                        .replacement(" ")
                        .applicableFields(KeyField.ADDRESS, KeyField.CITY)
                        .priority(20)
                        .build()
        );
    }

    public static List<NormalizationRule> cityRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("city-periods")
                        .pattern("\\.")
                        .replacement("")
                        .applicableFields(KeyField.CITY)
                        .priority(10)
                        .build()
        );
    }

    /**
     * Parcel identifiers compare without dashes, whitespace or a spreadsheet float suffix.
     */
    public static List<NormalizationRule> structuredIdRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("id-float-suffix")
                        .pattern("\\.0$")
                        .replacement("")
                        .applicableFields(KeyField.STRUCTURED_ID)
                        .priority(10)
                        .build(),
                NormalizationRule.builder()
                        .name("id-separators")
                        .pattern("[-\\s]")
                        .replacement("")
                        .applicableFields(KeyField.STRUCTURED_ID)
                        .priority(20)
                        .build()
        );
    }
}
