package com.property.linkage.region;

import com.property.linkage.classify.PriorityThresholds;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Validated configuration of one region.
 *
 * @param key              directory name the region was loaded from
 * @param name             display name
 * @param code             short region code
 * @param jurisdictionCode jurisdiction (FIPS) code every secondary dataset is filtered on
 * @param dateCutoff1      old-sale cutoff
 * @param dateCutoff2      recent-sale cutoff
 * @param amountCutoff1    low sale amount cutoff
 * @param amountCutoff2    high sale amount cutoff
 * @param marketType       optional market description
 * @param description      optional free text
 * @param notes            optional free text
 */
public record RegionConfig(
        String key,
        String name,
        String code,
        String jurisdictionCode,
        LocalDate dateCutoff1,
        LocalDate dateCutoff2,
        double amountCutoff1,
        double amountCutoff2,
        String marketType,
        String description,
        String notes
) {
    public RegionConfig {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(jurisdictionCode, "jurisdictionCode is required");
        Objects.requireNonNull(dateCutoff1, "dateCutoff1 is required");
        Objects.requireNonNull(dateCutoff2, "dateCutoff2 is required");
    }

    public PriorityThresholds thresholds() {
        return new PriorityThresholds(dateCutoff1, dateCutoff2, amountCutoff1, amountCutoff2);
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : key;
    }
}
