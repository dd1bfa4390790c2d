package com.property.linkage.classify;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Region-specific cutoffs for the priority scorer.
 *
 * @param dateCutoff1   sales on or before this date are old (ABS1)
 * @param dateCutoff2   sales on or after this date are recent (BUY1, BUY2)
 * @param amountCutoff1 sales at or below this amount are low value (OON1, TRS1)
 * @param amountCutoff2 high value cutoff, carried for reporting
 */
public record PriorityThresholds(
        LocalDate dateCutoff1,
        LocalDate dateCutoff2,
        double amountCutoff1,
        double amountCutoff2
) {
    public PriorityThresholds {
        Objects.requireNonNull(dateCutoff1, "dateCutoff1 is required");
        Objects.requireNonNull(dateCutoff2, "dateCutoff2 is required");
        if (amountCutoff1 < 0 || amountCutoff2 < 0) {
            throw new IllegalArgumentException("amount cutoffs must be non-negative");
        }
    }

    public boolean isOrdered() {
        return dateCutoff1.isBefore(dateCutoff2) && amountCutoff1 < amountCutoff2;
    }
}
