package com.property.linkage.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.property.linkage.core.model.DatasetKind;
import com.property.linkage.core.model.MatchStrategy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Statistics of one secondary dataset pass.
 *
 * @param datasetName                 dataset name
 * @param kind                        dataset kind
 * @param totalRecords                rows read
 * @param jurisdictionFiltered        rows dropped for a different jurisdiction code
 * @param skippedBlankAddress         rows with an empty normalized address
 * @param skippedInvalidStructuredId  rows whose parcel identifier could not be parsed
 * @param matchedRecords              rows matched by some strategy
 * @param enrichedRecords             canonical records that gained a tag or contact data
 * @param insertedRecords             niche-only records appended to the registry
 * @param unmatchedRecords            eligible rows no strategy matched
 * @param strategyBreakdown           eligible rows per strategy, including {@code NONE}
 * @param durationMillis              wall time of the pass
 * @param error                       schema error message; null on success
 */
public record LinkageSummary(
        String datasetName,
        DatasetKind kind,
        long totalRecords,
        long jurisdictionFiltered,
        long skippedBlankAddress,
        long skippedInvalidStructuredId,
        long matchedRecords,
        long enrichedRecords,
        long insertedRecords,
        long unmatchedRecords,
        Map<MatchStrategy, Long> strategyBreakdown,
        long durationMillis,
        String error
) {
    public LinkageSummary {
        EnumMap<MatchStrategy, Long> copy = new EnumMap<>(MatchStrategy.class);
        if (strategyBreakdown != null) {
            copy.putAll(strategyBreakdown);
        }
        strategyBreakdown = Collections.unmodifiableMap(copy);
    }

    public static LinkageSummary failure(String datasetName, DatasetKind kind, String error) {
        return new LinkageSummary(datasetName, kind, 0, 0, 0, 0, 0, 0, 0, 0, Map.of(), 0, error);
    }

    @JsonProperty("failed")
    public boolean failed() {
        return error != null;
    }

    public long countFor(MatchStrategy strategy) {
        return strategyBreakdown.getOrDefault(strategy, 0L);
    }

    @Override
    public String toString() {
        if (failed()) {
            return "LinkageSummary{dataset=" + datasetName + ", error=" + error + '}';
        }
        return "LinkageSummary{dataset=" + datasetName +
                ", total=" + totalRecords +
                ", filtered=" + jurisdictionFiltered +
                ", blankAddress=" + skippedBlankAddress +
                ", invalidId=" + skippedInvalidStructuredId +
                ", matched=" + matchedRecords +
                ", enriched=" + enrichedRecords +
                ", inserted=" + insertedRecords +
                ", strategies=" + strategyBreakdown + '}';
    }
}
