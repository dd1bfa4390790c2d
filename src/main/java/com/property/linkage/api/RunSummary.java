package com.property.linkage.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of a full region run, written as JSON next to the linked registry.
 *
 * @param runId                     correlation id of the run
 * @param regionKey                 region directory name
 * @param regionName                region display name
 * @param jurisdictionCode          registry jurisdiction
 * @param startedAt                 ISO-8601 start time
 * @param finishedAt                ISO-8601 end time
 * @param registryRecordsLoaded     records read from the registry export
 * @param recentSalesAppended       records appended from recent-sales files
 * @param datasets                  per-dataset pass statistics, in processing order
 * @param finalRegistrySize         records written
 * @param priorityCodeDistribution  most frequent composite codes with their counts
 */
public record RunSummary(
        String runId,
        String regionKey,
        String regionName,
        String jurisdictionCode,
        String startedAt,
        String finishedAt,
        long registryRecordsLoaded,
        long recentSalesAppended,
        List<LinkageSummary> datasets,
        long finalRegistrySize,
        Map<String, Long> priorityCodeDistribution
) {
    public RunSummary {
        datasets = datasets != null ? List.copyOf(datasets) : List.of();
        priorityCodeDistribution = priorityCodeDistribution != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(priorityCodeDistribution))
                : Map.of();
    }

    public long totalInserted() {
        return datasets.stream().mapToLong(LinkageSummary::insertedRecords).sum();
    }

    public boolean hasFailedDatasets() {
        return datasets.stream().anyMatch(LinkageSummary::failed);
    }
}
