package com.property.linkage.api;

import com.property.linkage.core.model.DatasetKind;
import com.property.linkage.core.model.SecondaryRecord;
import com.property.linkage.merge.PriorityCodeComposer;

import java.util.List;
import java.util.Objects;

/**
 * A fully read secondary dataset. Every record's tags are validated here, so a dataset that
 * would produce an unsplittable composite code is rejected before a pass touches the registry.
 *
 * @param name       dataset name used in logs and summaries, usually the file name
 * @param kind       niche list or skip-trace result
 * @param sourceType source type shared by every record
 * @param records    records in input order
 */
public record SecondaryDataset(String name, DatasetKind kind, String sourceType, List<SecondaryRecord> records) {
    public SecondaryDataset {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(sourceType, "sourceType is required");
        records = records != null ? List.copyOf(records) : List.of();
        if (kind == DatasetKind.NICHE) {
            PriorityCodeComposer.validateTag(sourceType);
        }
        for (SecondaryRecord record : records) {
            for (String tag : record.getEnrichmentTags()) {
                PriorityCodeComposer.validateTag(tag);
            }
        }
    }
}
