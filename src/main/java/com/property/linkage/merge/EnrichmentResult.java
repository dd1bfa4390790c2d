package com.property.linkage.merge;

import com.property.linkage.core.model.CanonicalPropertyRecord;

import java.util.List;

/**
 * Result of applying one secondary record to one canonical record.
 *
 * @param record                the canonical record that was enriched
 * @param tagsAdded             tags newly appended, empty when every tag was already carried
 * @param goldenContactUpdated  whether any verified-contact field was written
 */
public record EnrichmentResult(
        CanonicalPropertyRecord record,
        List<String> tagsAdded,
        boolean goldenContactUpdated
) {
    public EnrichmentResult {
        tagsAdded = tagsAdded != null ? List.copyOf(tagsAdded) : List.of();
    }

    public boolean addedTags() {
        return !tagsAdded.isEmpty();
    }

    public boolean hasChanges() {
        return addedTags() || goldenContactUpdated;
    }
}
