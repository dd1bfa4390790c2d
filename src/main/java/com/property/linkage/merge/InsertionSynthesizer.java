package com.property.linkage.merge;

import com.property.linkage.core.model.BaseClassification;
import com.property.linkage.core.model.BasePriority;
import com.property.linkage.core.model.CanonicalPropertyRecord;
import com.property.linkage.core.model.DatasetKind;
import com.property.linkage.core.model.PropertyCategory;
import com.property.linkage.core.model.SecondaryRecord;

/**
 * Builds a canonical record from an unmatched niche-list row.
 *
 * <p>The record's base priority is a sentinel whose code is the niche source type, e.g.
 * {@code {99, "Liens", "Liens List Only"}}; no tags are layered on top. Such records report
 * the source through {@link CanonicalPropertyRecord#carriesTag(String)}, so a later pass over
 * the same list does not tag them again.</p>
 */
public class InsertionSynthesizer {

    public static final int DEFAULT_NICHE_ONLY_PRIORITY_ID = 99;

    private final int nicheOnlyPriorityId;

    public InsertionSynthesizer() {
        this(DEFAULT_NICHE_ONLY_PRIORITY_ID);
    }

    public InsertionSynthesizer(int nicheOnlyPriorityId) {
        this.nicheOnlyPriorityId = nicheOnlyPriorityId;
    }

    public CanonicalPropertyRecord synthesize(SecondaryRecord secondary) {
        if (secondary.getKind() != DatasetKind.NICHE) {
            throw new IllegalArgumentException("Only niche-list records can be inserted, got "
                    + secondary.getKind().getLabel());
        }
        String sourceType = secondary.getSourceType();
        PriorityCodeComposer.validateTag(sourceType);

        return CanonicalPropertyRecord.builder()
                .address(secondary.getAddress())
                .city(secondary.getCity())
                .state(secondary.getState())
                .zip(secondary.getZip())
                .jurisdictionCode(secondary.getJurisdictionCode())
                .structuredId(secondary.getStructuredId())
                .ownerName(secondary.getOwnerName())
                .mailingAddress(secondary.getMailingAddress())
                .lastSaleDate(secondary.getLastSaleDate())
                .lastSaleAmount(secondary.getLastSaleAmount())
                .propertyCategory(PropertyCategory.DEVELOPED)
                .baseClassification(BaseClassification.none())
                .basePriority(new BasePriority(nicheOnlyPriorityId, sourceType, sourceType + " List Only"))
                .nicheOnly(true)
                .sourceColumns(secondary.getSourceColumns())
                .build();
    }
}
