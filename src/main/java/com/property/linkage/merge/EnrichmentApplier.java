package com.property.linkage.merge;

import com.property.linkage.core.model.CanonicalPropertyRecord;
import com.property.linkage.core.model.DatasetKind;
import com.property.linkage.core.model.GoldenContact;
import com.property.linkage.core.model.SecondaryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Merges a matched secondary record into a canonical record, in place.
 *
 * <ul>
 *   <li>Each tag of the secondary record is appended unless the record already carries it,
 *       so re-applying a dataset never duplicates tags.</li>
 *   <li>Skip-trace rows overwrite the verified-contact fields they supply (last write wins).</li>
 *   <li>The composite priority is recomputed after every application.</li>
 * </ul>
 */
public class EnrichmentApplier {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentApplier.class);

    private final PriorityCodeComposer composer;

    public EnrichmentApplier() {
        this(new PriorityCodeComposer());
    }

    public EnrichmentApplier(PriorityCodeComposer composer) {
        this.composer = Objects.requireNonNull(composer, "composer is required");
    }

    public EnrichmentResult apply(CanonicalPropertyRecord canonical, SecondaryRecord secondary) {
        List<String> added = new ArrayList<>(secondary.getEnrichmentTags().size());
        for (String tag : secondary.getEnrichmentTags()) {
            PriorityCodeComposer.validateTag(tag);
            if (!canonical.carriesTag(tag) && canonical.addTag(tag)) {
                added.add(tag);
            }
        }

        boolean goldenUpdated = false;
        if (secondary.getKind() == DatasetKind.SKIP_TRACE && secondary.getGoldenContact() != null) {
            goldenUpdated = applyGoldenContact(canonical, secondary.getGoldenContact());
        }

        composer.compose(canonical);

        if (log.isTraceEnabled()) {
            log.trace("enrichment.applied address='{}' tagsAdded={} golden={} code={}",
                    canonical.getAddress(), added, goldenUpdated, canonical.getCompositePriorityCode());
        }
        return new EnrichmentResult(canonical, added, goldenUpdated);
    }

    private boolean applyGoldenContact(CanonicalPropertyRecord canonical, GoldenContact golden) {
        boolean updated = false;
        if (isPresent(golden.address())) {
            String goldenAddress = golden.address().trim();
            canonical.setGoldenAddress(goldenAddress);
            canonical.setGoldenAddressDiffers(differsFromMailing(canonical.getMailingAddress(), goldenAddress));
            updated = true;
        }
        if (isPresent(golden.city())) {
            canonical.setGoldenCity(golden.city().trim());
            updated = true;
        }
        if (isPresent(golden.state())) {
            canonical.setGoldenState(golden.state().trim());
            updated = true;
        }
        if (isPresent(golden.zip())) {
            canonical.setGoldenZip(golden.zip().trim());
            updated = true;
        }
        return updated;
    }

    /**
     * Whitespace-insensitive, case-sensitive comparison. False when no mailing address is on file.
     */
    static boolean differsFromMailing(String mailingAddress, String goldenAddress) {
        if (!isPresent(mailingAddress)) {
            return false;
        }
        return !collapseWhitespace(mailingAddress).equals(collapseWhitespace(goldenAddress));
    }

    private static String collapseWhitespace(String value) {
        return value.trim().replaceAll("\\s+", " ");
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
