package com.property.linkage.merge;

import com.property.linkage.core.model.BasePriority;
import com.property.linkage.core.model.CanonicalPropertyRecord;
import com.property.linkage.core.model.EnrichmentTag;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Derives the composite priority code and name from a record's accumulated tags and base
 * priority. Pure function of current state; safe to call any number of times.
 *
 * <p>Example: tags {@code [Liens, STBankruptcy]} over {@code ABS1} give code
 * {@code Liens-STBankruptcy-ABS1} and name
 * {@code Liens + STBankruptcy Enhanced - ABS1 - High Priority Absentee}.</p>
 */
public class PriorityCodeComposer {

    static final String TAG_SEPARATOR = "-";

    public void compose(CanonicalPropertyRecord record) {
        List<String> tags = record.getAccumulatedTags();
        BasePriority base = record.getBasePriority();
        record.setCompositePriority(composeCode(tags, base), composeName(tags, base));
    }

    public static String composeCode(List<String> tags, BasePriority base) {
        if (tags.isEmpty()) {
            return base.code();
        }
        return String.join(TAG_SEPARATOR, tags) + TAG_SEPARATOR + base.code();
    }

    public static String composeName(List<String> tags, BasePriority base) {
        if (tags.isEmpty()) {
            return base.name();
        }
        return tags.stream().map(EnrichmentTag::labelFor).collect(Collectors.joining(" + "))
                + " Enhanced - " + base.name();
    }

    /**
     * Rejects tags that would make a composite code ambiguous to split.
     */
    public static void validateTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("tag must not be null or blank");
        }
        if (tag.contains(TAG_SEPARATOR)) {
            throw new IllegalArgumentException("tag must not contain '" + TAG_SEPARATOR + "': " + tag);
        }
    }
}
