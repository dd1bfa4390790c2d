package com.property.linkage.index;

import com.property.linkage.core.model.SecondaryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Restricts a secondary dataset to the registry's jurisdiction before any matching.
 * Codes compare exactly after trimming and numeric normalization, so {@code "051770"},
 * {@code "51770.0"} and {@code 51770} are the same code. There is no prefix matching.
 */
public final class JurisdictionFilter {
    private static final Logger log = LoggerFactory.getLogger(JurisdictionFilter.class);

    private JurisdictionFilter() {
    }

    /**
     * Canonical form of a jurisdiction code; {@code ""} for null or blank input.
     */
    public static String normalizeCode(String raw) {
        if (raw == null) {
            return "";
        }
        String code = raw.trim();
        if (code.endsWith(".0")) {
            code = code.substring(0, code.length() - 2).trim();
        }
        if (!code.isEmpty() && code.chars().allMatch(Character::isDigit)) {
            int i = 0;
            while (i < code.length() - 1 && code.charAt(i) == '0') {
                i++;
            }
            code = code.substring(i);
        }
        return code;
    }

    public static boolean sameJurisdiction(String code, String otherCode) {
        String normalized = normalizeCode(code);
        return !normalized.isEmpty() && normalized.equals(normalizeCode(otherCode));
    }

    /**
     * Keeps records whose jurisdiction code equals {@code jurisdictionCode}, in input order.
     * An empty result is not an error.
     */
    public static List<SecondaryRecord> filterByJurisdiction(List<SecondaryRecord> records,
                                                             String jurisdictionCode) {
        String expected = normalizeCode(jurisdictionCode);
        List<SecondaryRecord> kept = new ArrayList<>(records.size());
        for (SecondaryRecord record : records) {
            if (!expected.isEmpty() && expected.equals(normalizeCode(record.getJurisdictionCode()))) {
                kept.add(record);
            } else if (log.isTraceEnabled()) {
                log.trace("jurisdiction.filtered line={} expected={} found={}",
                        record.getLineNumber(), expected, record.getJurisdictionCode());
            }
        }
        return kept;
    }
}
