package com.property.linkage.bulk;

import com.property.linkage.core.model.EnrichmentTag;

import java.util.Locale;
import java.util.Set;

/**
 * Maps a niche list file name to its enrichment tag. Rules are checked in order and the
 * first match wins; unknown names map to {@link EnrichmentTag#OTHER}.
 *
 * <p>Delinquent-tax lists are current-year lists when the name says "current" or starts with
 * one of the configured locality prefixes, otherwise tax history.</p>
 */
public class NicheTypeDetector {

    /** Localities whose delinquent-tax exports only ever cover the current year. */
    public static final Set<String> DEFAULT_CURRENT_TAX_PREFIXES = Set.of("roanoke_", "lynchburg_", "norfolk_");

    private final Set<String> currentTaxPrefixes;

    public NicheTypeDetector() {
        this(DEFAULT_CURRENT_TAX_PREFIXES);
    }

    public NicheTypeDetector(Set<String> currentTaxPrefixes) {
        this.currentTaxPrefixes = Set.copyOf(currentTaxPrefixes);
    }

    public String detect(String fileName) {
        String name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);

        if (name.contains("lien")) {
            return EnrichmentTag.LIENS.getCode();
        }
        if (name.contains("foreclosure")) {
            return EnrichmentTag.PRE_FORECLOSURE.getCode();
        }
        if (name.contains("bankrupt")) {
            return EnrichmentTag.BANKRUPTCY.getCode();
        }
        if (name.contains("landlord") || name.contains("tired")) {
            return EnrichmentTag.LANDLORD.getCode();
        }
        if (name.contains("delinq")) {
            return name.contains("current") || startsWithAny(name, currentTaxPrefixes)
                    ? EnrichmentTag.CURRENT_TAX.getCode()
                    : EnrichmentTag.TAX_HISTORY.getCode();
        }
        if (name.contains("probate")) {
            return EnrichmentTag.PROBATE.getCode();
        }
        if (name.contains("interfamily") || name.contains("family")) {
            return EnrichmentTag.INTER_FAMILY.getCode();
        }
        if (name.contains("cash") && name.contains("buyer")) {
            return EnrichmentTag.CASH_BUYER.getCode();
        }
        if (name.contains("vacant")) {
            return EnrichmentTag.VACANT.getCode();
        }
        if (name.contains("code") && name.contains("enforcement")) {
            return EnrichmentTag.CODE_ENFORCEMENT.getCode();
        }
        if (name.contains("inherit")) {
            return EnrichmentTag.INHERITED.getCode();
        }
        return EnrichmentTag.OTHER;
    }

    private static boolean startsWithAny(String name, Set<String> prefixes) {
        for (String prefix : prefixes) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
