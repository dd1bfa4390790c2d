package com.property.linkage.core.model;

import java.util.Optional;

/**
 * Known enrichment tags and the boolean flag column each one drives on output.
 * Tags outside this list are still accepted; their flag column is derived from the tag code.
 */
public enum EnrichmentTag {
    LIENS("Liens", "HasLiens", DatasetKind.NICHE),
    PRE_FORECLOSURE("PreForeclosure", "HasForeclosure", DatasetKind.NICHE),
    CODE_ENFORCEMENT("CodeEnforcement", "HasCodeEnforcement", DatasetKind.NICHE),
    CURRENT_TAX("CurrentTax", "HasCurrentTax", DatasetKind.NICHE),
    TAX_HISTORY("TaxHistory", "HasTaxHistory", DatasetKind.NICHE),
    BANKRUPTCY("Bankruptcy", "HasBankruptcy", DatasetKind.NICHE),
    CASH_BUYER("CashBuyer", "HasCashBuyer", DatasetKind.NICHE),
    INTER_FAMILY("InterFamily", "HasInterFamily", DatasetKind.NICHE),
    LANDLORD("Landlord", "HasLandlord", DatasetKind.NICHE),
    PROBATE("Probate", "HasProbate", DatasetKind.NICHE),
    INHERITED("Inherited", "HasInherited", DatasetKind.NICHE),
    VACANT("Vacant", "HasVacant", DatasetKind.NICHE),
    ST_BANKRUPTCY("STBankruptcy", "HasSTBankruptcy", DatasetKind.SKIP_TRACE),
    ST_FORECLOSURE("STForeclosure", "HasSTForeclosure", DatasetKind.SKIP_TRACE),
    ST_LIEN("STLien", "HasSTLien", DatasetKind.SKIP_TRACE),
    ST_JUDGMENT("STJudgment", "HasSTJudgment", DatasetKind.SKIP_TRACE),
    ST_QUITCLAIM("STQuitclaim", "HasSTQuitclaim", DatasetKind.SKIP_TRACE),
    ST_DECEASED("STDeceased", "HasSTDeceased", DatasetKind.SKIP_TRACE);

    /** Tag assigned to niche lists whose file name maps to no known type. */
    public static final String OTHER = "Other";

    private final String code;
    private final String flagColumn;
    private final DatasetKind source;

    EnrichmentTag(String code, String flagColumn, DatasetKind source) {
        this.code = code;
        this.flagColumn = flagColumn;
        this.source = source;
    }

    public String getCode() {
        return code;
    }

    public String getFlagColumn() {
        return flagColumn;
    }

    public DatasetKind getSource() {
        return source;
    }

    public static Optional<EnrichmentTag> fromCode(String code) {
        for (EnrichmentTag tag : values()) {
            if (tag.code.equals(code)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }

    /**
     * Output flag column for a tag code, e.g. {@code Liens -> HasLiens}, {@code Other -> HasOther}.
     */
    public static String flagColumnFor(String code) {
        return fromCode(code).map(EnrichmentTag::getFlagColumn).orElse("Has" + code);
    }

    /**
     * Human label used in composite priority names. Tag codes are already human readable.
     */
    public static String labelFor(String code) {
        return code;
    }
}
