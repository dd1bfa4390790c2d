package com.property.linkage.classify;

import com.property.linkage.core.model.BaseClassification;

import java.util.List;
import java.util.Locale;

/**
 * Keyword-table classifier for registry owners.
 *
 * <p>Trust is checked first; church only when not a trust; business only when not a church.
 * A trust whose name contains "the" also counts as a business. All matching is on the
 * lowercased owner name.</p>
 */
public class PropertyClassifier {

    static final List<String> TRUST_KEYWORDS = List.of(
            "trus", "estate", "decl", "supplemental", "living", "amend",
            "life", "trs", "execut", "revoc", "irrev");

    static final List<String> CHURCH_KEYWORDS = List.of(
            "church", "evangel", "presbyterian", "bible", "episcopal", "dioce",
            "protestant", "trinity", "holy", "jerusalum", "baptist", "lutheran",
            "nazar", " god ", "convenant", "ministry", " christ ");

    static final List<String> CHURCH_ENDINGS = List.of(" christ", " god");

    static final List<String> BUSINESS_KEYWORDS = List.of(
            "roanoke", "llc", "housing", "develop", "author", "planning",
            "district", "commiss", "partner", "group", "condo", "city",
            "real", "holding", "company", " inc ", " co ", " tc ",
            " bank ", "proprietor", "propert", "foundation", "commonwealth",
            "clinic", " office", "limit", " ltd", " health", " llp",
            " assoc", " corp", "virginia", "north carolina", "enterprises",
            "attorney", "credit union", "incorporated", "medical", "center");

    static final List<String> BUSINESS_ENDINGS = List.of(" lc", " inc", " co", " tc", " bank", " ltd", " llp");

    private static final List<String> TRUST_ARTICLE = List.of(" the ", " the", "the ");

    /**
     * Owner-name classification; {@code isOwnerOccupied} is always false here.
     */
    public BaseClassification classify(String ownerName, String grantorName) {
        String owner = ownerName == null ? "" : ownerName.toLowerCase(Locale.ROOT);

        boolean trust = containsAny(owner, TRUST_KEYWORDS);
        boolean church = !trust && (containsAny(owner, CHURCH_KEYWORDS) || endsWithAny(owner, CHURCH_ENDINGS));
        boolean business = !church && isBusiness(owner, trust);
        boolean grantorMatch = grantorMatches(owner, grantorName);

        return new BaseClassification(trust, church, business, false, grantorMatch);
    }

    /**
     * Full classification including owner occupancy.
     */
    public BaseClassification classify(PropertyFacts facts) {
        return classify(facts.ownerName(), facts.grantorName())
                .withOwnerOccupied(isOwnerOccupied(facts));
    }

    /**
     * An explicit yes/no occupancy column wins; otherwise the property and mailing addresses must
     * be equal ignoring case. PO boxes are never owner occupied.
     */
    public boolean isOwnerOccupied(PropertyFacts facts) {
        String flag = facts.ownerOccupiedFlag();
        if (flag != null && !flag.isBlank()) {
            return flag.trim().equalsIgnoreCase("yes");
        }
        String property = facts.address() == null ? "" : facts.address().trim().toLowerCase(Locale.ROOT);
        String mailing = facts.mailingAddress() == null ? "" : facts.mailingAddress().trim().toLowerCase(Locale.ROOT);
        if (property.isEmpty() || mailing.isEmpty()) {
            return false;
        }
        if (mailing.startsWith("po ") || mailing.startsWith("p o ") || mailing.startsWith("p.o.")) {
            return false;
        }
        return property.equals(mailing);
    }

    /**
     * First words equal but full names differ.
     */
    static boolean grantorMatches(String lowerOwner, String grantorName) {
        if (grantorName == null || grantorName.isBlank()) {
            return false;
        }
        String grantor = grantorName.toLowerCase(Locale.ROOT);
        String[] ownerWords = lowerOwner.trim().split("\\s+");
        String[] grantorWords = grantor.trim().split("\\s+");
        if (ownerWords[0].isEmpty() || grantorWords[0].isEmpty()) {
            return false;
        }
        return ownerWords[0].equals(grantorWords[0]) && !lowerOwner.equals(grantor);
    }

    private static boolean isBusiness(String owner, boolean trust) {
        return containsAny(owner, BUSINESS_KEYWORDS)
                || endsWithAny(owner, BUSINESS_ENDINGS)
                || (trust && containsAny(owner, TRUST_ARTICLE));
    }

    private static boolean containsAny(String value, List<String> keywords) {
        for (String keyword : keywords) {
            if (value.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static boolean endsWithAny(String value, List<String> endings) {
        for (String ending : endings) {
            if (value.endsWith(ending)) {
                return true;
            }
        }
        return false;
    }
}
