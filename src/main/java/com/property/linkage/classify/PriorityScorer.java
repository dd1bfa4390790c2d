package com.property.linkage.classify;

import com.property.linkage.core.model.BaseClassification;
import com.property.linkage.core.model.BasePriority;
import com.property.linkage.core.model.PropertyCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Assigns a base priority from classification flags and sale history.
 *
 * <p>Blank, unparseable, pre-1901 and future sale dates are treated as very old, so such
 * records qualify for the "old sale" lists. Negative or unparseable amounts are ignored.</p>
 */
public class PriorityScorer {
    private static final Logger log = LoggerFactory.getLogger(PriorityScorer.class);

    static final LocalDate VERY_OLD_DATE = LocalDate.of(1850, 1, 1);

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("M/d/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yy"),
            DateTimeFormatter.ofPattern("yyyy/M/d"));

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("M/d/yyyy H:mm"),
            DateTimeFormatter.ofPattern("M/d/yyyy H:mm:ss"));

    private static final Set<String> TRUTHY = Set.of("true", "yes", "1", "y", "1.0");
    private static final Set<String> AMOUNT_PLACEHOLDERS = Set.of("null", "none", "n/a", "nan");

    private final PriorityThresholds thresholds;
    private final Clock clock;

    public PriorityScorer(PriorityThresholds thresholds) {
        this(thresholds, Clock.systemDefaultZone());
    }

    public PriorityScorer(PriorityThresholds thresholds, Clock clock) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public PriorityThresholds getThresholds() {
        return thresholds;
    }

    public BasePriority score(PropertyFacts facts, BaseClassification classification, PropertyCategory category) {
        return level(facts, classification, category).toBasePriority();
    }

    public PriorityLevel level(PropertyFacts facts, BaseClassification classification, PropertyCategory category) {
        if (category == PropertyCategory.RAW_LAND) {
            return PriorityLevel.DEFAULT;
        }
        if (classification.isTrust()) {
            return PriorityLevel.TRS2;
        }
        if (classification.isChurch()) {
            return PriorityLevel.CHURCH;
        }
        if (classification.isOwnerOccupied()) {
            return scoreOwnerOccupied(facts, classification);
        }
        return scoreAbsentee(facts, classification);
    }

    private PriorityLevel scoreOwnerOccupied(PropertyFacts facts, BaseClassification classification) {
        if (classification.ownerGrantorMatch()) {
            return PriorityLevel.OIN1;
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate saleDate = parseDate(facts.lastSaleDate());
        Double amount = parseAmount(facts.lastSaleAmount());

        if (!saleDate.isAfter(today.minusDays(365L * 20))) {
            return PriorityLevel.OWN20;
        }
        if (!saleDate.isAfter(today.minusDays(365L * 13))) {
            return PriorityLevel.OWN1;
        }
        if (amount != null && amount <= thresholds.amountCutoff1()) {
            return PriorityLevel.OON1;
        }
        boolean recent = !saleDate.isBefore(thresholds.dateCutoff2());
        if (recent && isCashBuyer(facts.lastCashBuyer())) {
            return PriorityLevel.BUY1;
        }
        if (recent) {
            return PriorityLevel.BUY2;
        }
        return PriorityLevel.DEFAULT;
    }

    private PriorityLevel scoreAbsentee(PropertyFacts facts, BaseClassification classification) {
        if (classification.ownerGrantorMatch()) {
            return PriorityLevel.INH1;
        }
        LocalDate saleDate = parseDate(facts.lastSaleDate());
        Double amount = parseAmount(facts.lastSaleAmount());

        if (!saleDate.isAfter(thresholds.dateCutoff1())) {
            return PriorityLevel.ABS1;
        }
        if (amount != null && amount <= thresholds.amountCutoff1()) {
            return PriorityLevel.TRS1;
        }
        if (!saleDate.isBefore(thresholds.dateCutoff2())) {
            return PriorityLevel.BUY1;
        }
        return PriorityLevel.DEFAULT;
    }

    /**
     * Parses a sale date, mapping blank, unparseable, pre-1901 and future values to a very old date.
     */
    LocalDate parseDate(String raw) {
        LocalDate parsed = tryParseDate(raw);
        if (parsed == null) {
            return VERY_OLD_DATE;
        }
        if (parsed.getYear() <= 1900) {
            return VERY_OLD_DATE;
        }
        if (parsed.isAfter(LocalDate.now(clock))) {
            log.debug("scoring.futureDate value={}", raw);
            return VERY_OLD_DATE;
        }
        return parsed;
    }

    /**
     * Parses a date in one of the common spreadsheet export formats; null when absent or unparseable.
     */
    public static LocalDate tryParseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(value, format);
            } catch (DateTimeParseException e) {
                log.trace("scoring.dateFormatMismatch format={} value={}", format, value);
            }
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(value, format).toLocalDate();
            } catch (DateTimeParseException e) {
                log.trace("scoring.dateFormatMismatch format={} value={}", format, value);
            }
        }
        log.debug("scoring.unparseableDate value={}", raw);
        return null;
    }

    /**
     * Parses an amount such as {@code $125,000.00}; null when absent, negative or unparseable.
     */
    public static Double parseAmount(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.replace(",", "").replace("$", "").trim();
        if (cleaned.isEmpty() || AMOUNT_PLACEHOLDERS.contains(cleaned.toLowerCase(Locale.ROOT))) {
            return null;
        }
        try {
            double amount = Double.parseDouble(cleaned);
            return amount < 0 ? null : amount;
        } catch (NumberFormatException e) {
            log.debug("scoring.unparseableAmount value={}", raw);
            return null;
        }
    }

    static boolean isCashBuyer(String raw) {
        return raw != null && TRUTHY.contains(raw.trim().toLowerCase(Locale.ROOT));
    }
}
