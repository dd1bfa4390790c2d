package com.property.linkage.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Applies a fixed rule set to matching keys.
 * Rules run in priority order (lower number first), followed by a final uppercase, trim
 * and whitespace collapse. Immutable once built, so one engine serves all matching threads.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::priority));
        this.rules = List.copyOf(sorted);
    }

    /**
     * Normalizes a value for the given key field. Null or blank input yields {@code ""}.
     */
    public String normalize(String value, KeyField field) {
        Objects.requireNonNull(field, "field is required");
        if (value == null || value.isBlank()) {
            return "";
        }

        String result = value.trim();
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(field)) {
                String before = result;
                result = rule.apply(result);
                if (log.isTraceEnabled() && !before.equals(result)) {
                    log.trace("normalize.rule name={} field={} '{}' -> '{}'", rule.name(), field, before, result);
                }
            }
        }

        return WHITESPACE.matcher(result.toUpperCase(Locale.ROOT).trim()).replaceAll(" ");
    }
}
