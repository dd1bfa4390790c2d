package com.property.linkage.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of resolving one secondary record against the canonical index.
 * A successful strategy may yield several candidates sharing an address or identifier.
 *
 * @param matched  canonical records the secondary record corresponds to, empty when unmatched
 * @param strategy strategy that produced the candidates, {@link MatchStrategy#NONE} when unmatched
 */
public record MatchResult(List<CanonicalPropertyRecord> matched, MatchStrategy strategy) {

    private static final MatchResult NO_MATCH = new MatchResult(List.of(), MatchStrategy.NONE);

    public MatchResult {
        Objects.requireNonNull(strategy, "strategy is required");
        matched = matched != null ? List.copyOf(matched) : List.of();
        if (matched.isEmpty() != (strategy == MatchStrategy.NONE)) {
            throw new IllegalArgumentException("strategy " + strategy + " inconsistent with "
                    + matched.size() + " candidates");
        }
    }

    public static MatchResult noMatch() {
        return NO_MATCH;
    }

    public static MatchResult of(MatchStrategy strategy, List<CanonicalPropertyRecord> matched) {
        return new MatchResult(matched, strategy);
    }

    public boolean isMatched() {
        return strategy != MatchStrategy.NONE;
    }

    @Override
    public String toString() {
        return "MatchResult{strategy=" + strategy + ", candidates=" + matched.size() + '}';
    }
}
