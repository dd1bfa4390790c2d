package com.property.linkage.rules;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One case-insensitive regex rewrite applied to the key fields it names.
 *
 * @param name        rule name, used in trace logging
 * @param pattern     compiled pattern
 * @param replacement replacement, may reference groups ({@code $1})
 * @param fields      key fields the rule rewrites, never empty
 * @param priority    lower runs first
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, Set<KeyField> fields, int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("rule '" + name + "' must name at least one key field");
        }
        fields = Set.copyOf(fields);
    }

    public boolean appliesTo(KeyField field) {
        return fields.contains(field);
    }

    public String apply(String input) {
        return pattern.matcher(input).replaceAll(replacement);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private final Set<KeyField> fields = EnumSet.noneOf(KeyField.class);
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder applicableFields(KeyField... fields) {
            this.fields.addAll(Set.of(fields));
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(pattern, "pattern is required");
            return new NormalizationRule(name, Pattern.compile(pattern, Pattern.CASE_INSENSITIVE),
                    replacement, fields, priority);
        }
    }
}
