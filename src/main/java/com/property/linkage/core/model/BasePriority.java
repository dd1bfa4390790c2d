package com.property.linkage.core.model;

import java.util.Objects;

/**
 * Base priority assigned by the scorer, or by the insertion path for niche-only records.
 *
 * @param id   numeric priority identifier
 * @param code short code such as {@code ABS1}; also the suffix of every composite code
 * @param name human readable name such as {@code ABS1 - High Priority Absentee}
 */
public record BasePriority(int id, String code, String name) {
    public BasePriority {
        Objects.requireNonNull(code, "code is required");
        Objects.requireNonNull(name, "name is required");
        if (code.isBlank()) {
            throw new IllegalArgumentException("code must not be blank");
        }
    }
}
