package com.property.linkage.classify;

import com.property.linkage.core.model.BasePriority;

/**
 * Base priority table. Ids are stable and appear in output.
 */
public enum PriorityLevel {
    OIN1(1, "Owner Occupied Grantor Match"),
    OWN1(2, "Owner Occupied Old Property"),
    OON1(3, "Owner Occupied Low Value"),
    BUY2(4, "Recent Non-Cash Buyer"),
    TRS2(5, "Trust"),
    INH1(6, "Absentee Grantor Match"),
    ABS1(7, "High Priority Absentee"),
    TRS1(8, "Absentee Low Value"),
    BUY1(9, "Investor Buyers"),
    CHURCH(10, "Church Property"),
    DEFAULT(11, "Default"),
    OWN20(13, "Very Old Owner Occupied");

    private final int id;
    private final String description;
    private final BasePriority basePriority;

    PriorityLevel(int id, String description) {
        this.id = id;
        this.description = description;
        this.basePriority = new BasePriority(id, name(), name() + " - " + description);
    }

    public int getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public BasePriority toBasePriority() {
        return basePriority;
    }

    public static PriorityLevel fromId(int id) {
        for (PriorityLevel level : values()) {
            if (level.id == id) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown priority id: " + id);
    }
}
