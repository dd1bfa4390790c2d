package com.property.linkage.api;

import com.property.linkage.core.model.CanonicalPropertyRecord;
import com.property.linkage.index.JurisdictionFilter;
import com.property.linkage.region.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The canonical property registry of one jurisdiction.
 *
 * <p>Owned by a single linkage run; not thread-safe. Records are only ever appended.
 * {@link #getVersion()} changes on every append so cached indexes can tell they are stale.</p>
 */
public class PropertyRegistry {
    private final String jurisdictionCode;
    private final List<String> columns;
    private final List<CanonicalPropertyRecord> records = new ArrayList<>();
    private long version;

    public PropertyRegistry(String jurisdictionCode) {
        this(jurisdictionCode, List.of());
    }

    /**
     * @param jurisdictionCode registry jurisdiction, required
     * @param columns          input schema columns, reproduced first on output
     */
    public PropertyRegistry(String jurisdictionCode, List<String> columns) {
        String normalized = JurisdictionFilter.normalizeCode(jurisdictionCode);
        if (normalized.isEmpty()) {
            throw new ConfigurationException("Registry jurisdiction code must not be null or blank");
        }
        this.jurisdictionCode = normalized;
        this.columns = columns != null ? List.copyOf(columns) : List.of();
    }

    public String getJurisdictionCode() {
        return jurisdictionCode;
    }

    public List<String> getColumns() {
        return columns;
    }

    public void add(CanonicalPropertyRecord record) {
        Objects.requireNonNull(record, "record is required");
        records.add(record);
        version++;
    }

    public void addAll(Collection<CanonicalPropertyRecord> newRecords) {
        if (newRecords.isEmpty()) {
            return;
        }
        for (CanonicalPropertyRecord record : newRecords) {
            Objects.requireNonNull(record, "record is required");
        }
        records.addAll(newRecords);
        version++;
    }

    /**
     * Live, read-only view in insertion order.
     */
    public List<CanonicalPropertyRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    public long getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "PropertyRegistry{jurisdiction=" + jurisdictionCode + ", records=" + records.size()
                + ", version=" + version + '}';
    }
}
