package com.property.linkage.index;

import com.property.linkage.core.model.CanonicalPropertyRecord;

import java.util.List;
import java.util.Map;

/**
 * Read-only lookup structures over the canonical registry, built once per pass.
 * Every map is one-to-many since neither parcel identifiers nor addresses are assumed unique.
 *
 * <p>{@code byAddressComponent} is derived from the keys of {@code byAddressCityKey} by
 * dropping the city component; it serves the address-only fallback from the same key space.</p>
 */
public final class CanonicalIndex {
    private final Map<String, List<CanonicalPropertyRecord>> byStructuredId;
    private final Map<String, List<CanonicalPropertyRecord>> byBaseStructuredId;
    private final Map<String, List<CanonicalPropertyRecord>> byAddressCityKey;
    private final Map<String, List<CanonicalPropertyRecord>> byAddressComponent;
    private final long registryVersion;
    private final int indexedRecords;

    CanonicalIndex(Map<String, List<CanonicalPropertyRecord>> byStructuredId,
                   Map<String, List<CanonicalPropertyRecord>> byBaseStructuredId,
                   Map<String, List<CanonicalPropertyRecord>> byAddressCityKey,
                   Map<String, List<CanonicalPropertyRecord>> byAddressComponent,
                   long registryVersion,
                   int indexedRecords) {
        this.byStructuredId = byStructuredId;
        this.byBaseStructuredId = byBaseStructuredId;
        this.byAddressCityKey = byAddressCityKey;
        this.byAddressComponent = byAddressComponent;
        this.registryVersion = registryVersion;
        this.indexedRecords = indexedRecords;
    }

    public List<CanonicalPropertyRecord> findByStructuredId(String normalizedId) {
        return byStructuredId.getOrDefault(normalizedId, List.of());
    }

    public List<CanonicalPropertyRecord> findByBaseStructuredId(String baseId) {
        return byBaseStructuredId.getOrDefault(baseId, List.of());
    }

    public List<CanonicalPropertyRecord> findByAddressCityKey(String key) {
        return byAddressCityKey.getOrDefault(key, List.of());
    }

    public List<CanonicalPropertyRecord> findByAddress(String normalizedAddress) {
        return byAddressComponent.getOrDefault(normalizedAddress, List.of());
    }

    /**
     * Registry version this index was built from.
     */
    public long getRegistryVersion() {
        return registryVersion;
    }

    public int getIndexedRecords() {
        return indexedRecords;
    }

    public int structuredIdKeyCount() {
        return byStructuredId.size();
    }

    public int addressKeyCount() {
        return byAddressCityKey.size();
    }

    @Override
    public String toString() {
        return "CanonicalIndex{records=" + indexedRecords +
                ", structuredIds=" + byStructuredId.size() +
                ", addressKeys=" + byAddressCityKey.size() +
                ", version=" + registryVersion + '}';
    }
}
