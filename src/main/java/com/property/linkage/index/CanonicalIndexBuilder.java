package com.property.linkage.index;

import com.property.linkage.core.model.CanonicalPropertyRecord;
import com.property.linkage.rules.KeyNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link CanonicalIndex} instances over a registry snapshot.
 */
public class CanonicalIndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(CanonicalIndexBuilder.class);

    public CanonicalIndex build(Collection<CanonicalPropertyRecord> records) {
        return build(records, 0L);
    }

    public CanonicalIndex build(Collection<CanonicalPropertyRecord> records, long registryVersion) {
        Map<String, List<CanonicalPropertyRecord>> byStructuredId = new HashMap<>();
        Map<String, List<CanonicalPropertyRecord>> byBaseStructuredId = new HashMap<>();
        Map<String, List<CanonicalPropertyRecord>> byAddressCityKey = new HashMap<>();
        Map<String, List<CanonicalPropertyRecord>> byAddressComponent = new HashMap<>();

        for (CanonicalPropertyRecord record : records) {
            String id = KeyNormalizer.normalizeStructuredId(record.getStructuredId());
            if (!id.isEmpty()) {
                add(byStructuredId, id, record);
                String baseId = KeyNormalizer.baseStructuredId(id);
                if (!baseId.isEmpty()) {
                    add(byBaseStructuredId, baseId, record);
                }
            }

            String key = KeyNormalizer.makeAddressCityKey(record.getAddress(), record.getCity());
            if (!key.isEmpty()) {
                add(byAddressCityKey, key, record);
                add(byAddressComponent, KeyNormalizer.addressComponent(key), record);
            }
        }

        CanonicalIndex index = new CanonicalIndex(
                freeze(byStructuredId), freeze(byBaseStructuredId),
                freeze(byAddressCityKey), freeze(byAddressComponent),
                registryVersion, records.size());
        log.debug("index.built {}", index);
        return index;
    }

    private static void add(Map<String, List<CanonicalPropertyRecord>> map, String key,
                            CanonicalPropertyRecord record) {
        map.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
    }

    private static Map<String, List<CanonicalPropertyRecord>> freeze(
            Map<String, List<CanonicalPropertyRecord>> map) {
        Map<String, List<CanonicalPropertyRecord>> frozen = new HashMap<>(map.size() * 2);
        map.forEach((key, value) -> frozen.put(key, List.copyOf(value)));
        return frozen;
    }
}
