package com.property.linkage.merge;

import com.property.linkage.api.PropertyRegistry;
import com.property.linkage.core.model.CanonicalPropertyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Appends recent-sales rows whose address is not yet in the registry.
 * Runs before any secondary dataset pass.
 */
public class RecentSalesAppender {
    private static final Logger log = LoggerFactory.getLogger(RecentSalesAppender.class);

    /**
     * @return number of records appended
     */
    public int append(PropertyRegistry registry, List<CanonicalPropertyRecord> recentSales) {
        Set<String> existing = new HashSet<>();
        for (CanonicalPropertyRecord record : registry.records()) {
            existing.add(record.getNormalizedAddressKey());
        }

        List<CanonicalPropertyRecord> unique = new ArrayList<>();
        int skippedBlank = 0;
        for (CanonicalPropertyRecord sale : recentSales) {
            String key = sale.getNormalizedAddressKey();
            if (key.isEmpty()) {
                skippedBlank++;
            } else if (!existing.contains(key)) {
                unique.add(sale);
            }
        }

        registry.addAll(unique);
        log.info("recentSales.appended candidates={} appended={} blankAddress={}",
                recentSales.size(), unique.size(), skippedBlank);
        return unique.size();
    }
}
