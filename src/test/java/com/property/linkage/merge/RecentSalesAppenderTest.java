package com.property.linkage.merge;

import com.property.linkage.api.PropertyRegistry;
import com.property.linkage.classify.PriorityLevel;
import com.property.linkage.core.model.CanonicalPropertyRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecentSalesAppenderTest {

    private static CanonicalPropertyRecord record(String address) {
        return CanonicalPropertyRecord.builder()
                .address(address)
                .jurisdictionCode("51770")
                .basePriority(PriorityLevel.BUY2.toBasePriority())
                .build();
    }

    @Test
    @DisplayName("Should append only sales whose address is not in the registry")
    void testAppendsNewAddresses() {
        PropertyRegistry registry = new PropertyRegistry("51770");
        registry.add(record("1 A St"));

        int appended = new RecentSalesAppender().append(registry, List.of(
                record("1 a st"),
                record("2 B St"),
                record("  "),
                record("3 C St")));

        assertEquals(2, appended);
        assertEquals(List.of("1 A St", "2 B St", "3 C St"),
                registry.records().stream().map(CanonicalPropertyRecord::getAddress).toList());
    }

    @Test
    @DisplayName("Should not change the registry when nothing is new")
    void testNothingNew() {
        PropertyRegistry registry = new PropertyRegistry("51770");
        registry.add(record("1 A St"));
        long version = registry.getVersion();

        assertEquals(0, new RecentSalesAppender().append(registry, List.of(record("1 A ST"))));
        assertEquals(version, registry.getVersion());
    }
}
