package com.property.linkage.classify;

import com.property.linkage.core.model.PropertyCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class RawLandDetectorTest {

    private final RawLandDetector detector = new RawLandDetector();

    @ParameterizedTest
    @DisplayName("Should categorize by street number presence")
    @CsvSource({
            "123 Main St,DEVELOPED",
            "12B Oak Ave,DEVELOPED",
            "Off Route 460,RAW_LAND",
            "Tract A Hill Rd,RAW_LAND",
            "RT 11 N,RAW_LAND"
    })
    void testCategorize(String address, PropertyCategory expected) {
        assertEquals(expected, detector.categorize(address));
    }

    @Test
    @DisplayName("Should not flag blank addresses as raw land")
    void testBlank() {
        assertFalse(detector.isRawLand(null));
        assertFalse(detector.isRawLand("  "));
    }
}
