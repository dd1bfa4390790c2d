package com.property.linkage.index;

import com.property.linkage.classify.PriorityLevel;
import com.property.linkage.core.model.CanonicalPropertyRecord;
import com.property.linkage.core.model.MatchResult;
import com.property.linkage.core.model.MatchStrategy;
import com.property.linkage.core.model.SecondaryRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatchCascadeResolverTest {

    private MatchCascadeResolver resolver;
    private CanonicalPropertyRecord mainStRoanoke;
    private CanonicalPropertyRecord mainStSalem;
    private CanonicalPropertyRecord parcel;
    private CanonicalIndex index;

    @BeforeEach
    void setUp() {
        resolver = new MatchCascadeResolver();
        mainStRoanoke = record("123 Main St", "Roanoke", null);
        mainStSalem = record("123 Main St", "Salem", null);
        parcel = record("9 Hill Rd", "Roanoke", "555-12");
        index = new CanonicalIndexBuilder().build(List.of(mainStRoanoke, mainStSalem, parcel));
    }

    private static CanonicalPropertyRecord record(String address, String city, String apn) {
        return CanonicalPropertyRecord.builder()
                .address(address).city(city).structuredId(apn)
                .jurisdictionCode("51770")
                .basePriority(PriorityLevel.DEFAULT.toBasePriority())
                .build();
    }

    private static SecondaryRecord row(String address, String city, String apn) {
        return SecondaryRecord.builder()
                .sourceType("Liens").address(address).city(city).structuredId(apn)
                .jurisdictionCode("51770")
                .build();
    }

    @Test
    @DisplayName("Should prefer structured identifier over address")
    void testStructuredIdFirst() {
        MatchResult result = resolver.resolve(row("123 Main St", "Roanoke", "55512"), index);

        assertEquals(MatchStrategy.STRUCTURED_ID, result.strategy());
        assertEquals(List.of(parcel), result.matched());
    }

    @Test
    @DisplayName("Should match sub-parcel identifier against its base parcel")
    void testSubParcelFallsBackToBase() {
        MatchResult result = resolver.resolve(row("nowhere", null, "555-12B"), index);

        assertEquals(MatchStrategy.STRUCTURED_ID, result.strategy());
        assertEquals(List.of(parcel), result.matched());
    }

    @Test
    @DisplayName("Should match base identifier against registry sub-parcels")
    void testBaseMatchesSubParcels() {
        CanonicalPropertyRecord unitA = record("1 Tower Pl", null, "700A");
        CanonicalPropertyRecord unitB = record("1 Tower Pl", null, "700B");
        CanonicalIndex towerIndex = new CanonicalIndexBuilder().build(List.of(unitA, unitB));

        MatchResult result = resolver.resolve(row("x", null, "700"), towerIndex);

        assertEquals(MatchStrategy.STRUCTURED_ID, result.strategy());
        assertEquals(List.of(unitA, unitB), result.matched());
    }

    @Test
    @DisplayName("Should not match a sub-parcel to a sibling sub-parcel")
    void testSiblingSubParcelFallsThroughToAddress() {
        CanonicalPropertyRecord siblingUnit = record("10 Oak St", "Roanoke", "1234A");
        CanonicalPropertyRecord oakSt = record("12 Oak St", "Roanoke", null);
        CanonicalIndex oakIndex = new CanonicalIndexBuilder().build(List.of(siblingUnit, oakSt));

        MatchResult result = resolver.resolve(row("12 Oak St", "Roanoke", "1234B"), oakIndex);

        assertEquals(MatchStrategy.ADDRESS_CITY, result.strategy());
        assertEquals(List.of(oakSt), result.matched());
    }

    @Test
    @DisplayName("Should fall through to address when identifier is unknown")
    void testUnknownIdFallsThrough() {
        MatchResult result = resolver.resolve(row("123 MAIN ST", "Roanoke", "999"), index);

        assertEquals(MatchStrategy.ADDRESS_CITY, result.strategy());
        assertEquals(List.of(mainStRoanoke), result.matched());
    }

    @Test
    @DisplayName("Should match every registry record sharing the address when city is absent")
    void testAddressOnly() {
        MatchResult result = resolver.resolve(row("123 Main St", null, null), index);

        assertEquals(MatchStrategy.ADDRESS_ONLY, result.strategy());
        assertEquals(List.of(mainStRoanoke, mainStSalem), result.matched());
    }

    @Test
    @DisplayName("Should use address only when the city differs")
    void testCityMismatch() {
        MatchResult result = resolver.resolve(row("123 Main St", "Vinton", null), index);

        assertEquals(MatchStrategy.ADDRESS_ONLY, result.strategy());
        assertEquals(2, result.matched().size());
    }

    @Test
    @DisplayName("Should report no match")
    void testNoMatch() {
        MatchResult result = resolver.resolve(row("77 Unknown Ln", "Roanoke", null), index);

        assertEquals(MatchStrategy.NONE, result.strategy());
        assertFalse(result.isMatched());
        assertTrue(result.matched().isEmpty());
    }

    @Test
    @DisplayName("Should not match a blank address")
    void testBlankAddress() {
        assertEquals(MatchStrategy.NONE, resolver.resolve(row("  ", "Roanoke", null), index).strategy());
    }
}
