package com.property.linkage.classify;

import com.property.linkage.core.model.BaseClassification;
import com.property.linkage.core.model.BasePriority;
import com.property.linkage.core.model.PropertyCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class PriorityScorerTest {

    private static final PriorityThresholds THRESHOLDS = new PriorityThresholds(
            LocalDate.of(2009, 1, 1), LocalDate.of(2019, 1, 1), 75_000, 200_000);

    private static final BaseClassification OCCUPIED = new BaseClassification(false, false, false, true, false);
    private static final BaseClassification ABSENTEE = BaseClassification.none();

    private PriorityScorer scorer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(LocalDate.of(2026, 6, 1).atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        scorer = new PriorityScorer(THRESHOLDS, clock);
    }

    private static PropertyFacts sale(String date, String amount, String cashBuyer) {
        return new PropertyFacts("DOE JANE", null, "1 A St", "1 A St", null, date, amount, cashBuyer);
    }

    private PriorityLevel level(PropertyFacts facts, BaseClassification classification) {
        return scorer.level(facts, classification, PropertyCategory.DEVELOPED);
    }

    @Nested
    @DisplayName("Precedence")
    class PrecedenceTests {

        @Test
        @DisplayName("Should give raw land the default priority regardless of owner")
        void testRawLand() {
            BaseClassification trust = new BaseClassification(true, false, false, false, false);
            assertEquals(PriorityLevel.DEFAULT,
                    scorer.level(sale("2000-01-01", "1000", null), trust, PropertyCategory.RAW_LAND));
        }

        @Test
        @DisplayName("Should rank trust before church")
        void testTrustAndChurch() {
            assertEquals(PriorityLevel.TRS2,
                    level(sale(null, null, null), new BaseClassification(true, false, false, true, true)));
            assertEquals(PriorityLevel.CHURCH,
                    level(sale(null, null, null), new BaseClassification(false, true, false, false, false)));
        }

        @Test
        @DisplayName("Should rank grantor match first within occupancy groups")
        void testGrantorMatch() {
            assertEquals(PriorityLevel.OIN1,
                    level(sale("2024-01-01", "500000", null), new BaseClassification(false, false, false, true, true)));
            assertEquals(PriorityLevel.INH1,
                    level(sale("2024-01-01", "500000", null), new BaseClassification(false, false, false, false, true)));
        }
    }

    @ParameterizedTest
    @DisplayName("Should score owner-occupied properties by sale age and amount")
    @CsvSource({
            "2000-01-01,500000,,OWN20",
            ",,,OWN20",
            "2012-05-01,500000,,OWN1",
            "2020-03-01,50000,,OON1",
            "2020-03-01,150000,Yes,BUY1",
            "2020-03-01,150000,No,BUY2",
            "2015-01-01,150000,,DEFAULT"
    })
    void testOwnerOccupied(String date, String amount, String cash, PriorityLevel expected) {
        assertEquals(expected, level(sale(date, amount, cash), OCCUPIED));
    }

    @ParameterizedTest
    @DisplayName("Should score absentee properties by region thresholds")
    @CsvSource({
            "2008-05-01,500000,ABS1",
            "2009-01-01,500000,ABS1",
            ",,ABS1",
            "2030-01-01,500000,ABS1",
            "1899-12-31,500000,ABS1",
            "2010-06-01,'$50,000',TRS1",
            "2020-03-01,150000,BUY1",
            "2019-01-01,150000,BUY1",
            "2015-01-01,150000,DEFAULT"
    })
    void testAbsentee(String date, String amount, PriorityLevel expected) {
        assertEquals(expected, level(sale(date, amount, null), ABSENTEE));
    }

    @Test
    @DisplayName("Should expose code and name of the base priority")
    void testBasePriority() {
        BasePriority priority = scorer.score(sale("2008-05-01", null, null), ABSENTEE, PropertyCategory.DEVELOPED);
        assertEquals(7, priority.id());
        assertEquals("ABS1", priority.code());
        assertEquals("ABS1 - High Priority Absentee", priority.name());
    }

    @Nested
    @DisplayName("Parsing")
    class ParsingTests {

        @ParameterizedTest
        @DisplayName("Should parse common export date formats")
        @CsvSource({
                "2015-03-04,2015-03-04",
                "3/4/2015,2015-03-04",
                "03/04/2015,2015-03-04",
                "2015/3/4,2015-03-04",
                "2015-03-04 00:00:00,2015-03-04",
                "2015-03-04T10:15:30,2015-03-04"
        })
        void testTryParseDate(String raw, LocalDate expected) {
            assertEquals(expected, PriorityScorer.tryParseDate(raw));
        }

        @Test
        @DisplayName("Should return null for absent or unparseable dates")
        void testUnparseableDates() {
            assertNull(PriorityScorer.tryParseDate(null));
            assertNull(PriorityScorer.tryParseDate(" "));
            assertNull(PriorityScorer.tryParseDate("not a date"));
        }

        @Test
        @DisplayName("Should map unusable sale dates to very old")
        void testParseDate() {
            assertEquals(PriorityScorer.VERY_OLD_DATE, scorer.parseDate("garbage"));
            assertEquals(PriorityScorer.VERY_OLD_DATE, scorer.parseDate("1900-06-01"));
            assertEquals(PriorityScorer.VERY_OLD_DATE, scorer.parseDate("2027-01-01"));
            assertEquals(LocalDate.of(1901, 1, 1), scorer.parseDate("1901-01-01"));
        }

        @ParameterizedTest
        @DisplayName("Should parse amounts with currency formatting")
        @CsvSource({
                "'$125,000.00',125000.0",
                "75000,75000.0",
                "' 0 ',0.0"
        })
        void testParseAmount(String raw, Double expected) {
            assertEquals(expected, PriorityScorer.parseAmount(raw));
        }

        @Test
        @DisplayName("Should ignore negative and placeholder amounts")
        void testInvalidAmounts() {
            assertNull(PriorityScorer.parseAmount("-5"));
            assertNull(PriorityScorer.parseAmount("NaN"));
            assertNull(PriorityScorer.parseAmount("abc"));
            assertNull(PriorityScorer.parseAmount(null));
        }

        @Test
        @DisplayName("Should recognize cash buyer indicators")
        void testCashBuyer() {
            assertTrue(PriorityScorer.isCashBuyer("Yes"));
            assertTrue(PriorityScorer.isCashBuyer("1.0"));
            assertFalse(PriorityScorer.isCashBuyer("No"));
            assertFalse(PriorityScorer.isCashBuyer(null));
        }
    }
}
