package com.property.linkage.api;

import com.property.linkage.bulk.SchemaException;
import com.property.linkage.classify.PriorityLevel;
import com.property.linkage.core.model.CanonicalPropertyRecord;
import com.property.linkage.core.model.DatasetKind;
import com.property.linkage.core.model.GoldenContact;
import com.property.linkage.core.model.MatchStrategy;
import com.property.linkage.core.model.SecondaryRecord;
import com.property.linkage.index.CanonicalIndex;
import com.property.linkage.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LinkageOrchestratorTest {

    private static final String FIPS = "51770";

    private PropertyRegistry registry;
    private CanonicalPropertyRecord mainSt;
    private LinkageOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        registry = new PropertyRegistry(FIPS);
        mainSt = canonical("123 MAIN ST", "ROANOKE", null, PriorityLevel.OWN1);
        registry.add(mainSt);
        orchestrator = new LinkageOrchestrator();
    }

    private static CanonicalPropertyRecord canonical(String address, String city, String apn, PriorityLevel level) {
        return CanonicalPropertyRecord.builder()
                .address(address).city(city).structuredId(apn)
                .jurisdictionCode(FIPS)
                .basePriority(level.toBasePriority())
                .build();
    }

    private static SecondaryRecord niche(String sourceType, String address) {
        return niche(sourceType, address, null, null, FIPS);
    }

    private static SecondaryRecord niche(String sourceType, String address, String city, String apn, String fips) {
        return SecondaryRecord.builder()
                .sourceType(sourceType).address(address).city(city).structuredId(apn).jurisdictionCode(fips)
                .build();
    }

    private static SecondaryDataset nicheDataset(String sourceType, SecondaryRecord... rows) {
        return new SecondaryDataset(sourceType.toLowerCase() + ".csv", DatasetKind.NICHE, sourceType, List.of(rows));
    }

    @Nested
    @DisplayName("Scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("Should enrich a registry record matched by address")
        void testMatchedByAddress() {
            LinkageSummary summary = orchestrator.link(registry, nicheDataset("Liens", niche("Liens", "123 Main St,")));

            assertEquals(1, summary.matchedRecords());
            assertEquals(0, summary.insertedRecords());
            assertEquals(1, summary.countFor(MatchStrategy.ADDRESS_ONLY));
            assertEquals(List.of("Liens"), mainSt.getAccumulatedTags());
            assertEquals("Liens-OWN1", mainSt.getCompositePriorityCode());
        }

        @Test
        @DisplayName("Should insert an unmatched niche row as a niche-only record")
        void testInsertsUnmatched() {
            LinkageSummary summary = orchestrator.link(registry, nicheDataset("Liens", niche("Liens", "999 New Ave")));

            assertEquals(1, summary.insertedRecords());
            assertEquals(1, summary.unmatchedRecords());
            assertEquals(2, registry.size());
            CanonicalPropertyRecord inserted = registry.records().get(1);
            assertEquals("Liens", inserted.getBasePriority().code());
            assertTrue(inserted.getAccumulatedTags().isEmpty());
            assertTrue(inserted.isNicheOnly());
        }

        @Test
        @DisplayName("Should not duplicate tags when a dataset is applied twice")
        void testIdempotent() {
            SecondaryDataset liens = nicheDataset("Liens", niche("Liens", "123 Main St"), niche("Liens", "999 New Ave"));

            orchestrator.link(registry, liens);
            String codeAfterFirst = mainSt.getCompositePriorityCode();
            LinkageSummary second = orchestrator.link(registry, liens);

            assertEquals(List.of("Liens"), mainSt.getAccumulatedTags());
            assertEquals(codeAfterFirst, mainSt.getCompositePriorityCode());
            assertEquals(0, second.insertedRecords());
            assertEquals(0, second.enrichedRecords());
            assertEquals(2, registry.size());
            assertEquals("Liens", registry.records().get(1).getCompositePriorityCode());
        }
    }

    @Nested
    @DisplayName("Matching")
    class MatchingTests {

        @Test
        @DisplayName("Should never match across jurisdictions")
        void testJurisdictionIsolation() {
            LinkageSummary summary = orchestrator.link(registry,
                    nicheDataset("Liens", niche("Liens", "123 MAIN ST", "ROANOKE", null, "51775")));

            assertEquals(1, summary.jurisdictionFiltered());
            assertEquals(0, summary.matchedRecords());
            assertEquals(0, summary.insertedRecords());
            assertTrue(mainSt.getAccumulatedTags().isEmpty());
            assertEquals(1, registry.size());
        }

        @Test
        @DisplayName("Should report structured id when both id and address match")
        void testStrategyPrecedence() {
            CanonicalPropertyRecord parcel = canonical("1 OTHER RD", "ROANOKE", "555", PriorityLevel.ABS1);
            registry.add(parcel);

            LinkageSummary summary = orchestrator.link(registry,
                    nicheDataset("Vacant", niche("Vacant", "123 Main St", "Roanoke", "555", FIPS)));

            assertEquals(1, summary.countFor(MatchStrategy.STRUCTURED_ID));
            assertEquals(List.of("Vacant"), parcel.getAccumulatedTags());
            assertTrue(mainSt.getAccumulatedTags().isEmpty());
        }

        @Test
        @DisplayName("Should count anomalies without matching or inserting them")
        void testAnomalies() {
            LinkageSummary summary = orchestrator.link(registry, nicheDataset("Liens",
                    niche("Liens", "  "),
                    niche("Liens", "123 Main St", null, "---", FIPS),
                    niche("Liens", "123 Main St", null, "", FIPS)));

            assertEquals(3, summary.totalRecords());
            assertEquals(1, summary.skippedBlankAddress());
            assertEquals(1, summary.skippedInvalidStructuredId());
            assertEquals(1, summary.matchedRecords());
            assertEquals(1, registry.size());
        }

        @Test
        @DisplayName("Should match on address when the parcel id is a spreadsheet placeholder")
        void testPlaceholderIdMatchesOnAddress() {
            LinkageSummary summary = orchestrator.link(registry, nicheDataset("Liens",
                    niche("Liens", "123 Main St", null, "N/A", FIPS),
                    niche("Liens", "123 Main St", null, "nan", FIPS)));

            assertEquals(0, summary.skippedInvalidStructuredId());
            assertEquals(2, summary.matchedRecords());
            assertEquals(2, summary.countFor(MatchStrategy.ADDRESS_ONLY));
            assertEquals(List.of("Liens"), mainSt.getAccumulatedTags());
        }

        @Test
        @DisplayName("Should enrich every candidate of an ambiguous address match")
        void testAmbiguousMatch() {
            CanonicalPropertyRecord salem = canonical("123 MAIN ST", "SALEM", null, PriorityLevel.BUY2);
            registry.add(salem);

            LinkageSummary summary = orchestrator.link(registry, nicheDataset("Probate", niche("Probate", "123 Main St")));

            assertEquals(1, summary.matchedRecords());
            assertEquals(2, summary.enrichedRecords());
            assertEquals("Probate-OWN1", mainSt.getCompositePriorityCode());
            assertEquals("Probate-BUY2", salem.getCompositePriorityCode());
        }
    }

    @Nested
    @DisplayName("Multiple datasets")
    class MultipleDatasetTests {

        @Test
        @DisplayName("Should let later datasets see earlier insertions")
        void testLaterDatasetsSeeInserts() {
            orchestrator.link(registry, nicheDataset("Liens", niche("Liens", "999 New Ave")));
            LinkageSummary vacant = orchestrator.link(registry, nicheDataset("Vacant", niche("Vacant", "999 New Ave")));

            assertEquals(1, vacant.matchedRecords());
            assertEquals(0, vacant.insertedRecords());
            CanonicalPropertyRecord inserted = registry.records().get(1);
            assertEquals("Vacant-Liens", inserted.getCompositePriorityCode());
        }

        @Test
        @DisplayName("Should not match rows against records inserted in the same pass")
        void testNoSelfMatchWithinPass() {
            LinkageSummary summary = orchestrator.link(registry,
                    nicheDataset("Liens", niche("Liens", "999 New Ave"), niche("Liens", "999 NEW AVE")));

            assertEquals(2, summary.insertedRecords());
            assertEquals(3, registry.size());
        }

        @Test
        @DisplayName("Should keep tag order stable across runs")
        void testOrderingDeterminism() {
            List<String> first = runThreeDatasets(new LinkageOrchestrator());
            List<String> second = runThreeDatasets(new LinkageOrchestrator());

            assertEquals(List.of("Vacant", "Liens", "STDeceased"), first);
            assertEquals(first, second);
        }

        private List<String> runThreeDatasets(LinkageOrchestrator linker) {
            PropertyRegistry fresh = new PropertyRegistry(FIPS);
            CanonicalPropertyRecord record = canonical("123 MAIN ST", "ROANOKE", null, PriorityLevel.OWN1);
            fresh.add(record);
            linker.link(fresh, nicheDataset("Vacant", niche("Vacant", "123 Main St")));
            linker.link(fresh, nicheDataset("Liens", niche("Liens", "123 Main St")));
            SecondaryRecord skip = SecondaryRecord.builder()
                    .kind(DatasetKind.SKIP_TRACE).sourceType("SkipTrace")
                    .enrichmentTags(List.of("STDeceased")).address("123 Main St").jurisdictionCode(FIPS)
                    .goldenContact(new GoldenContact("PO Box 1", null, null, null))
                    .build();
            linker.link(fresh, new SecondaryDataset("skip.csv", DatasetKind.SKIP_TRACE, "SkipTrace", List.of(skip)));
            return record.getAccumulatedTags();
        }

        @Test
        @DisplayName("Should never insert unmatched skip-trace rows")
        void testSkipTraceDoesNotInsert() {
            SecondaryRecord skip = SecondaryRecord.builder()
                    .kind(DatasetKind.SKIP_TRACE).sourceType("SkipTrace")
                    .enrichmentTags(List.of("STLien")).address("404 Lost Ln").jurisdictionCode(FIPS)
                    .build();

            LinkageSummary summary = orchestrator.link(registry,
                    new SecondaryDataset("skip.csv", DatasetKind.SKIP_TRACE, "SkipTrace", List.of(skip)));

            assertEquals(1, summary.unmatchedRecords());
            assertEquals(0, summary.insertedRecords());
            assertEquals(1, registry.size());
        }
    }

    @Nested
    @DisplayName("Parallel resolution")
    class ParallelTests {

        @Test
        @DisplayName("Should produce the same registry as sequential resolution")
        void testParallelEqualsSequential() {
            List<String> sequential = linkLargeDataset(1);
            List<String> parallel = linkLargeDataset(4);

            assertEquals(sequential, parallel);
        }

        private List<String> linkLargeDataset(int parallelism) {
            PropertyRegistry fresh = new PropertyRegistry(FIPS);
            for (int i = 0; i < 200; i++) {
                fresh.add(canonical(i + " MAIN ST", "ROANOKE", "P" + i, PriorityLevel.ABS1));
            }
            List<SecondaryRecord> rows = new ArrayList<>();
            for (int i = 0; i < 300; i++) {
                rows.add(niche(i % 2 == 0 ? "Liens" : "Vacant", (i % 250) + " Main St"));
            }
            LinkageOrchestrator linker = new LinkageOrchestrator(LinkageOptions.builder().parallelism(parallelism).build());
            linker.link(fresh, new SecondaryDataset("mixed.csv", DatasetKind.NICHE, "Liens", rows));

            return fresh.records().stream().map(CanonicalPropertyRecord::getCompositePriorityCode).toList();
        }
    }

    @Nested
    @DisplayName("Errors and metrics")
    class ErrorTests {

        @Mock
        private SecondaryDatasetSource brokenSource;

        @Mock
        private MetricsService metricsService;

        @Test
        @DisplayName("Should report a schema error and continue with remaining datasets")
        void testSchemaErrorContinues() {
            when(brokenSource.name()).thenReturn("broken.csv");
            when(brokenSource.kind()).thenReturn(DatasetKind.NICHE);
            when(brokenSource.load()).thenThrow(new SchemaException("broken.csv", List.of("FIPS"), List.of("Address")));

            SecondaryDatasetSource liens = new SecondaryDatasetSource() {
                @Override
                public String name() {
                    return "liens.csv";
                }

                @Override
                public DatasetKind kind() {
                    return DatasetKind.NICHE;
                }

                @Override
                public SecondaryDataset load() {
                    return nicheDataset("Liens", niche("Liens", "123 Main St"));
                }
            };

            List<LinkageSummary> summaries = orchestrator.linkAll(registry, List.of(brokenSource, liens));

            assertEquals(2, summaries.size());
            assertTrue(summaries.get(0).failed());
            assertTrue(summaries.get(0).error().contains("FIPS"));
            assertFalse(summaries.get(1).failed());
            assertEquals(List.of("Liens"), mainSt.getAccumulatedTags());
        }

        @Test
        @DisplayName("Should record match, insert and skip metrics")
        void testMetrics() {
            LinkageOrchestrator instrumented = new LinkageOrchestrator(LinkageOptions.defaults(), metricsService);

            instrumented.link(registry, nicheDataset("Liens",
                    niche("Liens", "123 Main St"),
                    niche("Liens", "999 New Ave"),
                    niche("Liens", "1 Far Rd", null, null, "51775")));

            verify(metricsService).recordMatch("liens.csv", MatchStrategy.ADDRESS_ONLY);
            verify(metricsService).incrementInserted("liens.csv");
            verify(metricsService).recordSkipped("liens.csv", LinkageOrchestrator.SKIP_JURISDICTION, 1L);
            verify(metricsService).recordPassDuration(eq("liens.csv"), eq(DatasetKind.NICHE), any(Duration.class));
            verify(metricsService).recordRegistrySize(anyInt());
        }

        @Test
        @DisplayName("Should reuse the index until the registry changes")
        void testIndexCaching() {
            assertSame(orchestrator.indexFor(registry), orchestrator.indexFor(registry));

            CanonicalIndex before = orchestrator.indexFor(registry);
            registry.add(canonical("2 B ST", null, null, PriorityLevel.DEFAULT));

            assertNotSame(before, orchestrator.indexFor(registry));
        }
    }
}
