package com.property.linkage.region;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonRegionConfigurationServiceTest {

    private static RegionConfig parse(String json) {
        return JsonRegionConfigurationService.parse("test_region",
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "inline");
    }

    private static String config(String fips, String date1, String amount1) {
        return "{\"region_name\":\"Test\",\"fips_code\":" + fips
                + ",\"region_input_date1\":" + date1
                + ",\"region_input_date2\":\"2019-01-01\""
                + ",\"region_input_amount1\":" + amount1
                + ",\"region_input_amount2\":200000}";
    }

    @Nested
    @DisplayName("Fixture regions")
    class FixtureTests {

        private JsonRegionConfigurationService service;

        @BeforeEach
        void setUp() throws URISyntaxException {
            service = new JsonRegionConfigurationService(
                    Path.of(JsonRegionConfigurationServiceTest.class.getResource("/regions").toURI()));
        }

        @Test
        @DisplayName("Should load region from its directory")
        void testLoadsFixture() {
            RegionConfig region = service.getRegion("roanoke_city");

            assertEquals("roanoke_city", region.key());
            assertEquals("Roanoke City", region.displayName());
            assertEquals("ROA", region.code());
            assertEquals("51770", region.jurisdictionCode());
            assertEquals(LocalDate.of(2009, 1, 1), region.dateCutoff1());
            assertEquals(LocalDate.of(2019, 1, 1), region.dateCutoff2());
            assertEquals(75_000.0, region.amountCutoff1());
            assertEquals(200_000.0, region.amountCutoff2());
            assertEquals("Urban", region.marketType());
            assertTrue(region.thresholds().isOrdered());
        }

        @Test
        @DisplayName("Should list regions")
        void testListRegions() {
            List<RegionConfig> regions = service.listRegions();
            assertEquals(1, regions.size());
            assertEquals("roanoke_city", regions.get(0).key());
        }

        @Test
        @DisplayName("Should reject unknown and blank region keys")
        void testUnknownRegion() {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> service.getRegion("atlantis"));
            assertTrue(e.getMessage().contains("atlantis"));
            assertThrows(ConfigurationException.class, () -> service.getRegion(" "));
            assertThrows(ConfigurationException.class, () -> service.getRegion(null));
        }

        @Test
        @DisplayName("Should resolve region directory")
        void testRegionDirectory() {
            assertTrue(service.regionDirectory("roanoke_city").endsWith("roanoke_city"));
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Should accept numeric FIPS codes and normalize them")
        void testNumericFips() {
            assertEquals("1001", parse(config("\"01001\"", "\"2009-01-01\"", "75000")).jurisdictionCode());
            assertEquals("51770", parse(config("51770", "\"2009-01-01\"", "75000")).jurisdictionCode());
        }

        @Test
        @DisplayName("Should reject a missing FIPS code")
        void testMissingFips() {
            assertThrows(ConfigurationException.class, () -> parse(config("null", "\"2009-01-01\"", "75000")));
            assertThrows(ConfigurationException.class, () -> parse(config("\" \"", "\"2009-01-01\"", "75000")));
        }

        @Test
        @DisplayName("Should reject malformed dates")
        void testBadDate() {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> parse(config("51770", "\"01/01/2009\"", "75000")));
            assertTrue(e.getMessage().contains("region_input_date1"));
        }

        @Test
        @DisplayName("Should reject missing and negative amounts")
        void testBadAmount() {
            assertThrows(ConfigurationException.class, () -> parse(config("51770", "\"2009-01-01\"", "null")));
            assertThrows(ConfigurationException.class, () -> parse(config("51770", "\"2009-01-01\"", "-1")));
        }

        @Test
        @DisplayName("Should load misordered thresholds with a warning")
        void testMisorderedThresholds() {
            RegionConfig region = parse(config("51770", "\"2020-01-01\"", "300000"));
            assertFalse(region.thresholds().isOrdered());
        }

        @Test
        @DisplayName("Should reject malformed JSON")
        void testMalformedJson() {
            assertThrows(ConfigurationException.class, () -> parse("{not json"));
        }

        @Test
        @DisplayName("Should ignore unknown fields")
        void testUnknownFields() {
            String json = config("51770", "\"2009-01-01\"", "75000").replace("}", ",\"extra\":true}");
            assertEquals("51770", parse(json).jurisdictionCode());
        }
    }

    @Nested
    @DisplayName("Directory loading")
    class DirectoryTests {

        @TempDir
        Path regionsDir;

        @Test
        @DisplayName("Should fail when the regions directory is missing")
        void testMissingDirectory() {
            assertThrows(ConfigurationException.class,
                    () -> new JsonRegionConfigurationService(regionsDir.resolve("absent")));
        }

        @Test
        @DisplayName("Should fail on an invalid region file")
        void testInvalidRegionFile() throws IOException {
            Path dir = Files.createDirectories(regionsDir.resolve("broken"));
            Files.writeString(dir.resolve(JsonRegionConfigurationService.CONFIG_FILE_NAME), "{}");

            assertThrows(ConfigurationException.class, () -> new JsonRegionConfigurationService(regionsDir));
        }

        @Test
        @DisplayName("Should skip directories without a configuration file")
        void testSkipsDirectoriesWithoutConfig() throws IOException {
            Files.createDirectories(regionsDir.resolve("empty"));
            Path dir = Files.createDirectories(regionsDir.resolve("salem"));
            Files.writeString(dir.resolve(JsonRegionConfigurationService.CONFIG_FILE_NAME),
                    config("51775", "\"2009-01-01\"", "75000"));

            JsonRegionConfigurationService service = new JsonRegionConfigurationService(regionsDir);

            assertEquals(1, service.listRegions().size());
            assertEquals("51775", service.getRegion("salem").jurisdictionCode());
        }
    }
}
