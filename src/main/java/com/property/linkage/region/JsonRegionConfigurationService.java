package com.property.linkage.region;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.property.linkage.index.JurisdictionFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Loads region configuration from {@code <regionsDir>/<regionKey>/config.json} files.
 *
 * <p>Expected document:</p>
 * <pre>
 * {
 *   "region_name": "Roanoke City",
 *   "region_code": "ROA",
 *   "fips_code": "51770",
 *   "region_input_date1": "2009-01-01",
 *   "region_input_date2": "2019-01-01",
 *   "region_input_amount1": 75000,
 *   "region_input_amount2": 200000
 * }
 * </pre>
 * Every region is validated when the service is created; the first invalid file fails fast.
 */
public class JsonRegionConfigurationService implements RegionConfigurationService {
    private static final Logger log = LoggerFactory.getLogger(JsonRegionConfigurationService.class);

    public static final String CONFIG_FILE_NAME = "config.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path regionsDir;
    private final Map<String, RegionConfig> regions;

    public JsonRegionConfigurationService(Path regionsDir) {
        this.regionsDir = regionsDir;
        this.regions = loadAll(regionsDir);
        log.info("regions.loaded dir={} count={}", regionsDir, regions.size());
    }

    @Override
    public RegionConfig getRegion(String regionKey) {
        if (regionKey == null || regionKey.isBlank()) {
            throw new ConfigurationException("regionKey must not be null or blank");
        }
        RegionConfig config = regions.get(regionKey);
        if (config == null) {
            throw new ConfigurationException("Unknown region '" + regionKey + "' in " + regionsDir
                    + "; available: " + regions.keySet());
        }
        return config;
    }

    @Override
    public List<RegionConfig> listRegions() {
        List<RegionConfig> list = new ArrayList<>(regions.values());
        list.sort(Comparator.comparing(RegionConfig::displayName));
        return List.copyOf(list);
    }

    public Path regionDirectory(String regionKey) {
        getRegion(regionKey);
        return regionsDir.resolve(regionKey);
    }

    private static Map<String, RegionConfig> loadAll(Path regionsDir) {
        if (!Files.isDirectory(regionsDir)) {
            throw new ConfigurationException("Regions directory not found: " + regionsDir);
        }
        Map<String, RegionConfig> loaded = new TreeMap<>();
        try (Stream<Path> children = Files.list(regionsDir)) {
            for (Path dir : children.filter(Files::isDirectory).sorted().toList()) {
                Path file = dir.resolve(CONFIG_FILE_NAME);
                if (Files.isRegularFile(file)) {
                    String key = dir.getFileName().toString();
                    loaded.put(key, load(key, file));
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException("Cannot list regions directory " + regionsDir, e);
        }
        return loaded;
    }

    /**
     * Reads and validates one configuration file.
     */
    public static RegionConfig load(String regionKey, Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(regionKey, in, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read region configuration " + file, e);
        }
    }

    /**
     * Parses and validates one configuration document.
     */
    public static RegionConfig parse(String regionKey, InputStream in, String sourceName) {
        RegionDocument doc;
        try {
            doc = MAPPER.readValue(in, RegionDocument.class);
        } catch (IOException e) {
            throw new ConfigurationException("Malformed region configuration " + sourceName + ": "
                    + e.getMessage(), e);
        }
        if (doc == null) {
            throw new ConfigurationException("Empty region configuration " + sourceName);
        }

        String jurisdiction = JurisdictionFilter.normalizeCode(doc.fipsCode());
        if (jurisdiction.isEmpty()) {
            throw new ConfigurationException("Region '" + regionKey + "' has no fips_code (" + sourceName + ")");
        }
        LocalDate date1 = requireDate(regionKey, "region_input_date1", doc.date1(), sourceName);
        LocalDate date2 = requireDate(regionKey, "region_input_date2", doc.date2(), sourceName);
        double amount1 = requireAmount(regionKey, "region_input_amount1", doc.amount1(), sourceName);
        double amount2 = requireAmount(regionKey, "region_input_amount2", doc.amount2(), sourceName);

        if (!date1.isBefore(date2)) {
            log.warn("region.thresholds.dateOrder region={} date1={} date2={}", regionKey, date1, date2);
        }
        if (amount1 >= amount2) {
            log.warn("region.thresholds.amountOrder region={} amount1={} amount2={}", regionKey, amount1, amount2);
        }

        return new RegionConfig(regionKey, doc.regionName(), doc.regionCode(), jurisdiction,
                date1, date2, amount1, amount2, doc.marketType(), doc.description(), doc.notes());
    }

    private static LocalDate requireDate(String regionKey, String field, String value, String sourceName) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Region '" + regionKey + "' is missing " + field + " (" + sourceName + ")");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Region '" + regionKey + "' has invalid " + field
                    + " '" + value + "', expected yyyy-MM-dd (" + sourceName + ")", e);
        }
    }

    private static double requireAmount(String regionKey, String field, Double value, String sourceName) {
        if (value == null || value.isNaN()) {
            throw new ConfigurationException("Region '" + regionKey + "' is missing " + field + " (" + sourceName + ")");
        }
        if (value < 0) {
            throw new ConfigurationException("Region '" + regionKey + "' has negative " + field + " (" + sourceName + ")");
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record RegionDocument(
            @JsonProperty("region_name") String regionName,
            @JsonProperty("region_code") String regionCode,
            @JsonProperty("fips_code") String fipsCode,
            @JsonProperty("region_input_date1") String date1,
            @JsonProperty("region_input_date2") String date2,
            @JsonProperty("region_input_amount1") Double amount1,
            @JsonProperty("region_input_amount2") Double amount2,
            @JsonProperty("market_type") String marketType,
            @JsonProperty("description") String description,
            @JsonProperty("notes") String notes
    ) {}
}
