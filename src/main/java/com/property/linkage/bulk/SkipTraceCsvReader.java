package com.property.linkage.bulk;

import com.property.linkage.api.SecondaryDataset;
import com.property.linkage.api.SecondaryDatasetSource;
import com.property.linkage.classify.PriorityScorer;
import com.property.linkage.core.model.DatasetKind;
import com.property.linkage.core.model.EnrichmentTag;
import com.property.linkage.core.model.GoldenContact;
import com.property.linkage.core.model.SecondaryRecord;
import com.property.linkage.logging.LogContext;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a skip-trace provider export: property identity, a verified "golden" mailing contact
 * and distress indicators. Each indicator becomes an ST tag on the row.
 *
 * <p>Distress columns hold the date of the event; a cell that parses as a date raises the flag.
 * {@value #OWNER_DECEASED} holds a boolean, frequently exported by spreadsheets as {@code 1.0}.</p>
 */
public class SkipTraceCsvReader implements SecondaryDatasetSource {
    private static final Logger log = LoggerFactory.getLogger(SkipTraceCsvReader.class);

    public static final String SOURCE_TYPE = "SkipTrace";

    public static final String PROPERTY_ADDRESS = "Property Address";
    public static final String PROPERTY_CITY = "Property City";
    public static final String PROPERTY_FIPS = "Property FIPS";
    public static final String PROPERTY_APN = "Property APN";
    public static final String GOLDEN_ADDRESS = "Golden Address";
    public static final String GOLDEN_CITY = "Golden City";
    public static final String GOLDEN_STATE = "Golden State";
    public static final String GOLDEN_ZIP = "Golden Zip";
    public static final String OWNER_DECEASED = "Owner Is Deceased";

    private static final List<String> REQUIRED = List.of(PROPERTY_ADDRESS, PROPERTY_FIPS, GOLDEN_ADDRESS);

    private static final Map<String, EnrichmentTag> DATE_FLAG_COLUMNS = dateFlagColumns();

    private static final Set<String> TRUTHY = Set.of("true", "yes", "1", "y");

    private final Path file;

    public SkipTraceCsvReader(Path file) {
        this.file = Objects.requireNonNull(file, "file is required");
    }

    @Override
    public String name() {
        return file.getFileName().toString();
    }

    @Override
    public DatasetKind kind() {
        return DatasetKind.SKIP_TRACE;
    }

    @Override
    public SecondaryDataset load() {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, name());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read skip-trace file " + file, e);
        }
    }

    /**
     * @throws SchemaException if a required column is missing
     */
    public static SecondaryDataset read(Reader reader, String datasetName) {
        try (LogContext ctx = LogContext.forImport(datasetName);
             CSVParser parser = CsvHeaders.INPUT_FORMAT.parse(reader)) {

            CsvHeaders headers = new CsvHeaders(parser.getHeaderNames());
            List<String> missing = headers.missing(REQUIRED);
            if (!missing.isEmpty()) {
                throw new SchemaException(datasetName, missing, headers.names());
            }

            Integer address = headers.find(PROPERTY_ADDRESS);
            Integer city = headers.find(PROPERTY_CITY);
            Integer fips = headers.find(PROPERTY_FIPS);
            Integer apn = headers.find(PROPERTY_APN);
            Integer goldenAddress = headers.find(GOLDEN_ADDRESS);
            Integer goldenCity = headers.find(GOLDEN_CITY);
            Integer goldenState = headers.find(GOLDEN_STATE);
            Integer goldenZip = headers.find(GOLDEN_ZIP);
            Integer deceased = headers.find(OWNER_DECEASED);
            Map<EnrichmentTag, Integer> dateFlags = new LinkedHashMap<>();
            DATE_FLAG_COLUMNS.forEach((column, tag) -> {
                Integer position = headers.find(column);
                if (position != null) {
                    dateFlags.put(tag, position);
                }
            });

            List<SecondaryRecord> records = new ArrayList<>();
            long flagged = 0;
            for (CSVRecord row : parser) {
                if (CsvHeaders.isBlankRow(row)) {
                    continue;
                }
                List<String> tags = detectFlags(row, deceased, dateFlags);
                if (!tags.isEmpty()) {
                    flagged++;
                }
                GoldenContact golden = new GoldenContact(
                        CsvHeaders.value(row, goldenAddress),
                        CsvHeaders.value(row, goldenCity),
                        CsvHeaders.value(row, goldenState),
                        CsvHeaders.value(row, goldenZip));

                records.add(SecondaryRecord.builder()
                        .kind(DatasetKind.SKIP_TRACE)
                        .sourceType(SOURCE_TYPE)
                        .enrichmentTags(tags)
                        .address(CsvHeaders.value(row, address))
                        .city(CsvHeaders.value(row, city))
                        .jurisdictionCode(CsvHeaders.value(row, fips))
                        .structuredId(CsvHeaders.value(row, apn))
                        .goldenContact(golden.isEmpty() ? null : golden)
                        .lineNumber(row.getRecordNumber() + 1)
                        .sourceColumns(headers.row(row))
                        .build());
            }

            log.info("skipTrace.loaded dataset={} records={} flagged={}", datasetName, records.size(), flagged);
            return new SecondaryDataset(datasetName, DatasetKind.SKIP_TRACE, SOURCE_TYPE, records);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse skip-trace file " + datasetName, e);
        }
    }

    static List<String> detectFlags(CSVRecord row, Integer deceased, Map<EnrichmentTag, Integer> dateFlags) {
        List<String> tags = new ArrayList<>();
        for (Map.Entry<EnrichmentTag, Integer> entry : dateFlags.entrySet()) {
            if (PriorityScorer.tryParseDate(CsvHeaders.value(row, entry.getValue())) != null) {
                tags.add(entry.getKey().getCode());
            }
        }
        if (isDeceased(CsvHeaders.value(row, deceased))) {
            tags.add(EnrichmentTag.ST_DECEASED.getCode());
        }
        return tags;
    }

    static boolean isDeceased(String value) {
        if (value == null) {
            return false;
        }
        try {
            return Double.parseDouble(value) == 1.0;
        } catch (NumberFormatException e) {
            return TRUTHY.contains(value.toLowerCase(Locale.ROOT));
        }
    }

    private static Map<String, EnrichmentTag> dateFlagColumns() {
        Map<String, EnrichmentTag> columns = new LinkedHashMap<>();
        columns.put("Owner Bankruptcy", EnrichmentTag.ST_BANKRUPTCY);
        columns.put("Owner Foreclosure", EnrichmentTag.ST_FORECLOSURE);
        columns.put("Lien", EnrichmentTag.ST_LIEN);
        columns.put("Judgment", EnrichmentTag.ST_JUDGMENT);
        columns.put("Quitclaim", EnrichmentTag.ST_QUITCLAIM);
        return columns;
    }
}
