package com.property.linkage.bulk;

import com.property.linkage.classify.PriorityScorer;
import com.property.linkage.classify.PropertyClassifier;
import com.property.linkage.classify.PropertyFacts;
import com.property.linkage.classify.RawLandDetector;
import com.property.linkage.core.model.BaseClassification;
import com.property.linkage.core.model.BasePriority;
import com.property.linkage.core.model.CanonicalPropertyRecord;
import com.property.linkage.core.model.PropertyCategory;
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
import java.util.List;
import java.util.Objects;

/**
 * Reads a registry export (or a recent-sales export with the same layout) into canonical
 * records. Each row is classified, categorized and scored on the way in.
 *
 * <p>Only {@value #ADDRESS} is required. Rows whose cells are all blank are skipped; a row
 * that fails to convert is reported in the {@link ImportResult} and does not stop the import.</p>
 */
public class RegistryCsvImporter {
    private static final Logger log = LoggerFactory.getLogger(RegistryCsvImporter.class);

    public static final String ADDRESS = "Address";
    public static final String CITY = "City";
    public static final String STATE = "State";
    public static final String ZIP = "Zip";
    public static final String APN = "APN";
    public static final String FIPS = "FIPS";
    public static final String OWNER_LAST_NAME = "Owner 1 Last Name";
    public static final String OWNER_FIRST_NAME = "Owner 1 First Name";
    public static final String MAILING_ADDRESS = "Mailing Address";
    public static final String LAST_SALE_DATE = "Last Sale Date";
    public static final String LAST_SALE_AMOUNT = "Last Sale Amount";
    public static final String OWNER_OCCUPIED = "Owner Occupied";
    public static final String GRANTOR = "Grantor";
    public static final String LAST_CASH_BUYER = "Last Cash Buyer";

    private static final List<String> RECOMMENDED = List.of(
            CITY, APN, FIPS, OWNER_LAST_NAME, MAILING_ADDRESS, LAST_SALE_DATE, LAST_SALE_AMOUNT);

    private static final int PROGRESS_INTERVAL = 10_000;

    private final PropertyClassifier classifier;
    private final PriorityScorer scorer;
    private final RawLandDetector rawLandDetector;

    public RegistryCsvImporter(PriorityScorer scorer) {
        this(new PropertyClassifier(), scorer, new RawLandDetector());
    }

    public RegistryCsvImporter(PropertyClassifier classifier, PriorityScorer scorer, RawLandDetector rawLandDetector) {
        this.classifier = Objects.requireNonNull(classifier, "classifier is required");
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.rawLandDetector = Objects.requireNonNull(rawLandDetector, "rawLandDetector is required");
    }

    public RegistryImport importFile(Path file, String defaultJurisdiction, ProgressCallback callback) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return importRecords(reader, file.getFileName().toString(), defaultJurisdiction, callback);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read registry file " + file, e);
        }
    }

    /**
     * Imports every row of {@code reader}.
     *
     * @param defaultJurisdiction jurisdiction assigned to rows with no FIPS value
     * @throws SchemaException if the header has no address column
     */
    public RegistryImport importRecords(Reader reader, String inputName, String defaultJurisdiction,
                                        ProgressCallback callback) {
        ProgressCallback progress = callback != null ? callback : ProgressCallback.NOOP;
        try (LogContext ctx = LogContext.forImport(inputName);
             CSVParser parser = CsvHeaders.INPUT_FORMAT.parse(reader)) {

            CsvHeaders headers = new CsvHeaders(parser.getHeaderNames());
            List<String> missing = headers.missing(List.of(ADDRESS));
            if (!missing.isEmpty()) {
                throw new SchemaException(inputName, missing, headers.names());
            }
            List<String> absent = headers.missing(RECOMMENDED);
            if (!absent.isEmpty()) {
                log.warn("import.missingColumns input={} columns={}", inputName, absent);
            }

            Columns columns = new Columns(headers);
            List<CanonicalPropertyRecord> records = new ArrayList<>();
            List<ImportResult.ImportError> errors = new ArrayList<>();
            long total = 0;
            long skipped = 0;

            for (CSVRecord row : parser) {
                total++;
                long lineNumber = row.getRecordNumber() + 1;
                if (CsvHeaders.isBlankRow(row)) {
                    skipped++;
                    continue;
                }
                try {
                    records.add(toRecord(row, headers, columns, defaultJurisdiction));
                } catch (RuntimeException e) {
                    String address = CsvHeaders.value(row, columns.address);
                    log.warn("import.rowFailed input={} line={} error={}", inputName, lineNumber, e.getMessage());
                    errors.add(new ImportResult.ImportError(lineNumber, address, e.getMessage()));
                }
                if (total % PROGRESS_INTERVAL == 0) {
                    progress.onProgress(total, -1, "Imported " + records.size() + " records");
                }
            }
            progress.onProgress(total, total, "Import complete");

            ImportResult result = new ImportResult(total, records.size(), skipped, errors);
            log.info("import.completed input={} {}", inputName, result);
            return new RegistryImport(inputName, headers.names(), records, result);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse registry input " + inputName, e);
        }
    }

    private CanonicalPropertyRecord toRecord(CSVRecord row, CsvHeaders headers, Columns c, String defaultJurisdiction) {
        String address = CsvHeaders.value(row, c.address);
        String ownerName = joinName(CsvHeaders.value(row, c.ownerLast), CsvHeaders.value(row, c.ownerFirst));
        String fips = CsvHeaders.value(row, c.fips);

        PropertyFacts facts = new PropertyFacts(
                ownerName,
                CsvHeaders.value(row, c.grantor),
                address,
                CsvHeaders.value(row, c.mailing),
                CsvHeaders.value(row, c.ownerOccupied),
                CsvHeaders.value(row, c.saleDate),
                CsvHeaders.value(row, c.saleAmount),
                CsvHeaders.value(row, c.cashBuyer));

        BaseClassification classification = classifier.classify(facts);
        PropertyCategory category = rawLandDetector.categorize(address);
        BasePriority priority = scorer.score(facts, classification, category);

        return CanonicalPropertyRecord.builder()
                .address(address)
                .city(CsvHeaders.value(row, c.city))
                .state(CsvHeaders.value(row, c.state))
                .zip(CsvHeaders.value(row, c.zip))
                .jurisdictionCode(fips != null ? fips : defaultJurisdiction)
                .structuredId(CsvHeaders.value(row, c.apn))
                .ownerName(ownerName)
                .mailingAddress(facts.mailingAddress())
                .lastSaleDate(facts.lastSaleDate())
                .lastSaleAmount(facts.lastSaleAmount())
                .propertyCategory(category)
                .baseClassification(classification)
                .basePriority(priority)
                .sourceColumns(headers.row(row))
                .build();
    }

    private static String joinName(String last, String first) {
        String joined = ((last != null ? last : "") + " " + (first != null ? first : "")).trim();
        return joined.isEmpty() ? null : joined;
    }

    private static final class Columns {
        final Integer address;
        final Integer city;
        final Integer state;
        final Integer zip;
        final Integer apn;
        final Integer fips;
        final Integer ownerLast;
        final Integer ownerFirst;
        final Integer mailing;
        final Integer saleDate;
        final Integer saleAmount;
        final Integer ownerOccupied;
        final Integer grantor;
        final Integer cashBuyer;

        Columns(CsvHeaders headers) {
            address = headers.find(ADDRESS);
            city = headers.find(CITY);
            state = headers.find(STATE);
            zip = headers.find(ZIP);
            apn = headers.find(APN);
            fips = headers.find(FIPS);
            ownerLast = headers.find(OWNER_LAST_NAME);
            ownerFirst = headers.find(OWNER_FIRST_NAME);
            mailing = headers.find(MAILING_ADDRESS);
            saleDate = headers.find(LAST_SALE_DATE);
            saleAmount = headers.find(LAST_SALE_AMOUNT);
            ownerOccupied = headers.find(OWNER_OCCUPIED);
            grantor = headers.find(GRANTOR);
            cashBuyer = headers.find(LAST_CASH_BUYER);
        }
    }
}
