package com.property.linkage.bulk;

import com.property.linkage.api.SecondaryDataset;
import com.property.linkage.api.SecondaryDatasetSource;
import com.property.linkage.core.model.DatasetKind;
import com.property.linkage.core.model.SecondaryRecord;
import com.property.linkage.logging.LogContext;
import com.property.linkage.merge.PriorityCodeComposer;
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
 * Reads a niche list export. Every row contributes the list's source type as its tag.
 * Requires {@value #ADDRESS} and {@value #FIPS}; other registry-style columns are optional.
 */
public class NicheListCsvReader implements SecondaryDatasetSource {
    private static final Logger log = LoggerFactory.getLogger(NicheListCsvReader.class);

    public static final String ADDRESS = "Address";
    public static final String FIPS = "FIPS";

    private static final List<String> REQUIRED = List.of(ADDRESS, FIPS);

    private final Path file;
    private final String sourceType;

    /**
     * Reader whose source type is detected from the file name.
     */
    public NicheListCsvReader(Path file) {
        this(file, new NicheTypeDetector().detect(file.getFileName().toString()));
    }

    /**
     * @throws IllegalArgumentException if {@code sourceType} is blank or contains {@code -}
     */
    public NicheListCsvReader(Path file, String sourceType) {
        this.file = Objects.requireNonNull(file, "file is required");
        PriorityCodeComposer.validateTag(sourceType);
        this.sourceType = sourceType;
    }

    @Override
    public String name() {
        return file.getFileName().toString();
    }

    @Override
    public DatasetKind kind() {
        return DatasetKind.NICHE;
    }

    public String getSourceType() {
        return sourceType;
    }

    @Override
    public SecondaryDataset load() {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, name(), sourceType);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read niche list " + file, e);
        }
    }

    /**
     * @throws SchemaException if a required column is missing
     */
    public static SecondaryDataset read(Reader reader, String datasetName, String sourceType) {
        PriorityCodeComposer.validateTag(sourceType);
        try (LogContext ctx = LogContext.forImport(datasetName);
             CSVParser parser = CsvHeaders.INPUT_FORMAT.parse(reader)) {

            CsvHeaders headers = new CsvHeaders(parser.getHeaderNames());
            List<String> missing = headers.missing(REQUIRED);
            if (!missing.isEmpty()) {
                throw new SchemaException(datasetName, missing, headers.names());
            }

            Integer address = headers.find(ADDRESS);
            Integer fips = headers.find(FIPS);
            Integer city = headers.find(RegistryCsvImporter.CITY);
            Integer state = headers.find(RegistryCsvImporter.STATE);
            Integer zip = headers.find(RegistryCsvImporter.ZIP);
            Integer apn = headers.find(RegistryCsvImporter.APN);
            Integer ownerLast = headers.find(RegistryCsvImporter.OWNER_LAST_NAME);
            Integer ownerFirst = headers.find(RegistryCsvImporter.OWNER_FIRST_NAME);
            Integer mailing = headers.find(RegistryCsvImporter.MAILING_ADDRESS);
            Integer saleDate = headers.find(RegistryCsvImporter.LAST_SALE_DATE);
            Integer saleAmount = headers.find(RegistryCsvImporter.LAST_SALE_AMOUNT);

            List<SecondaryRecord> records = new ArrayList<>();
            for (CSVRecord row : parser) {
                if (CsvHeaders.isBlankRow(row)) {
                    continue;
                }
                String last = CsvHeaders.value(row, ownerLast);
                String first = CsvHeaders.value(row, ownerFirst);
                String owner = ((last != null ? last : "") + " " + (first != null ? first : "")).trim();
                records.add(SecondaryRecord.builder()
                        .kind(DatasetKind.NICHE)
                        .sourceType(sourceType)
                        .address(CsvHeaders.value(row, address))
                        .city(CsvHeaders.value(row, city))
                        .state(CsvHeaders.value(row, state))
                        .zip(CsvHeaders.value(row, zip))
                        .jurisdictionCode(CsvHeaders.value(row, fips))
                        .structuredId(CsvHeaders.value(row, apn))
                        .ownerName(owner.isEmpty() ? null : owner)
                        .mailingAddress(CsvHeaders.value(row, mailing))
                        .lastSaleDate(CsvHeaders.value(row, saleDate))
                        .lastSaleAmount(CsvHeaders.value(row, saleAmount))
                        .lineNumber(row.getRecordNumber() + 1)
                        .sourceColumns(headers.row(row))
                        .build());
            }

            log.info("niche.loaded dataset={} sourceType={} records={}", datasetName, sourceType, records.size());
            return new SecondaryDataset(datasetName, DatasetKind.NICHE, sourceType, records);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse niche list " + datasetName, e);
        }
    }
}
