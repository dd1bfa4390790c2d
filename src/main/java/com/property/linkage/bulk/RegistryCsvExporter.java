package com.property.linkage.bulk;

import com.property.linkage.api.PropertyRegistry;
import com.property.linkage.core.model.BaseClassification;
import com.property.linkage.core.model.CanonicalPropertyRecord;
import com.property.linkage.core.model.DatasetKind;
import com.property.linkage.core.model.EnrichmentTag;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the linked registry as CSV: the input columns unchanged, then classification,
 * priority, one boolean column per enrichment source, the golden contact and the ST flags.
 */
public class RegistryCsvExporter {
    private static final Logger log = LoggerFactory.getLogger(RegistryCsvExporter.class);

    static final List<String> CLASSIFICATION_COLUMNS = List.of(
            "IsTrust", "IsChurch", "IsBusiness", "IsOwnerOccupied", "OwnerGrantorMatch",
            "PropertyCategory", "PriorityId", "BasePriorityCode", "PriorityCode", "PriorityName");

    static final List<String> GOLDEN_COLUMNS = List.of(
            "Golden_Address", "Golden_City", "Golden_State", "Golden_Zip", "Golden_Address_Differs", "ST_Flags");

    static final String ST_FLAG_SEPARATOR = ",";

    public ExportResult exportFile(PropertyRegistry registry, Path file) {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            ExportResult result = export(registry, writer);
            log.info("export.written file={} {}", file, result);
            return result;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write registry to " + file, e);
        }
    }

    public ExportResult export(PropertyRegistry registry, Writer writer) throws IOException {
        List<String> inputColumns = registry.getColumns();
        Map<String, String> flagColumns = flagColumns(registry);

        List<String> header = new ArrayList<>(inputColumns);
        header.addAll(CLASSIFICATION_COLUMNS);
        header.addAll(flagColumns.values());
        header.addAll(GOLDEN_COLUMNS);

        CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder()
                .setHeader(header.toArray(new String[0]))
                .build());

        long written = 0;
        for (CanonicalPropertyRecord record : registry.records()) {
            List<Object> row = new ArrayList<>(header.size());
            for (String column : inputColumns) {
                row.add(record.getSourceColumns().getOrDefault(column, ""));
            }

            BaseClassification classification = record.getBaseClassification();
            row.add(classification.isTrust());
            row.add(classification.isChurch());
            row.add(classification.isBusiness());
            row.add(classification.isOwnerOccupied());
            row.add(classification.ownerGrantorMatch());
            row.add(record.getPropertyCategory().name());
            row.add(record.getBasePriority().id());
            row.add(record.getBasePriority().code());
            row.add(record.getCompositePriorityCode());
            row.add(record.getCompositePriorityName());

            for (String tag : flagColumns.keySet()) {
                row.add(record.carriesTag(tag));
            }

            row.add(nullToEmpty(record.getGoldenAddress()));
            row.add(nullToEmpty(record.getGoldenCity()));
            row.add(nullToEmpty(record.getGoldenState()));
            row.add(nullToEmpty(record.getGoldenZip()));
            row.add(record.isGoldenAddressDiffers());
            row.add(String.join(ST_FLAG_SEPARATOR, skipTraceTags(record)));

            printer.printRecord(row);
            written++;
        }
        printer.flush();
        return new ExportResult(written, header.size());
    }

    /**
     * Tag code to flag column: every known tag, then unknown tags in first-seen order.
     */
    static Map<String, String> flagColumns(PropertyRegistry registry) {
        Map<String, String> columns = new LinkedHashMap<>();
        for (EnrichmentTag tag : EnrichmentTag.values()) {
            columns.put(tag.getCode(), tag.getFlagColumn());
        }
        for (CanonicalPropertyRecord record : registry.records()) {
            for (String tag : record.getAccumulatedTags()) {
                columns.computeIfAbsent(tag, EnrichmentTag::flagColumnFor);
            }
            if (record.isNicheOnly()) {
                columns.computeIfAbsent(record.getBasePriority().code(), EnrichmentTag::flagColumnFor);
            }
        }
        return columns;
    }

    private static List<String> skipTraceTags(CanonicalPropertyRecord record) {
        List<String> tags = new ArrayList<>();
        for (String tag : record.getAccumulatedTags()) {
            EnrichmentTag.fromCode(tag)
                    .filter(known -> known.getSource() == DatasetKind.SKIP_TRACE)
                    .ifPresent(known -> tags.add(tag));
        }
        return tags;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
