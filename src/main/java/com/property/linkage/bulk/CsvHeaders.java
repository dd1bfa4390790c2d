package com.property.linkage.bulk;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Case- and whitespace-insensitive header lookup for spreadsheet exports.
 * Values are read by column position, so duplicate or BOM-prefixed headers are harmless.
 */
final class CsvHeaders {

    static final CSVFormat INPUT_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    private final List<String> names;
    private final Map<String, Integer> positions = new HashMap<>();

    CsvHeaders(List<String> rawNames) {
        List<String> cleaned = new ArrayList<>(rawNames.size());
        for (int i = 0; i < rawNames.size(); i++) {
            String name = clean(rawNames.get(i));
            cleaned.add(name);
            positions.putIfAbsent(key(name), i);
        }
        this.names = List.copyOf(cleaned);
    }

    List<String> names() {
        return names;
    }

    /**
     * Position of the first header matching any candidate, or null.
     */
    Integer find(String... candidates) {
        for (String candidate : candidates) {
            Integer position = positions.get(key(candidate));
            if (position != null) {
                return position;
            }
        }
        return null;
    }

    boolean has(String name) {
        return find(name) != null;
    }

    List<String> missing(List<String> required) {
        List<String> missing = new ArrayList<>();
        for (String name : required) {
            if (!has(name)) {
                missing.add(name);
            }
        }
        return missing;
    }

    /**
     * Trimmed cell value, or null when the column is absent or the cell is blank.
     */
    static String value(CSVRecord record, Integer position) {
        if (position == null || position >= record.size()) {
            return null;
        }
        String value = record.get(position).replace('\u00A0', ' ').trim();
        return value.isEmpty() ? null : value;
    }

    /**
     * Every column of the row keyed by cleaned header name, in header order.
     */
    Map<String, String> row(CSVRecord record) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            String value = i < record.size() ? record.get(i).trim() : "";
            row.putIfAbsent(names.get(i), value);
        }
        return row;
    }

    static boolean isBlankRow(CSVRecord record) {
        for (String value : record) {
            if (value != null && !value.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private static String clean(String header) {
        if (header == null) {
            return "";
        }
        return header.replace("\uFEFF", "").replace('\u00A0', ' ').trim().replaceAll("\\s+", " ");
    }

    private static String key(String header) {
        return clean(header).toLowerCase(Locale.ROOT);
    }
}
