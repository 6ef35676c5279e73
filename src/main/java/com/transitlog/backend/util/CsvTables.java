package com.transitlog.backend.util;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.transitlog.backend.exception.TableParseException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes comma-delimited tables with a header row, as used by static
 * GTFS files and the object store.
 */
public class CsvTables {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .build();

    private CsvTables() {
    }

    /**
     * Parse a table whose first row is the header.
     *
     * @return one record per data row, keyed by header name in column order
     * @throws TableParseException listing every malformed row
     */
    public static List<Map<String, String>> parse(String text) {
        List<String[]> rows = readRows(text);
        List<Map<String, String>> records = new ArrayList<>();
        if (rows.isEmpty()) {
            return records;
        }

        String[] header = rows.get(0);
        for (int i = 0; i < header.length; i++) {
            header[i] = header[i].replace("\uFEFF", "").trim();
        }

        List<String> errors = new ArrayList<>();
        for (int i = 1; i < rows.size(); i++) {
            String[] row = rows.get(i);
            if (isBlank(row)) {
                continue;
            }
            if (row.length != header.length) {
                errors.add(String.format("row %d: expected %d fields but found %d", i + 1, header.length,
                        row.length));
                continue;
            }
            Map<String, String> record = new LinkedHashMap<>();
            for (int c = 0; c < header.length; c++) {
                record.put(header[c], row[c]);
            }
            records.add(record);
        }

        if (!errors.isEmpty()) {
            throw new TableParseException(errors);
        }
        return records;
    }

    /**
     * Render records as a table with a header row, columns in the given order.
     * Missing values are written as empty fields.
     */
    public static String write(List<String> columns, List<? extends Map<String, ?>> records) {
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        columns.forEach(schema::addColumn);

        List<Map<String, String>> rows = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            Map<String, String> row = new LinkedHashMap<>();
            for (String column : columns) {
                Object value = record.get(column);
                row.put(column, value == null ? "" : value.toString());
            }
            rows.add(row);
        }

        try {
            return CSV_MAPPER.writer(schema.build()).writeValueAsString(rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write table", e);
        }
    }

    private static List<String[]> readRows(String text) {
        try (MappingIterator<String[]> iterator = CSV_MAPPER.readerFor(String[].class)
                .with(CsvSchema.emptySchema())
                .readValues(text)) {
            return iterator.readAll();
        } catch (IOException e) {
            throw new TableParseException(List.of("unreadable table: " + e.getMessage()));
        }
    }

    private static boolean isBlank(String[] row) {
        return Arrays.stream(row).allMatch(value -> value == null || value.isBlank());
    }
}
