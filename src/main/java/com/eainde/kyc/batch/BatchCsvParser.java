package com.eainde.kyc.batch;

import com.eainde.kyc.config.KycProperties;
import com.eainde.kyc.exception.MalformedBatchException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses an uploaded batch CSV into {@link BatchRow}s.
 *
 * <p>Header names are matched ignoring case, spaces and punctuation, so {@code Full Name},
 * {@code full_name} and {@code FULLNAME} are the same column. Name, document number and
 * document type columns are required; address is optional. Rows shorter than the header
 * yield empty fields and are left to per-row validation.</p>
 */
@Slf4j
@Component
public class BatchCsvParser {

    enum Column {
        NAME(true, "Full Name", "Name"),
        DOCUMENT_NUMBER(true, "Document Number", "Document_Number", "DocumentNumber"),
        ADDRESS(false, "Address"),
        DOCUMENT_TYPE(true, "Document Type", "ID_Type", "DocumentType");

        private final boolean required;
        private final Set<String> aliases;

        Column(boolean required, String... headers) {
            this.required = required;
            this.aliases = Arrays.stream(headers)
                    .map(BatchCsvParser::normalize)
                    .collect(Collectors.toUnmodifiableSet());
        }
    }

    private final CsvMapper csvMapper;
    private final int maxRows;

    public BatchCsvParser(CsvMapper csvMapper, KycProperties properties) {
        this.csvMapper = csvMapper;
        this.maxRows = properties.getBatch().getMaxRows();
    }

    public List<BatchRow> parse(InputStream in) {
        List<String[]> lines = readLines(in);
        if (lines.isEmpty()) {
            throw new MalformedBatchException("Batch file is empty");
        }
        Map<Column, Integer> positions = locateColumns(lines.get(0));
        int dataRows = lines.size() - 1;
        if (dataRows == 0) {
            throw new MalformedBatchException("Batch file has a header but no data rows");
        }
        if (dataRows > maxRows) {
            throw new MalformedBatchException(
                    "Batch file has " + dataRows + " rows, more than the limit of " + maxRows);
        }

        List<BatchRow> rows = new ArrayList<>(dataRows);
        for (int i = 1; i < lines.size(); i++) {
            String[] fields = lines.get(i);
            rows.add(new BatchRow(
                    i,
                    field(fields, positions.get(Column.NAME)),
                    field(fields, positions.get(Column.DOCUMENT_NUMBER)),
                    field(fields, positions.get(Column.ADDRESS)),
                    field(fields, positions.get(Column.DOCUMENT_TYPE))
            ));
        }
        log.info("Parsed batch file with {} rows", rows.size());
        return rows;
    }

    private List<String[]> readLines(InputStream in) {
        List<String[]> lines = new ArrayList<>();
        try (MappingIterator<String[]> it = csvMapper
                .readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(in)) {
            while (it.hasNextValue()) {
                String[] line = it.nextValue();
                if (!isBlank(line)) {
                    lines.add(line);
                }
            }
        } catch (IOException | RuntimeException e) {
            throw new MalformedBatchException("Batch file is not valid CSV: " + e.getMessage(), e);
        }
        return lines;
    }

    private static Map<Column, Integer> locateColumns(String[] header) {
        Map<Column, Integer> positions = new EnumMap<>(Column.class);
        for (int i = 0; i < header.length; i++) {
            String key = normalize(i == 0 ? stripBom(header[i]) : header[i]);
            for (Column column : Column.values()) {
                if (column.aliases.contains(key)) {
                    positions.putIfAbsent(column, i);
                }
            }
        }
        List<String> missing = new ArrayList<>();
        for (Column column : Column.values()) {
            if (column.required && !positions.containsKey(column)) {
                missing.add(column.name());
            }
        }
        if (!missing.isEmpty()) {
            throw new MalformedBatchException("Batch file is missing required columns " + missing);
        }
        return positions;
    }

    private static String field(String[] fields, Integer position) {
        if (position == null || position >= fields.length || fields[position] == null) {
            return "";
        }
        return fields[position].trim();
    }

    private static boolean isBlank(String[] line) {
        for (String value : line) {
            if (value != null && !value.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private static String stripBom(String value) {
        return value != null && value.startsWith("\uFEFF") ? value.substring(1) : value;
    }

    static String normalize(String header) {
        return header == null ? "" : header.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
