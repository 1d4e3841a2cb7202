package com.fundradar.ingestion;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads comma-separated files with a header line into {@link CsvRow}s. Header names are matched
 * case-insensitively; blank lines are skipped; surrounding spaces are trimmed.
 */
public final class CsvRowReader {

    private static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .build();
    private static final CsvSchema SCHEMA = CsvSchema.emptySchema().withHeader().withColumnSeparator(',');

    private CsvRowReader() {
    }

    /**
     * @throws UncheckedIOException when the input cannot be read or is not valid CSV
     */
    public static List<CsvRow> read(Reader input) {
        List<CsvRow> rows = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = MAPPER.readerForMapOf(String.class).with(SCHEMA).readValues(input)) {
            int row = 0;
            while (it.hasNextValue()) {
                Map<String, String> raw = it.nextValue();
                row++;
                Map<String, String> normalized = new LinkedHashMap<>();
                raw.forEach((k, v) -> normalized.put(normalize(k), v));
                rows.add(new CsvRow(row, normalized));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read CSV input", e);
        }
        return rows;
    }

    static String normalize(String header) {
        return header.strip()
                .replace("\uFEFF", "")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[\\s/]+", "_");
    }
}
