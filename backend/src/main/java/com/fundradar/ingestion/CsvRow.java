package com.fundradar.ingestion;

import java.util.Map;

/**
 * One data row keyed by normalized header (lower case, spaces as underscores). {@code row} is 1-based and
 * counts data rows only.
 */
public record CsvRow(int row, Map<String, String> values) {

    /** First non-blank value among the given column names, or null. */
    public String get(String... columns) {
        for (String c : columns) {
            String v = values.get(c);
            if (v != null && !v.isBlank()) {
                return v.strip();
            }
        }
        return null;
    }

    public String require(String... columns) {
        String v = get(columns);
        if (v == null) {
            throw new IllegalArgumentException("missing " + columns[0]);
        }
        return v;
    }
}
