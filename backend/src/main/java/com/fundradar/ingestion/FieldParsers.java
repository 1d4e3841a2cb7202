package com.fundradar.ingestion;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Field conversions shared by the CSV parsers. Each throws IllegalArgumentException with a message fit for a
 * row error.
 */
final class FieldParsers {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    private FieldParsers() {
    }

    /** ISO {@code yyyy-MM-dd}; a time part after the date is ignored. */
    static LocalDate date(String value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("missing " + field);
        }
        String v = value.length() > 10 && (value.charAt(10) == 'T' || value.charAt(10) == ' ') ? value.substring(0, 10) : value;
        try {
            return LocalDate.parse(v);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid " + field + " '" + value + "', expected yyyy-MM-dd", e);
        }
    }

    static LocalDate optionalDate(String value, String field) {
        return value == null ? null : date(value, field);
    }

    /** Plain decimal with '.' as separator. */
    static BigDecimal decimal(String value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("missing " + field);
        }
        try {
            return new BigDecimal(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + field + " '" + value + "'", e);
        }
    }

    static BigDecimal optionalDecimal(String value, String field) {
        return value == null ? null : decimal(value, field);
    }

    /**
     * Percentage written as {@code 6.5}, {@code 6.5%}, {@code IPCA + 6%} or {@code 110% CDI}: the last number wins.
     */
    static BigDecimal percent(String value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("missing " + field);
        }
        Matcher m = NUMBER.matcher(value);
        String last = null;
        while (m.find()) {
            last = m.group();
        }
        if (last == null) {
            throw new IllegalArgumentException("invalid " + field + " '" + value + "'");
        }
        return new BigDecimal(last);
    }

    static boolean bool(String value) {
        if (value == null) {
            return false;
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "y", "1", "sim", "s" -> true;
            default -> false;
        };
    }

    static String currency(String value, String fallback) {
        return value == null ? fallback : value.strip().toUpperCase(Locale.ROOT);
    }
}
