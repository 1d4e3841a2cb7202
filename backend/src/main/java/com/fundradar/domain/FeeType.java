package com.fundradar.domain;

import java.util.Locale;

public enum FeeType {
    MANAGEMENT,
    PERFORMANCE;

    public static FeeType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("fee type is required");
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("management") || normalized.startsWith("admin")) {
            return MANAGEMENT;
        }
        if (normalized.startsWith("performance")) {
            return PERFORMANCE;
        }
        throw new IllegalArgumentException("Unknown fee type: " + value);
    }
}
