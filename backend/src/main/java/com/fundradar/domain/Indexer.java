package com.fundradar.domain;

import java.util.Locale;

/**
 * Reference index for fixed-income accrual.
 */
public enum Indexer {
    IPCA,
    CDI,
    SELIC,
    PREFIXADO;

    /**
     * Parses free-text indexer labels; treasury names map to their index (NTN-B → IPCA, LFT → SELIC, LTN → PREFIXADO).
     * Blank input is PREFIXADO.
     */
    public static Indexer parse(String label) {
        if (label == null || label.isBlank()) {
            return PREFIXADO;
        }
        String normalized = label.strip().toUpperCase(Locale.ROOT);
        if (normalized.contains("IPCA") || normalized.startsWith("NTN-B") || normalized.startsWith("NTNB")) {
            return IPCA;
        }
        if (normalized.contains("SELIC") || normalized.startsWith("LFT")) {
            return SELIC;
        }
        if (normalized.contains("CDI") || normalized.contains("DI")) {
            return CDI;
        }
        if (normalized.startsWith("PRE") || normalized.startsWith("LTN") || normalized.contains("FIXED")) {
            return PREFIXADO;
        }
        throw new IllegalArgumentException("Unknown indexer: " + label);
    }
}
