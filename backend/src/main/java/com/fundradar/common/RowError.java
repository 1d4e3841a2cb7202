package com.fundradar.common;

/**
 * Rejected input row: 1-based data row number (header excluded) and the reason.
 */
public record RowError(int row, String message) {

    @Override
    public String toString() {
        return "row " + row + ": " + message;
    }
}
