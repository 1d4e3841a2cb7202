package com.fundradar.common;

import java.util.Optional;

/**
 * Per-row outcome of validation at an ingestion boundary: either a typed value or a {@link RowError}.
 */
public final class RowResult<T> {

    private final int row;
    private final T value;
    private final String error;

    private RowResult(int row, T value, String error) {
        this.row = row;
        this.value = value;
        this.error = error;
    }

    public static <T> RowResult<T> ok(int row, T value) {
        if (value == null) {
            throw new IllegalArgumentException("value is required");
        }
        return new RowResult<>(row, value, null);
    }

    public static <T> RowResult<T> rejected(int row, String error) {
        return new RowResult<>(row, null, error == null ? "invalid row" : error);
    }

    public boolean isOk() {
        return value != null;
    }

    public int getRow() {
        return row;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<RowError> getError() {
        return isOk() ? Optional.empty() : Optional.of(new RowError(row, error));
    }
}
