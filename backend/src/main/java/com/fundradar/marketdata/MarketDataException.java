package com.fundradar.marketdata;

import lombok.Getter;

/**
 * Thrown when an upstream market-data or indexer call fails. {@code retryable} is false for client errors
 * (unknown symbol, bad request) that a retry cannot fix.
 */
@Getter
public class MarketDataException extends RuntimeException {

    private final boolean retryable;

    public MarketDataException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public MarketDataException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }
}
