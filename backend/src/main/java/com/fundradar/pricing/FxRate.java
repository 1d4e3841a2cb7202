package com.fundradar.pricing;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Units of {@code to} per one {@code from}. {@code approximated} when a configured default was used.
 */
public record FxRate(String from, String to, BigDecimal rate, boolean approximated) {

    public static FxRate identity(String currency) {
        return new FxRate(currency, currency, BigDecimal.ONE, false);
    }

    public BigDecimal convert(BigDecimal amount) {
        return amount.multiply(rate, MathContext.DECIMAL64);
    }
}
