package com.fundradar.analytics;

import java.time.LocalDate;

/** Trailing-window statistics ending on {@code date}; null until the window is full. */
public record RollingMetricPoint(LocalDate date, Double annualizedReturn, Double annualizedVolatility, Double sharpeRatio) {

    public boolean isDefined() {
        return annualizedReturn != null;
    }
}
