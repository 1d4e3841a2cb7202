package com.fundradar.analytics;

import java.time.LocalDate;

/** Distance below the running peak on one date; {@code drawdownPct} is zero or negative. */
public record DrawdownPoint(LocalDate date, double value, double peak, double drawdown, double drawdownPct) {
}
