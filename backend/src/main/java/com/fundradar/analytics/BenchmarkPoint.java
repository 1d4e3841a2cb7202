package com.fundradar.analytics;

import java.time.LocalDate;

/** Cumulative returns in percent since the first shared date. */
public record BenchmarkPoint(LocalDate date, double portfolioCumulativePct, double benchmarkCumulativePct, double cumulativeAlphaPct) {
}
