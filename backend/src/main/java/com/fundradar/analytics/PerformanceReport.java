package com.fundradar.analytics;

import java.time.LocalDate;
import java.util.List;

/**
 * Performance payload for one portfolio and date range. {@code riskMetrics} and {@code benchmark} are null when
 * the series is too short; {@code benchmarkSeries} is empty when the benchmark has no cached prices.
 */
public record PerformanceReport(
        String portfolioId,
        LocalDate from,
        LocalDate to,
        String currency,
        List<NavPoint> navSeries,
        RiskMetrics riskMetrics,
        List<DrawdownEpisode> drawdownEpisodes,
        List<DrawdownPoint> drawdownSeries,
        BenchmarkComparison benchmark,
        List<BenchmarkPoint> benchmarkSeries,
        List<RollingMetricPoint> rollingMetrics,
        List<MonthlyReturn> monthlyReturns,
        boolean approximated
) {
}
