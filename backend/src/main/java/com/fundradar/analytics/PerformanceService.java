package com.fundradar.analytics;

import com.fundradar.analytics.config.AnalyticsProperties;
import com.fundradar.context.PortfolioContext;
import com.fundradar.domain.NavSnapshot;
import com.fundradar.domain.PriceBar;
import com.fundradar.fund.NavSeriesBuilder;
import com.fundradar.timeseries.TimeSeriesCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Builds the NAV series of a portfolio and derives its performance report against a cached benchmark.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PerformanceService {

    private final NavSeriesBuilder navSeriesBuilder;
    private final TimeSeriesCache timeSeriesCache;
    private final PerformanceAnalytics performanceAnalytics;
    private final AnalyticsProperties analyticsProperties;

    /**
     * @param benchmarkSymbol quote symbol in the price cache; the configured default when null
     */
    public PerformanceReport performance(PortfolioContext ctx, LocalDate from, LocalDate to, String benchmarkSymbol) {
        List<NavSnapshot> snapshots = navSeriesBuilder.build(ctx, from, to, false);
        List<NavPoint> navSeries = snapshots.stream()
                .map(s -> new NavPoint(s.getDate(), s.getNav().doubleValue()))
                .toList();
        boolean approximated = snapshots.stream().anyMatch(NavSnapshot::isApproximated);
        return report(ctx.portfolioId(), ctx.baseCurrency(), from, to, navSeries,
                benchmarkSymbol != null ? benchmarkSymbol : analyticsProperties.getBenchmarkSymbol(), approximated);
    }

    PerformanceReport report(String portfolioId, String currency, LocalDate from, LocalDate to, List<NavPoint> navSeries,
                             String benchmarkSymbol, boolean approximated) {
        List<NavPoint> benchmark = timeSeriesCache.history(benchmarkSymbol, from, to).stream()
                .filter(b -> b.getClose() != null)
                .map(b -> new NavPoint(b.getDate(), closeOf(b)))
                .toList();
        if (benchmark.isEmpty()) {
            log.warn("Portfolio {}: no cached prices for benchmark {} in {}..{}", portfolioId, benchmarkSymbol, from, to);
        }
        return new PerformanceReport(portfolioId, from, to, currency, navSeries,
                performanceAnalytics.riskMetrics(navSeries).orElse(null),
                PerformanceAnalytics.drawdownEpisodes(navSeries),
                PerformanceAnalytics.drawdownSeries(navSeries),
                performanceAnalytics.compare(navSeries, benchmark, benchmarkSymbol).orElse(null),
                PerformanceAnalytics.benchmarkSeries(navSeries, benchmark),
                performanceAnalytics.rollingMetrics(navSeries, analyticsProperties.getRollingWindow()),
                PerformanceAnalytics.monthlyReturns(navSeries),
                approximated);
    }

    private static double closeOf(PriceBar bar) {
        return bar.getAdjClose() != null ? bar.getAdjClose().doubleValue() : bar.getClose().doubleValue();
    }
}
