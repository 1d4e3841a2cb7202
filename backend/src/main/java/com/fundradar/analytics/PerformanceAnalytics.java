package com.fundradar.analytics;

import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Return and risk statistics over a daily value series.
 * <p>
 * Daily return {@code r_t = v_t / v_(t-1) - 1}; annualization uses {@code tradingDays} (mean × N, stdev × √N).
 * Standard deviations are sample deviations. VaR is the lower percentile with linear interpolation between
 * order statistics; CVaR is the mean of returns at or below it.
 */
public final class PerformanceAnalytics {

    private final int tradingDays;
    private final double riskFreeRate;

    /**
     * @param riskFreeRate annual risk-free rate as a fraction
     */
    public PerformanceAnalytics(int tradingDays, double riskFreeRate) {
        if (tradingDays <= 0) {
            throw new IllegalArgumentException("tradingDays must be positive");
        }
        this.tradingDays = tradingDays;
        this.riskFreeRate = riskFreeRate;
    }

    /** Returns between consecutive points; a point after a non-positive value starts a new base and yields none. */
    public static double[] dailyReturns(List<NavPoint> series) {
        double[] out = new double[Math.max(0, series.size() - 1)];
        int n = 0;
        for (int i = 1; i < series.size(); i++) {
            double prev = series.get(i - 1).value();
            if (prev > 0) {
                out[n++] = series.get(i).value() / prev - 1.0;
            }
        }
        return n == out.length ? out : Arrays.copyOf(out, n);
    }

    public static double cumulativeReturn(double[] returns) {
        double growth = 1.0;
        for (double r : returns) {
            growth *= 1.0 + r;
        }
        return growth - 1.0;
    }

    /** Empty when the series has fewer than two points. */
    public Optional<RiskMetrics> riskMetrics(List<NavPoint> series) {
        double[] returns = dailyReturns(series);
        if (returns.length == 0) {
            return Optional.empty();
        }
        DescriptiveStatistics stats = new DescriptiveStatistics(returns);
        double mean = stats.getMean();
        double annualReturn = mean * tradingDays;
        double volDaily = stats.getStandardDeviation();
        double volAnnual = volDaily * Math.sqrt(tradingDays);
        double sharpe = volAnnual > 0 ? (annualReturn - riskFreeRate) / volAnnual : 0.0;
        double sortino = sortino(returns, annualReturn);

        List<DrawdownEpisode> episodes = drawdownEpisodes(series);
        DrawdownEpisode worst = episodes.stream()
                .max((a, b) -> Double.compare(a.depthPct(), b.depthPct()))
                .orElse(null);
        double maxDdPct = worst == null ? 0.0 : worst.depthPct();
        double maxDdAmount = worst == null ? 0.0 : worst.peakValue() - worst.troughValue();
        double calmar = maxDdPct > 0 ? annualReturn / (maxDdPct / 100.0) : 0.0;

        long wins = Arrays.stream(returns).filter(r -> r > 0).count();
        double var95 = valueAtRisk(returns, 95);
        double var99 = valueAtRisk(returns, 99);
        return Optional.of(new RiskMetrics(returns.length, cumulativeReturn(returns), annualReturn, volDaily, volAnnual,
                sharpe, sortino, maxDdAmount, maxDdPct, calmar, 100.0 * wins / returns.length,
                stats.getMax(), stats.getMin(), var95, var99,
                conditionalValueAtRisk(returns, var95), conditionalValueAtRisk(returns, var99)));
    }

    private double sortino(double[] returns, double annualReturn) {
        double[] downside = Arrays.stream(returns).filter(r -> r < 0).toArray();
        if (downside.length == 0) {
            return 0.0;
        }
        double downsideDev = new DescriptiveStatistics(downside).getStandardDeviation() * Math.sqrt(tradingDays);
        return downsideDev > 0 ? (annualReturn - riskFreeRate) / downsideDev : 0.0;
    }

    /**
     * Lower-tail percentile of daily returns at {@code confidence} (95 → 5th percentile).
     */
    public static double valueAtRisk(double[] returns, double confidence) {
        if (returns.length == 0) {
            return 0.0;
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(returns, 100.0 - confidence);
    }

    public static double conditionalValueAtRisk(double[] returns, double var) {
        return Arrays.stream(returns).filter(r -> r <= var).average().orElse(var);
    }

    /**
     * Peak-to-trough episodes in series order. An episode closes when the value first gets back to its peak;
     * one still open at the end of the series is reported unrecovered.
     */
    public static List<DrawdownEpisode> drawdownEpisodes(List<NavPoint> series) {
        List<DrawdownEpisode> episodes = new ArrayList<>();
        if (series.isEmpty()) {
            return episodes;
        }
        int peak = 0;
        int trough = -1;
        for (int i = 1; i < series.size(); i++) {
            double v = series.get(i).value();
            double peakValue = series.get(peak).value();
            if (v >= peakValue) {
                if (trough >= 0) {
                    episodes.add(episode(series, peak, trough, i));
                    trough = -1;
                }
                peak = i;
            } else if (trough < 0 || v < series.get(trough).value()) {
                trough = i;
            }
        }
        if (trough >= 0) {
            episodes.add(episode(series, peak, trough, null));
        }
        return episodes;
    }

    private static DrawdownEpisode episode(List<NavPoint> series, int peak, int trough, Integer recovery) {
        NavPoint p = series.get(peak);
        NavPoint t = series.get(trough);
        double depth = p.value() > 0 ? (p.value() - t.value()) / p.value() * 100.0 : 0.0;
        return new DrawdownEpisode(peak, p.date(), p.value(), trough, t.date(), t.value(), recovery,
                recovery == null ? null : series.get(recovery).date(), depth);
    }

    public static List<DrawdownPoint> drawdownSeries(List<NavPoint> series) {
        List<DrawdownPoint> points = new ArrayList<>(series.size());
        double peak = Double.NEGATIVE_INFINITY;
        for (NavPoint p : series) {
            peak = Math.max(peak, p.value());
            double dd = p.value() - peak;
            points.add(new DrawdownPoint(p.date(), p.value(), peak, dd, peak > 0 ? dd / peak * 100.0 : 0.0));
        }
        return points;
    }

    /**
     * Compares returns on the dates both series have. Empty with fewer than two shared return observations.
     */
    public Optional<BenchmarkComparison> compare(List<NavPoint> portfolio, List<NavPoint> benchmark, String benchmarkSymbol) {
        List<NavPoint[]> aligned = align(portfolio, benchmark);
        if (aligned.size() < 3) {
            return Optional.empty();
        }
        double[] p = new double[aligned.size() - 1];
        double[] b = new double[aligned.size() - 1];
        int n = 0;
        for (int i = 1; i < aligned.size(); i++) {
            double p0 = aligned.get(i - 1)[0].value();
            double b0 = aligned.get(i - 1)[1].value();
            if (p0 > 0 && b0 > 0) {
                p[n] = aligned.get(i)[0].value() / p0 - 1.0;
                b[n] = aligned.get(i)[1].value() / b0 - 1.0;
                n++;
            }
        }
        if (n < 2) {
            return Optional.empty();
        }
        p = Arrays.copyOf(p, n);
        b = Arrays.copyOf(b, n);
        double[] excess = new double[n];
        for (int i = 0; i < n; i++) {
            excess[i] = p[i] - b[i];
        }
        DescriptiveStatistics excessStats = new DescriptiveStatistics(excess);
        double alphaSimple = excessStats.getMean() * tradingDays;
        double benchVariance = new DescriptiveStatistics(b).getVariance();
        double beta = benchVariance > 0 ? new Covariance().covariance(p, b) / benchVariance : 0.0;
        double portAnnual = new DescriptiveStatistics(p).getMean() * tradingDays;
        double benchAnnual = new DescriptiveStatistics(b).getMean() * tradingDays;
        double jensen = portAnnual - (riskFreeRate + beta * (benchAnnual - riskFreeRate));
        double trackingError = excessStats.getStandardDeviation() * Math.sqrt(tradingDays);
        double ir = trackingError > 0 ? alphaSimple / trackingError : 0.0;
        double correlation = new PearsonsCorrelation().correlation(p, b);
        long wins = Arrays.stream(excess).filter(e -> e > 0).count();
        return Optional.of(new BenchmarkComparison(benchmarkSymbol, n, alphaSimple, jensen, beta, trackingError, ir,
                Double.isNaN(correlation) ? 0.0 : correlation, 100.0 * wins / n, excessStats.getMean(), excessStats.getSum()));
    }

    /** Cumulative portfolio and benchmark returns on shared dates, rebased to the first one. */
    public static List<BenchmarkPoint> benchmarkSeries(List<NavPoint> portfolio, List<NavPoint> benchmark) {
        List<NavPoint[]> aligned = align(portfolio, benchmark);
        List<BenchmarkPoint> points = new ArrayList<>(aligned.size());
        if (aligned.isEmpty() || aligned.get(0)[0].value() <= 0 || aligned.get(0)[1].value() <= 0) {
            return points;
        }
        double p0 = aligned.get(0)[0].value();
        double b0 = aligned.get(0)[1].value();
        for (NavPoint[] pair : aligned) {
            double pc = (pair[0].value() / p0 - 1.0) * 100.0;
            double bc = (pair[1].value() / b0 - 1.0) * 100.0;
            points.add(new BenchmarkPoint(pair[0].date(), pc, bc, pc - bc));
        }
        return points;
    }

    private static List<NavPoint[]> align(List<NavPoint> portfolio, List<NavPoint> benchmark) {
        Map<LocalDate, NavPoint> byDate = new LinkedHashMap<>();
        for (NavPoint b : benchmark) {
            byDate.put(b.date(), b);
        }
        List<NavPoint[]> aligned = new ArrayList<>();
        for (NavPoint p : portfolio) {
            NavPoint b = byDate.get(p.date());
            if (b != null) {
                aligned.add(new NavPoint[]{p, b});
            }
        }
        return aligned;
    }

    /**
     * One point per return observation; statistics are null until {@code window} returns have accumulated.
     */
    public List<RollingMetricPoint> rollingMetrics(List<NavPoint> series, int window) {
        if (window < 2) {
            throw new IllegalArgumentException("window must be at least 2");
        }
        List<RollingMetricPoint> points = new ArrayList<>();
        DescriptiveStatistics trailing = new DescriptiveStatistics(window);
        for (int i = 1; i < series.size(); i++) {
            double prev = series.get(i - 1).value();
            if (prev <= 0) {
                continue;
            }
            trailing.addValue(series.get(i).value() / prev - 1.0);
            LocalDate date = series.get(i).date();
            if (trailing.getN() < window) {
                points.add(new RollingMetricPoint(date, null, null, null));
                continue;
            }
            double annualReturn = trailing.getMean() * tradingDays;
            double vol = trailing.getStandardDeviation() * Math.sqrt(tradingDays);
            points.add(new RollingMetricPoint(date, annualReturn, vol, vol > 0 ? (annualReturn - riskFreeRate) / vol : 0.0));
        }
        return points;
    }

    public static List<MonthlyReturn> monthlyReturns(List<NavPoint> series) {
        Map<YearMonth, Double> monthEnd = new LinkedHashMap<>();
        for (NavPoint p : series) {
            monthEnd.put(YearMonth.from(p.date()), p.value());
        }
        List<MonthlyReturn> months = new ArrayList<>();
        if (series.isEmpty()) {
            return months;
        }
        double start = series.get(0).value();
        for (Map.Entry<YearMonth, Double> e : monthEnd.entrySet()) {
            double end = e.getValue();
            double pct = start > 0 ? (end / start - 1.0) * 100.0 : 0.0;
            months.add(new MonthlyReturn(e.getKey(), start, end, pct));
            start = end;
        }
        return months;
    }
}
