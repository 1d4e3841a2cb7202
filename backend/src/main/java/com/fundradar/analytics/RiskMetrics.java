package com.fundradar.analytics;

/**
 * Risk and return statistics of a daily series. Returns and ratios are fractions (0.05 = 5%) except
 * {@code maxDrawdownPct} and {@code winRatePct}, which are percentages. Drawdowns are positive magnitudes; {@code maxDrawdownAmount} is in the series currency.
 */
public record RiskMetrics(
        int observations,
        double totalReturn,
        double annualizedReturn,
        double volatilityDaily,
        double volatilityAnnual,
        double sharpeRatio,
        double sortinoRatio,
        double maxDrawdownAmount,
        double maxDrawdownPct,
        double calmarRatio,
        double winRatePct,
        double bestDay,
        double worstDay,
        double var95,
        double var99,
        double cvar95,
        double cvar99
) {
}
