package com.fundradar.analytics;

/**
 * Portfolio against a benchmark over dates both series have. Alphas and tracking error are annualized fractions.
 */
public record BenchmarkComparison(
        String benchmarkSymbol,
        int observations,
        double alphaSimple,
        double jensensAlpha,
        double beta,
        double trackingError,
        double informationRatio,
        double correlation,
        double winRatePct,
        double avgExcessReturn,
        double totalExcessReturn
) {
}
