package com.fundradar.aggregator;

import com.fundradar.domain.AssetClass;

import java.math.BigDecimal;

/** One asset class in the consolidated summary; {@code allocationPct} is its share of total value. */
public record AssetClassAllocation(
        AssetClass assetClass,
        BigDecimal value,
        BigDecimal costBasis,
        BigDecimal allocationPct,
        int positions,
        BigDecimal pnl,
        BigDecimal returnPct
) {
}
