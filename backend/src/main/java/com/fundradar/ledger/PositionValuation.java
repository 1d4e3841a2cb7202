package com.fundradar.ledger;

import com.fundradar.domain.AssetClass;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Read model of one position valued as of a date, in the position's currency.
 * {@code unrealizedPnl = quantity * (marketPrice - avgCost)}.
 */
public record PositionValuation(
        AssetClass assetClass,
        String symbol,
        String quoteSymbol,
        String currency,
        BigDecimal quantity,
        BigDecimal avgCost,
        BigDecimal marketPrice,
        LocalDate priceDate,
        BigDecimal marketValue,
        BigDecimal costBasis,
        BigDecimal unrealizedPnl,
        BigDecimal unrealizedPnlPct,
        BigDecimal realizedPnl,
        BigDecimal totalPnl,
        boolean priceStale
) {
}
