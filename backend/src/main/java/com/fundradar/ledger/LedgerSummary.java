package com.fundradar.ledger;

import com.fundradar.domain.AssetClass;

import java.math.BigDecimal;
import java.util.List;

/**
 * Totals of one asset-class ledger in the requested currency.
 */
public record LedgerSummary(
        AssetClass assetClass,
        String currency,
        BigDecimal marketValue,
        BigDecimal costBasis,
        BigDecimal unrealizedPnl,
        BigDecimal realizedPnl,
        BigDecimal totalPnl,
        BigDecimal returnPct,
        int openPositions,
        List<String> staleSymbols,
        boolean approximated
) {
}
