package com.fundradar.aggregator;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * All asset classes valued in one currency. {@code exchangeRates} holds the rate used per source currency
 * (units of {@code currency} per unit of the key).
 */
public record ConsolidatedSummary(
        LocalDate asOf,
        String currency,
        BigDecimal totalValue,
        BigDecimal totalCost,
        BigDecimal totalPnl,
        BigDecimal totalReturnPct,
        List<AssetClassAllocation> allocations,
        Map<String, BigDecimal> exchangeRates,
        List<String> staleSymbols,
        boolean approximated
) {
}
