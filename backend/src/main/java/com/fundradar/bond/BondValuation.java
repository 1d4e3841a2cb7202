package com.fundradar.bond;

import com.fundradar.domain.Indexer;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

/**
 * A bond valued as of a date. Accrual stops at maturity; {@code daysToMaturity} is null once matured.
 * {@code approximated} is set when any part of the accrual used a reference rate instead of published data;
 * {@code substitutedMonths} lists the IPCA months that were filled in.
 */
public record BondValuation(
        String bondId,
        String title,
        String issuer,
        String bondType,
        Indexer indexer,
        BigDecimal rate,
        BigDecimal quantity,
        BigDecimal investedValue,
        BigDecimal accruedValue,
        BigDecimal pnl,
        BigDecimal pnlPct,
        LocalDate applicationDate,
        LocalDate maturityDate,
        LocalDate valuationDate,
        Long daysToMaturity,
        boolean matured,
        boolean approximated,
        List<YearMonth> substitutedMonths,
        String currency
) {
}
