package com.fundradar.bond;

import java.math.BigDecimal;

/**
 * Bond portfolio totals as of a date. Matured bonds count in values but not in {@code activeBonds}.
 */
public record BondPortfolioSummary(
        String currency,
        BigDecimal totalInvested,
        BigDecimal currentValue,
        BigDecimal pnl,
        BigDecimal returnPct,
        int bonds,
        int activeBonds,
        int maturingWithin30Days,
        int maturingWithin90Days,
        boolean approximated
) {
}
