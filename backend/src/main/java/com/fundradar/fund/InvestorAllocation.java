package com.fundradar.fund;

import java.math.BigDecimal;

/**
 * One investor's share of fund NAV. {@code unrealizedGain = investorNav - netContribution}.
 */
public record InvestorAllocation(
        String investorId,
        String investorName,
        BigDecimal stakePct,
        BigDecimal investorNav,
        BigDecimal netContribution,
        BigDecimal unrealizedGain,
        BigDecimal unrealizedGainPct
) {
}
