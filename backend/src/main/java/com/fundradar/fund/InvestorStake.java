package com.fundradar.fund;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Contribution totals of one investor in base currency. {@code stakePct} is in percent (0..100).
 */
public record InvestorStake(
        String investorId,
        String investorName,
        BigDecimal deposits,
        BigDecimal withdrawals,
        BigDecimal netContribution,
        LocalDate firstInvestmentDate,
        BigDecimal stakePct
) {
}
