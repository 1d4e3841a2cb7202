package com.fundradar.fund;

import com.fundradar.domain.FeeRecord;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/** Fee records dated in [from, to] with totals in base currency. */
public record FeeSummary(
        LocalDate from,
        LocalDate to,
        String currency,
        BigDecimal managementFees,
        BigDecimal performanceFees,
        BigDecimal totalFees,
        BigDecimal paid,
        BigDecimal outstanding,
        int paidCount,
        int outstandingCount,
        List<FeeRecord> records
) {
}
