package com.fundradar.fund;

import com.fundradar.domain.FeeRecord;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Outcome of one fee calculation. {@code performanceFee} is null when NAV ended at or below the high-water mark.
 */
public record FeePeriodResult(
        LocalDate periodStart,
        LocalDate periodEnd,
        long days,
        BigDecimal navStart,
        BigDecimal navEnd,
        FeeRecord managementFee,
        FeeRecord performanceFee,
        BigDecimal highWaterMarkBefore,
        BigDecimal highWaterMarkAfter
) {

    public BigDecimal totalFees() {
        BigDecimal total = managementFee.getAmount();
        return performanceFee == null ? total : total.add(performanceFee.getAmount());
    }
}
