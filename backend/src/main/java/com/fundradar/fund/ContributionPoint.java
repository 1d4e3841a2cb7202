package com.fundradar.fund;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Cumulative contributions of one investor at the end of {@code date}. */
public record ContributionPoint(LocalDate date, BigDecimal deposits, BigDecimal withdrawals, BigDecimal netContribution) {
}
