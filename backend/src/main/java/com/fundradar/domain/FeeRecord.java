package com.fundradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Management or performance fee for one period. Fund-level fees use {@link #FUND_INVESTOR_ID}.
 * Status moves only forward; see {@link FeeStatus}.
 */
@Document(collection = "fee_records")
@CompoundIndex(name = "portfolio_period_type", def = "{'portfolioId': 1, 'investorId': 1, 'periodStart': 1, 'periodEnd': 1, 'feeType': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class FeeRecord {

    public static final String FUND_INVESTOR_ID = "FUND";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String portfolioId;
    private String investorId = FUND_INVESTOR_ID;
    private String investorName;
    /** Record date (period end for calculated fees). */
    private LocalDate date;
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private FeeType feeType;
    private BigDecimal navStart;
    private BigDecimal navEnd;
    /** Annual rate as a fraction (0.02 = 2%). */
    private BigDecimal rate;
    private BigDecimal amount;
    private String currency;
    private FeeStatus status = FeeStatus.PENDING;
    private LocalDate paymentDate;
    private Instant calculatedAt;

    public static String idFor(String portfolioId, String investorId, FeeType feeType, LocalDate periodStart, LocalDate periodEnd) {
        return portfolioId + ":" + investorId + ":" + feeType + ":" + periodStart + ":" + periodEnd;
    }

    public boolean isPaid() {
        return status == FeeStatus.PAID;
    }

    /** Outstanding at {@code asOf}: recorded on or before it and not paid on or before it. */
    public boolean isOutstandingAt(LocalDate asOf) {
        if (date != null && date.isAfter(asOf)) {
            return false;
        }
        return !isPaid() || paymentDate == null || paymentDate.isAfter(asOf);
    }

    public void markCalculated(BigDecimal amount, Instant at) {
        if (status != FeeStatus.PENDING) {
            throw new IllegalStateException("Fee " + id + " is " + status + ", expected PENDING");
        }
        this.amount = amount;
        this.calculatedAt = at;
        this.status = FeeStatus.CALCULATED;
    }

    public void markPaid(LocalDate paymentDate) {
        if (status != FeeStatus.CALCULATED) {
            throw new IllegalStateException("Fee " + id + " is " + status + ", expected CALCULATED");
        }
        this.paymentDate = paymentDate;
        this.status = FeeStatus.PAID;
    }
}
