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
 * Append-only investor cash movement. Corrections are new offsetting entries.
 * {@code amount} is always positive; the sign comes from {@link CashFlowType}.
 * {@code amountInBaseCurrency} is kept as supplied by the source file and is not used for valuation.
 */
@Document(collection = "cash_flows")
@CompoundIndex(name = "portfolio_date", def = "{'portfolioId': 1, 'date': 1}")
@CompoundIndex(name = "portfolio_investor_date", def = "{'portfolioId': 1, 'investorId': 1, 'date': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CashFlow {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String portfolioId;
    private LocalDate date;
    private String investorId;
    private String investorName;
    private CashFlowType type;
    private BigDecimal amount;
    private String currency;
    private BigDecimal amountInBaseCurrency;
    private String description;
    private Instant recordedAt;

    /** Deposit positive, withdrawal negative, in {@link #getCurrency()}. */
    public BigDecimal signedAmount() {
        return type == CashFlowType.WITHDRAWAL ? amount.negate() : amount;
    }
}
