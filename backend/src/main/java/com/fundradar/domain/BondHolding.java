package com.fundradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Fixed-income holding. Accrued value is never stored; BondIndexationEngine recomputes it per valuation date.
 * {@code rate} is a percentage whose meaning depends on the indexer: spread over IPCA, percent of CDI/SELIC,
 * or the fixed annual rate for PREFIXADO.
 */
@Document(collection = "bond_holdings")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BondHolding {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String portfolioId;
    private String title;
    private String issuer;
    private String bondType;
    private BigDecimal quantity;
    private BigDecimal unitPrice;
    /** Principal. */
    private BigDecimal investedValue;
    private Indexer indexer;
    private BigDecimal rate;
    private LocalDate applicationDate;
    private LocalDate maturityDate;
    private String currency = "BRL";

    public boolean isMaturedAt(LocalDate date) {
        return maturityDate != null && !date.isBefore(maturityDate);
    }
}
