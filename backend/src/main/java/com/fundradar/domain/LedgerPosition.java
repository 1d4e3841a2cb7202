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
 * Materialized position per (portfolio, asset class, symbol). Written only by the position ledger.
 * All monetary/quantity fields are BigDecimal in the transaction currency.
 */
@Document(collection = "positions")
@CompoundIndex(name = "portfolio_class_symbol", def = "{'portfolioId': 1, 'assetClass': 1, 'symbol': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LedgerPosition {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String portfolioId;
    private AssetClass assetClass;
    private String symbol;
    private String market;
    private String currency;
    private BigDecimal quantity = BigDecimal.ZERO;
    private BigDecimal avgCost = BigDecimal.ZERO;
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private BigDecimal totalInvested = BigDecimal.ZERO;
    private BigDecimal lastTradePrice;
    private LocalDate firstTransactionDate;
    private LocalDate lastTransactionDate;
    private int transactionCount;
    private Instant lastCalculatedAt;

    public static String idFor(String portfolioId, AssetClass assetClass, String symbol) {
        return portfolioId + ":" + assetClass + ":" + symbol;
    }

    public boolean isOpen() {
        return quantity != null && quantity.signum() != 0;
    }

    public boolean isShort() {
        return quantity != null && quantity.signum() < 0;
    }
}
