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
 * Signed buy/sell transaction. Positive quantity = buy, negative = sell.
 * Immutable once recorded; replay order is (date ASC, sequence ASC).
 */
@Document(collection = "transactions")
@CompoundIndex(name = "portfolio_class_date", def = "{'portfolioId': 1, 'assetClass': 1, 'date': 1, 'sequence': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LedgerTransaction {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String portfolioId;
    private AssetClass assetClass;
    private String symbol;
    private LocalDate date;
    private BigDecimal quantity;
    private BigDecimal price;
    private String currency;
    /** Listing market, e.g. "Nacional" or "Internacional"; drives the quote symbol. */
    private String market;
    /** Ingestion order; breaks ties between transactions on the same date. */
    private long sequence;
    private Instant recordedAt;

    public boolean isBuy() {
        return quantity != null && quantity.signum() > 0;
    }

    public boolean isSell() {
        return quantity != null && quantity.signum() < 0;
    }
}
