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
import java.util.ArrayList;
import java.util.List;

/**
 * Materialized NAV for (portfolio, date). Recomputable; upserted by NavCalculator.
 * {@code nav = portfolioValue + cashPosition - outstandingFees}.
 */
@Document(collection = "nav_snapshots")
@CompoundIndex(name = "portfolio_date_unique", def = "{'portfolioId': 1, 'date': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class NavSnapshot {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String portfolioId;
    private LocalDate date;
    private BigDecimal equityValue = BigDecimal.ZERO;
    private BigDecimal cryptoValue = BigDecimal.ZERO;
    private BigDecimal bondValue = BigDecimal.ZERO;
    private BigDecimal portfolioValue = BigDecimal.ZERO;
    private BigDecimal cashPosition = BigDecimal.ZERO;
    private BigDecimal outstandingFees = BigDecimal.ZERO;
    private BigDecimal nav = BigDecimal.ZERO;
    private String currency;
    /** True when any component used a stale price, an approximated indexer or a default FX rate. */
    private boolean approximated;
    private List<String> staleSymbols = new ArrayList<>();
    private Instant computedAt;

    public static String idFor(String portfolioId, LocalDate date) {
        return portfolioId + ":" + date;
    }
}
