package com.fundradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Daily OHLC bar. Primary key (symbol, date), materialized as {@code _id = symbol|date} so upserts are idempotent.
 */
@Document(collection = "price_history")
@CompoundIndex(name = "symbol_date_unique", def = "{'symbol': 1, 'date': -1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PriceBar {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String symbol;
    private LocalDate date;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private BigDecimal adjClose;
    private Long volume;
    private BigDecimal dividend = BigDecimal.ZERO;
    private BigDecimal split = BigDecimal.ZERO;

    public static String idFor(String symbol, LocalDate date) {
        return symbol + "|" + date;
    }

    public void ensureId() {
        if (id == null || id.isBlank()) {
            id = idFor(symbol, date);
        }
    }
}
