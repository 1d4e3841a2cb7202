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
 * One observation of an indexer series: monthly variation in percent for IPCA (dated the first of the month),
 * daily rate in percent for CDI and SELIC.
 */
@Document(collection = "indexer_rates")
@CompoundIndex(name = "indexer_date_unique", def = "{'indexer': 1, 'date': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class IndexerRate {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private Indexer indexer;
    private LocalDate date;
    private BigDecimal valuePct;

    public static IndexerRate of(Indexer indexer, LocalDate date, BigDecimal valuePct) {
        IndexerRate r = new IndexerRate();
        r.setId(indexer + ":" + date);
        r.setIndexer(indexer);
        r.setDate(date);
        r.setValuePct(valuePct);
        return r;
    }
}
