package com.fundradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Coverage of the price cache for one symbol. Drives incremental fetches: only dates outside
 * [firstDate, lastDate] are requested from the gateway.
 */
@Document(collection = "symbol_metadata")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class SymbolMetadata {

    @Id
    @EqualsAndHashCode.Include
    private String symbol;
    private LocalDate firstDate;
    private LocalDate lastDate;
    private Instant lastUpdated;
    private long totalRecords;

    public boolean hasCoverage() {
        return firstDate != null && lastDate != null;
    }
}
