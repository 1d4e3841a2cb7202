package com.fundradar.timeseries;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Summary of the price cache.
 */
public record CacheStats(
        int symbolCount,
        long totalRecords,
        LocalDate earliestDate,
        LocalDate latestDate,
        List<SymbolStats> symbols
) {

    public record SymbolStats(String symbol, LocalDate firstDate, LocalDate lastDate, long totalRecords, Instant lastUpdated) {
    }
}
