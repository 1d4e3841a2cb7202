package com.fundradar.aggregator;

import com.fundradar.domain.Indexer;
import com.fundradar.timeseries.BulkFetchReport;

import java.util.Map;

/**
 * Outcome of refreshing prices and indexer series. Failures are collected per indexer; price failures are in
 * {@code prices}.
 */
public record MarketDataRefreshReport(
        BulkFetchReport prices,
        Map<Indexer, Integer> indexerRatesStored,
        Map<Indexer, String> indexerErrors
) {

    public boolean hasFailures() {
        return prices.hasFailures() || !indexerErrors.isEmpty();
    }
}
