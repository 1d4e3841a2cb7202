package com.fundradar.marketdata;

import com.fundradar.common.DateWindow;
import com.fundradar.domain.Indexer;
import com.fundradar.domain.IndexerRate;

import java.util.List;

/**
 * External boundary for Brazilian reference-rate series: monthly IPCA variation, daily CDI and SELIC rates (percent).
 */
public interface IndexerSeriesGateway {

    /**
     * @throws MarketDataException on upstream failure
     */
    List<IndexerRate> fetchSeries(Indexer indexer, DateWindow window);
}
