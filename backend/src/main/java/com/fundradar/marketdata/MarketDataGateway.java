package com.fundradar.marketdata;

import com.fundradar.common.DateWindow;
import com.fundradar.domain.PriceBar;

import java.util.List;

/**
 * External boundary for daily OHLC bars. One call covers one bounded date window of one symbol.
 * Days without trading are simply absent from the result.
 */
public interface MarketDataGateway {

    /**
     * @throws MarketDataException on upstream failure
     */
    List<PriceBar> fetchDailyBars(String symbol, DateWindow window);
}
