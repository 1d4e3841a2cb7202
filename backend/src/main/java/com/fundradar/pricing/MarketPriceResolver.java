package com.fundradar.pricing;

import com.fundradar.domain.PriceBar;
import com.fundradar.pricing.config.PricingProperties;
import com.fundradar.timeseries.TimeSeriesCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Resolves the valuation price of a symbol as of a date: close of the latest cached bar on or before it,
 * falling back to the last trade price (flagged stale). Never calls the network.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MarketPriceResolver {

    private final TimeSeriesCache timeSeriesCache;
    private final PricingProperties pricingProperties;

    public PriceQuote resolve(String quoteSymbol, String quoteCurrency, LocalDate asOf,
                              BigDecimal lastTradePrice, String lastTradeCurrency) {
        Optional<PriceBar> bar = timeSeriesCache.latestBar(quoteSymbol, asOf);
        if (bar.isPresent() && bar.get().getClose() != null) {
            PriceBar b = bar.get();
            boolean stale = b.getDate().plusDays(pricingProperties.getStaleAfterDays()).isBefore(asOf);
            if (stale) {
                log.debug("Price for {} at {} is from {} (stale)", quoteSymbol, asOf, b.getDate());
            }
            return new PriceQuote(quoteSymbol, b.getClose(), quoteCurrency, b.getDate(), PriceQuote.Source.CACHED_BAR, stale);
        }
        if (lastTradePrice != null) {
            log.debug("No cached bar for {} at {}; using last trade price", quoteSymbol, asOf);
            return new PriceQuote(quoteSymbol, lastTradePrice, lastTradeCurrency, null, PriceQuote.Source.LAST_TRADE, true);
        }
        return PriceQuote.unknown(quoteSymbol, quoteCurrency);
    }
}
