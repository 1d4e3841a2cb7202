package com.fundradar.pricing;

import com.fundradar.domain.AssetClass;
import com.fundradar.domain.PriceBar;
import com.fundradar.pricing.config.PricingProperties;
import com.fundradar.timeseries.TimeSeriesCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MarketPriceResolverTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 6, 28);

    @Mock
    private TimeSeriesCache timeSeriesCache;

    private MarketPriceResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new MarketPriceResolver(timeSeriesCache, new PricingProperties());
    }

    private static Optional<PriceBar> bar(LocalDate date, String close) {
        PriceBar b = new PriceBar();
        b.setSymbol("PETR4.SA");
        b.setDate(date);
        b.setClose(new BigDecimal(close));
        return Optional.of(b);
    }

    @Test
    void recentBar_isFresh() {
        when(timeSeriesCache.latestBar("PETR4.SA", AS_OF)).thenReturn(bar(AS_OF.minusDays(1), "38.10"));

        PriceQuote quote = resolver.resolve("PETR4.SA", "BRL", AS_OF, new BigDecimal("30"), "BRL");

        assertThat(quote.price()).isEqualByComparingTo("38.10");
        assertThat(quote.source()).isEqualTo(PriceQuote.Source.CACHED_BAR);
        assertThat(quote.stale()).isFalse();
    }

    @Test
    void oldBar_isFlaggedStale() {
        when(timeSeriesCache.latestBar("PETR4.SA", AS_OF)).thenReturn(bar(AS_OF.minusDays(8), "36.00"));

        PriceQuote quote = resolver.resolve("PETR4.SA", "BRL", AS_OF, null, null);

        assertThat(quote.price()).isEqualByComparingTo("36.00");
        assertThat(quote.stale()).isTrue();
    }

    @Test
    void noBar_fallsBackToLastTrade() {
        when(timeSeriesCache.latestBar("PETR4.SA", AS_OF)).thenReturn(Optional.empty());

        PriceQuote quote = resolver.resolve("PETR4.SA", "BRL", AS_OF, new BigDecimal("30"), "BRL");

        assertThat(quote.source()).isEqualTo(PriceQuote.Source.LAST_TRADE);
        assertThat(quote.price()).isEqualByComparingTo("30");
        assertThat(quote.stale()).isTrue();

        assertThat(resolver.resolve("PETR4.SA", "BRL", AS_OF, null, null).isKnown()).isFalse();
    }

    @Test
    void symbolMapping() {
        assertThat(MarketSymbolMapper.quoteSymbol(AssetClass.EQUITY, "petr4", "Nacional")).isEqualTo("PETR4.SA");
        assertThat(MarketSymbolMapper.quoteSymbol(AssetClass.EQUITY, "AAPL", "NASDAQ")).isEqualTo("AAPL");
        assertThat(MarketSymbolMapper.quoteSymbol(AssetClass.CRYPTO, "btc", null)).isEqualTo("BTC-USD");
        assertThat(MarketSymbolMapper.quoteCurrency(AssetClass.EQUITY, "B3")).isEqualTo("BRL");
        assertThat(MarketSymbolMapper.quoteCurrency(AssetClass.CRYPTO, null)).isEqualTo("USD");
    }
}
