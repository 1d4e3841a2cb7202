package com.fundradar.pricing;

import com.fundradar.config.CaffeineConfig;
import com.fundradar.domain.PriceBar;
import com.fundradar.marketdata.MarketDataException;
import com.fundradar.pricing.config.PricingProperties;
import com.fundradar.timeseries.TimeSeriesCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;

/**
 * FX conversion at read time from cached {@code FROMTO=X} bars: direct pair, then the reverse pair inverted,
 * then configured defaults (flagged approximated).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FxRateService {

    private final TimeSeriesCache timeSeriesCache;
    private final PricingProperties pricingProperties;

    /**
     * @throws MarketDataException when the pair is neither cached nor configured
     */
    @Cacheable(cacheNames = CaffeineConfig.FX_RATE_CACHE, key = "#from + '-' + #to + '-' + #asOf")
    public FxRate rate(String from, String to, LocalDate asOf) {
        String f = from.toUpperCase(Locale.ROOT);
        String t = to.toUpperCase(Locale.ROOT);
        if (f.equals(t)) {
            return FxRate.identity(f);
        }
        Optional<BigDecimal> direct = cachedClose(MarketSymbolMapper.fxSymbol(f, t), asOf);
        if (direct.isPresent()) {
            return new FxRate(f, t, direct.get(), false);
        }
        Optional<BigDecimal> reverse = cachedClose(MarketSymbolMapper.fxSymbol(t, f), asOf);
        if (reverse.isPresent()) {
            return new FxRate(f, t, BigDecimal.ONE.divide(reverse.get(), MathContext.DECIMAL64), false);
        }
        BigDecimal configured = pricingProperties.getDefaultFxRates().get(f + t);
        if (configured != null && configured.signum() > 0) {
            log.warn("No cached FX rate {}/{} at {}; using configured default {}", f, t, asOf, configured);
            return new FxRate(f, t, configured, true);
        }
        BigDecimal configuredReverse = pricingProperties.getDefaultFxRates().get(t + f);
        if (configuredReverse != null && configuredReverse.signum() > 0) {
            log.warn("No cached FX rate {}/{} at {}; using inverse of configured default {}", f, t, asOf, configuredReverse);
            return new FxRate(f, t, BigDecimal.ONE.divide(configuredReverse, MathContext.DECIMAL64), true);
        }
        throw new MarketDataException("No FX rate available for " + f + "/" + t + " at " + asOf, false);
    }

    private Optional<BigDecimal> cachedClose(String fxSymbol, LocalDate asOf) {
        return timeSeriesCache.latestBar(fxSymbol, asOf)
                .map(PriceBar::getClose)
                .filter(c -> c.signum() > 0);
    }
}
