package com.fundradar.pricing;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Price used for a valuation. {@code stale} is set when it came from an old bar or the last trade instead of a
 * current bar; {@code price} is null only when nothing at all is known.
 */
public record PriceQuote(String symbol, BigDecimal price, String currency, LocalDate priceDate, Source source, boolean stale) {

    public enum Source {
        CACHED_BAR,
        LAST_TRADE,
        NONE
    }

    public static PriceQuote unknown(String symbol, String currency) {
        return new PriceQuote(symbol, null, currency, null, Source.NONE, true);
    }

    public boolean isKnown() {
        return price != null;
    }
}
