package com.fundradar.pricing;

import com.fundradar.domain.AssetClass;

import java.util.Locale;

/**
 * Maps ledger symbols to quote symbols in the price cache and to their quote currency.
 * Brazilian listings ({@code market = Nacional}) quote as {@code SYM.SA} in BRL; other equities as-is in USD;
 * crypto as {@code SYM-USD}.
 */
public final class MarketSymbolMapper {

    private MarketSymbolMapper() {
    }

    public static String quoteSymbol(AssetClass assetClass, String symbol, String market) {
        String s = symbol.strip().toUpperCase(Locale.ROOT);
        return switch (assetClass) {
            case CRYPTO -> s.contains("-") ? s : s + "-USD";
            case EQUITY -> isDomestic(market) && !s.endsWith(".SA") ? s + ".SA" : s;
            case FIXED_INCOME -> throw new IllegalArgumentException("Fixed income has no quote symbol: " + symbol);
        };
    }

    public static String quoteCurrency(AssetClass assetClass, String market) {
        if (assetClass == AssetClass.EQUITY && isDomestic(market)) {
            return "BRL";
        }
        return "USD";
    }

    /** Yahoo-style FX symbol; its close is units of {@code to} per one {@code from}. */
    public static String fxSymbol(String from, String to) {
        return from.toUpperCase(Locale.ROOT) + to.toUpperCase(Locale.ROOT) + "=X";
    }

    public static boolean isDomestic(String market) {
        if (market == null) {
            return false;
        }
        String m = market.strip().toLowerCase(Locale.ROOT);
        return m.equals("nacional") || m.equals("b3") || m.equals("br") || m.equals("brasil");
    }
}
