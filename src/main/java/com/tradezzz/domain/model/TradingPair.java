package com.tradezzz.domain.model;

/**
 * A tradable BASE/QUOTE pair.
 */
public record TradingPair(String base, String quote) {

    public static TradingPair parse(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Symbol is required");
        }
        int slash = symbol.indexOf('/');
        if (slash <= 0 || slash == symbol.length() - 1) {
            throw new IllegalArgumentException("Symbol must be in BASE/QUOTE form: " + symbol);
        }
        return new TradingPair(symbol.substring(0, slash).toUpperCase(), symbol.substring(slash + 1).toUpperCase());
    }

    public String symbol() {
        return base + "/" + quote;
    }
}
