package com.tradezzz.domain.enums;

import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Venues known to the platform, with the request budget per minute we allow ourselves
 * against each one (kept below the venue's own published limits).
 */
@Getter
@RequiredArgsConstructor
public enum ExchangeId {
    BINANCE("binance", "Binance", 1200),
    COINBASE("coinbase", "Coinbase", 300),
    KRAKEN("kraken", "Kraken", 180),
    BYBIT("bybit", "Bybit", 600),
    OKX("okx", "OKX", 600);

    /** Budget applied to venues that are not listed here. */
    public static final int DEFAULT_REQUESTS_PER_MINUTE = 100;

    private final String code;
    private final String displayName;
    private final int requestsPerMinute;

    /**
     * Resolves a venue from its lower-case code or enum name.
     *
     * @throws IllegalArgumentException if the venue is unknown
     */
    public static ExchangeId fromCode(String code) {
        return Arrays.stream(values())
                .filter(id -> id.code.equalsIgnoreCase(code) || id.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown exchange: " + code));
    }

    /** Budget for an arbitrary venue code, falling back to the default for unknown venues. */
    public static int requestsPerMinuteFor(String code) {
        return Arrays.stream(values())
                .filter(id -> id.code.equalsIgnoreCase(code) || id.name().equalsIgnoreCase(code))
                .mapToInt(ExchangeId::getRequestsPerMinute)
                .findFirst()
                .orElse(DEFAULT_REQUESTS_PER_MINUTE);
    }
}
