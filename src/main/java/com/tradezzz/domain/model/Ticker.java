package com.tradezzz.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time price and 24h statistics for one trading pair.
 *
 * <p>Tickers are never cached: every consumer re-fetches through the gateway, so paper
 * fills always use the venue's current price.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Ticker {

    /** Canonical BASE/QUOTE symbol, e.g. "BTC/USDT". */
    private String symbol;

    private BigDecimal price;
    private BigDecimal bid;
    private BigDecimal ask;
    private BigDecimal volume24h;
    private BigDecimal change24h;
    private BigDecimal changePercent24h;
    private BigDecimal high24h;
    private BigDecimal low24h;
    private Instant timestamp;
}
