package com.tradezzz.domain.model;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Depth snapshot. Bids are sorted best (highest) first, asks best (lowest) first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderBook {

    private String symbol;
    private List<OrderBookLevel> bids;
    private List<OrderBookLevel> asks;
    private Instant timestamp;
}
