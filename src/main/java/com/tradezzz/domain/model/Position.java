package com.tradezzz.domain.model;

import com.tradezzz.domain.enums.PositionSide;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-symbol aggregate of fills, marked to the current price.
 *
 * <p>{@code entryPrice} is the cost-basis average, recomputed on every fill.
 * Spot venues derive positions from non-quote balances and may report an entry price of zero.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String symbol;
    private PositionSide side;
    private BigDecimal quantity;
    private BigDecimal entryPrice;
    private BigDecimal currentPrice;
    private BigDecimal unrealizedPnl;
    private BigDecimal unrealizedPnlPercent;
}
