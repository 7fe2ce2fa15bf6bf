package com.tradezzz.risk;

import com.tradezzz.domain.enums.PositionSide;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A position tracked by the risk engine for exposure and P&L. Independent of exchange positions.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RiskPosition {

    private String id;
    private String symbol;
    private PositionSide direction;
    private double entryPrice;
    private double currentPrice;
    private double size;
    private Double stopLoss;
    private Double takeProfit;
    private Instant openedAt;
    private double unrealizedPnl;

    /** Price move in the position's favour, per unit. */
    double favourableMove(double price) {
        return direction == PositionSide.LONG ? price - entryPrice : entryPrice - price;
    }
}
