package com.tradezzz.risk;

import lombok.Builder;
import lombok.Value;

/**
 * Win/loss statistics over closed trades. {@code avgLoss} is a positive magnitude.
 * {@code profitFactor} is infinite when there are wins and no losses.
 */
@Value
@Builder
public class TradeStats {

    int totalTrades;
    int winningTrades;
    int losingTrades;
    double winRate;
    double avgWin;
    double avgLoss;
    double profitFactor;
    double expectancy;

    public static TradeStats empty() {
        return TradeStats.builder().build();
    }
}
