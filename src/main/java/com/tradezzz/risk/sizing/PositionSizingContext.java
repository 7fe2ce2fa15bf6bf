package com.tradezzz.risk.sizing;

import lombok.Builder;
import lombok.Value;

/**
 * Inputs for one sizing decision. Only {@code accountBalance} is always required; each sizer reads
 * the fields relevant to its method.
 */
@Value
@Builder
public class PositionSizingContext {

    double accountBalance;

    @Builder.Default
    double riskPercentage = 0.02;

    @Builder.Default
    double winRate = 0.5;

    @Builder.Default
    double avgWin = 1;

    @Builder.Default
    double avgLoss = 1;

    @Builder.Default
    double fixedAmount = 0;

    @Builder.Default
    double volatility = 0;

    @Builder.Default
    double avgVolatility = 1;
}
