package com.tradezzz.risk;

import lombok.Builder;
import lombok.Value;

/**
 * Per-user thresholds for the pre-trade gate. Percent limits are fractions of equity
 * (0.1 = 10%). Updates replace the whole object.
 */
@Value
@Builder(toBuilder = true)
public class RiskLimits {

    /** Maximum notional of one position as a fraction of current equity. Larger trades are clamped. */
    @Builder.Default
    double maxPositionSize = 0.1;

    /** Realized loss for today, as a fraction of initial equity, that blocks new trades. */
    @Builder.Default
    double maxDailyLoss = 0.05;

    /** Current drawdown from the equity high that blocks new trades. */
    @Builder.Default
    double maxDrawdown = 0.2;

    @Builder.Default
    int maxOpenPositions = 10;

    /** Informational only; no check enforces it yet. */
    @Builder.Default
    int maxCorrelatedPositions = 3;

    @Builder.Default
    double minRiskRewardRatio = 1.5;

    public static RiskLimits defaults() {
        return RiskLimits.builder().build();
    }
}
