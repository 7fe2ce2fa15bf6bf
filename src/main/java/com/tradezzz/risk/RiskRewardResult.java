package com.tradezzz.risk;

import lombok.Builder;
import lombok.Value;

/** Distances from entry to stop and target, their ratio and the win rate needed to break even. */
@Value
@Builder
public class RiskRewardResult {

    double riskAmount;
    double rewardAmount;
    double riskRewardRatio;
    double breakEvenWinRate;
}
