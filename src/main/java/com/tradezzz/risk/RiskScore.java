package com.tradezzz.risk;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * 0-100 summary of how close a user is to their limits. Each component is itself 0-100;
 * {@code score} is their weighted blend. Higher is riskier.
 */
@Value
@Builder
public class RiskScore {

    int score;
    double dailyLossScore;
    double drawdownScore;
    double positionScore;
    double activityScore;
    List<RiskWarning> warnings;
}
