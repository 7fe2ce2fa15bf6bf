package com.tradezzz.risk.sizing;

import com.tradezzz.domain.enums.PositionSizingMethod;
import com.tradezzz.risk.RiskCalculations;

/**
 * Half-Kelly sizing. The full Kelly fraction from win rate and win/loss ratio is halved and capped
 * at {@value #MAX_FRACTION} of the balance.
 */
public class KellyCriterionSizer implements PositionSizer {

    static final double KELLY_MULTIPLIER = 0.5;
    static final double MAX_FRACTION = 0.25;

    @Override
    public PositionSizingMethod getMethod() {
        return PositionSizingMethod.KELLY_CRITERION;
    }

    @Override
    public PositionSizeResult size(PositionSizingContext context) {
        double kelly = RiskCalculations.kellyFraction(context.getWinRate(), context.getAvgWin(), context.getAvgLoss());
        double fraction = Math.max(0, Math.min(kelly * KELLY_MULTIPLIER, MAX_FRACTION));
        return PositionSizeResult.of(getMethod(), context.getAccountBalance() * fraction, context.getAccountBalance());
    }
}
