package com.tradezzz.risk.sizing;

import com.tradezzz.domain.enums.PositionSizingMethod;

/**
 * Scales the base risk fraction by {@code avgVolatility / volatility}: calmer markets get larger
 * positions, up to twice the base.
 */
public class VolatilityAdjustedSizer implements PositionSizer {

    static final double MAX_ADJUSTMENT = 2.0;
    static final double MIN_VOLATILITY = 0.001;

    @Override
    public PositionSizingMethod getMethod() {
        return PositionSizingMethod.VOLATILITY_ADJUSTED;
    }

    @Override
    public PositionSizeResult size(PositionSizingContext context) {
        double adjustment = context.getAvgVolatility() > 0
                ? context.getAvgVolatility() / Math.max(context.getVolatility(), MIN_VOLATILITY)
                : 1;
        double risk = context.getAccountBalance() * context.getRiskPercentage() * Math.min(adjustment, MAX_ADJUSTMENT);
        return PositionSizeResult.of(getMethod(), risk, context.getAccountBalance());
    }
}
