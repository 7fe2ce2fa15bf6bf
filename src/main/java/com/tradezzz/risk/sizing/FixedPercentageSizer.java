package com.tradezzz.risk.sizing;

import com.tradezzz.domain.enums.PositionSizingMethod;

/** Risks {@code riskPercentage} of the balance. */
public class FixedPercentageSizer implements PositionSizer {

    @Override
    public PositionSizingMethod getMethod() {
        return PositionSizingMethod.FIXED_PERCENTAGE;
    }

    @Override
    public PositionSizeResult size(PositionSizingContext context) {
        double risk = context.getAccountBalance() * context.getRiskPercentage();
        return PositionSizeResult.of(getMethod(), risk, context.getAccountBalance());
    }
}
