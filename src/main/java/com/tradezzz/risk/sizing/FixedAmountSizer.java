package com.tradezzz.risk.sizing;

import com.tradezzz.domain.enums.PositionSizingMethod;

/** A fixed amount, never more than 10% of the balance. */
public class FixedAmountSizer implements PositionSizer {

    static final double MAX_FRACTION = 0.1;

    @Override
    public PositionSizingMethod getMethod() {
        return PositionSizingMethod.FIXED_AMOUNT;
    }

    @Override
    public PositionSizeResult size(PositionSizingContext context) {
        double risk = Math.min(context.getFixedAmount(), context.getAccountBalance() * MAX_FRACTION);
        return PositionSizeResult.of(getMethod(), Math.max(0, risk), context.getAccountBalance());
    }
}
