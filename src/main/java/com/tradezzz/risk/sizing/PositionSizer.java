package com.tradezzz.risk.sizing;

import com.tradezzz.domain.enums.PositionSizingMethod;

/**
 * Strategy for turning an account balance and trade history into a position size.
 */
public interface PositionSizer {

    PositionSizingMethod getMethod();

    PositionSizeResult size(PositionSizingContext context);
}
