package com.tradezzz.domain.enums;

/**
 * Determines how the risk engine sizes a new trade.
 *
 * <p>Each method maps to a {@link com.tradezzz.risk.sizing.PositionSizer} implementation
 * resolved by {@link com.tradezzz.risk.sizing.PositionSizerFactory}.
 */
public enum PositionSizingMethod {

    /** Risk a fixed fraction of equity per trade. */
    FIXED_PERCENTAGE,

    /** Half-Kelly fraction from historical win rate and win/loss ratio, capped at 25% of equity. */
    KELLY_CRITERION,

    /** A fixed currency amount, capped at 10% of equity. */
    FIXED_AMOUNT,

    /** Base risk fraction scaled by average over current volatility, capped at 2x. */
    VOLATILITY_ADJUSTED
}
