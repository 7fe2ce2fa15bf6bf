package com.tradezzz.domain.enums;

/**
 * Order types accepted by every exchange gateway.
 *
 * <p>Venues that need both a trigger and a limit for STOP_LOSS / TAKE_PROFIT
 * (e.g. Binance STOP_LOSS_LIMIT) take the trigger from {@code stopPrice} and the
 * limit from {@code price}.
 */
public enum OrderType {

    /** Executes immediately at the best available price. */
    MARKET,

    /** Rests at the given limit price until matched or cancelled. */
    LIMIT,

    /** Becomes active once the stop price is crossed against the position. */
    STOP_LOSS,

    /** Becomes active once the stop price is crossed in favour of the position. */
    TAKE_PROFIT
}
