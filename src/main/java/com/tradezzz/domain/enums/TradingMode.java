package com.tradezzz.domain.enums;

/**
 * Execution mode of a user's trading session.
 *
 * <p>Every session starts in PAPER. Switching to LIVE requires an explicit
 * acknowledgment that real money will be at risk.
 */
public enum TradingMode {

    /** Orders are filled by the in-memory paper engine against real market prices. */
    PAPER,

    /** Orders are routed to the connected exchange account. */
    LIVE
}
