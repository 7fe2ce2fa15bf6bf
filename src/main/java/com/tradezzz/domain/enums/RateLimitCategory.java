package com.tradezzz.domain.enums;

/**
 * Request categories with independent fixed-window budgets per user.
 */
public enum RateLimitCategory {

    /** Any REST call against the public API, one-minute window. */
    API,

    /** Order placement, one-minute window. */
    ORDERS,

    /** Backtest runs, one-day window. */
    BACKTESTS
}
