package com.tradezzz.domain.enums;

/**
 * Order lifecycle states.
 *
 * <pre>
 *   PENDING --> OPEN --> FILLED
 *      |          |
 *      |          +--> CANCELLED
 *      +--> REJECTED
 * </pre>
 *
 * <p>FILLED, CANCELLED and REJECTED are terminal. Only PENDING and OPEN orders can be cancelled.
 */
public enum OrderStatus {
    PENDING,
    OPEN,
    FILLED,
    PARTIALLY_FILLED,
    CANCELLED,
    REJECTED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }

    public boolean isCancellable() {
        return this == PENDING || this == OPEN;
    }
}
