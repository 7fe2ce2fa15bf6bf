package com.tradezzz.session;

import com.tradezzz.domain.enums.TradingMode;
import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of a user's trading context. {@code canTrade} is the single predicate callers check before
 * allowing any order.
 */
@Value
@Builder
public class TradingState {

    TradingMode mode;
    String exchangeId;
    String exchangeName;
    boolean connected;
    boolean canTrade;

    public static TradingState disconnected() {
        return TradingState.builder().mode(TradingMode.PAPER).connected(false).canTrade(false).build();
    }
}
