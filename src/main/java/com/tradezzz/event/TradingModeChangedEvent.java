package com.tradezzz.event;

import com.tradezzz.domain.enums.TradingMode;
import org.springframework.context.ApplicationEvent;

/**
 * Published on connect (previousMode null), mode switch and disconnect (newMode null).
 */
public class TradingModeChangedEvent extends ApplicationEvent {

    private final String userId;
    private final TradingMode previousMode;
    private final TradingMode newMode;

    public TradingModeChangedEvent(Object source, String userId, TradingMode previousMode, TradingMode newMode) {
        super(source);
        this.userId = userId;
        this.previousMode = previousMode;
        this.newMode = newMode;
    }

    public String getUserId() {
        return userId;
    }

    public TradingMode getPreviousMode() {
        return previousMode;
    }

    public TradingMode getNewMode() {
        return newMode;
    }
}
