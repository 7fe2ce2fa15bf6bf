package com.tradezzz.event;

import com.tradezzz.resilience.CircuitState;
import org.springframework.context.ApplicationEvent;

public class CircuitBreakerStateChangedEvent extends ApplicationEvent {

    private final String breakerName;
    private final CircuitState fromState;
    private final CircuitState toState;

    public CircuitBreakerStateChangedEvent(
            Object source, String breakerName, CircuitState fromState, CircuitState toState) {
        super(source);
        this.breakerName = breakerName;
        this.fromState = fromState;
        this.toState = toState;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public CircuitState getFromState() {
        return fromState;
    }

    public CircuitState getToState() {
        return toState;
    }
}
