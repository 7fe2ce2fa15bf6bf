package com.tradezzz.resilience;

@FunctionalInterface
public interface CircuitBreakerListener {

    CircuitBreakerListener NO_OP = (name, from, to) -> {};

    void onStateChange(String name, CircuitState from, CircuitState to);
}
