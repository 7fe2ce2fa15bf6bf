package com.tradezzz.resilience;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable thresholds for one breaker. Timeouts are in milliseconds; a timeout of zero disables
 * the per-call timeout race.
 */
@Value
@Builder(toBuilder = true)
public class CircuitBreakerSettings {

    String name;

    @Builder.Default
    int failureThreshold = 5;

    @Builder.Default
    int successThreshold = 2;

    @Builder.Default
    long timeout = 10_000;

    @Builder.Default
    long resetTimeout = 60_000;
}
