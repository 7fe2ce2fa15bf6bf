package com.tradezzz.resilience;

/**
 * Circuit breaker states.
 *
 * <pre>
 *   CLOSED --(failureThreshold consecutive failures)--> OPEN
 *   OPEN --(resetTimeout elapsed, evaluated on next call)--> HALF_OPEN
 *   HALF_OPEN --(successThreshold successes)--> CLOSED
 *   HALF_OPEN --(any failure)--> OPEN
 * </pre>
 */
public enum CircuitState {

    /** Calls pass through; consecutive failures are counted. */
    CLOSED,

    /** Calls fail immediately without reaching the dependency. */
    OPEN,

    /** Trial state: calls pass through and a single failure re-opens the circuit. */
    HALF_OPEN
}
