package com.tradezzz.resilience;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CircuitBreakerStats {

    String name;
    CircuitState state;

    /** Consecutive failures since the last success or close. */
    int failureCount;

    long successCount;
    long totalRequests;

    /** Failed calls over all calls that reached the dependency or timed out. */
    double failureRate;

    Instant lastFailureTime;
    Instant lastSuccessTime;
    Instant openedAt;
}
