package com.tradezzz.config;

import com.tradezzz.resilience.CircuitBreakerSettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Default thresholds for breakers created by {@link com.tradezzz.resilience.CircuitBreakerRegistry}.
 * Binds to {@code tradezzz.circuit-breaker.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "tradezzz.circuit-breaker")
@Getter
@Setter
public class CircuitBreakerProperties {

    /** Consecutive failures that open a closed circuit. */
    private int failureThreshold = 5;

    /** Successes in HALF_OPEN required to close the circuit. */
    private int successThreshold = 2;

    /** Per-call timeout in milliseconds. */
    private long timeout = 10_000;

    /** Time in milliseconds an open circuit waits before allowing a trial call. */
    private long resetTimeout = 60_000;

    public CircuitBreakerSettings toSettings(String name) {
        return CircuitBreakerSettings.builder()
                .name(name)
                .failureThreshold(failureThreshold)
                .successThreshold(successThreshold)
                .timeout(timeout)
                .resetTimeout(resetTimeout)
                .build();
    }
}
