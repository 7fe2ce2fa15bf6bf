package com.tradezzz.resilience;

import com.tradezzz.config.CircuitBreakerProperties;
import com.tradezzz.event.EventPublisherHelper;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Indexes circuit breakers by dependency name so every exchange gets an independent breaker
 * (named {@code exchange:<id>}).
 *
 * <p>Breakers are created lazily with the configured defaults and live for the lifetime of the
 * application. State transitions are published as
 * {@link com.tradezzz.event.CircuitBreakerStateChangedEvent}.
 */
@Component
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    private final CircuitBreakerProperties circuitBreakerProperties;
    private final Clock clock;
    private final Executor executor;
    private final EventPublisherHelper eventPublisherHelper;

    public CircuitBreakerRegistry(
            CircuitBreakerProperties circuitBreakerProperties,
            Clock clock,
            @Qualifier("circuitBreakerExecutor") Executor executor,
            EventPublisherHelper eventPublisherHelper) {
        this.circuitBreakerProperties = circuitBreakerProperties;
        this.clock = clock;
        this.executor = executor;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /** Returns the breaker for {@code name}, creating it with the configured defaults. */
    public CircuitBreaker getOrCreate(String name) {
        return getOrCreate(name, circuitBreakerProperties.toSettings(name));
    }

    /**
     * Returns the breaker for {@code name}, creating it with the given settings. Settings are ignored
     * when the breaker already exists.
     */
    public CircuitBreaker getOrCreate(String name, CircuitBreakerSettings settings) {
        return breakers.computeIfAbsent(name, key -> new CircuitBreaker(
                settings.toBuilder().name(key).build(),
                clock,
                executor,
                (breakerName, from, to) ->
                        eventPublisherHelper.publishCircuitBreakerTransition(this, breakerName, from, to)));
    }

    public Optional<CircuitBreaker> get(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public List<CircuitBreaker> getAll() {
        return List.copyOf(breakers.values());
    }

    public Map<String, CircuitBreakerStats> getAllStats() {
        Map<String, CircuitBreakerStats> stats = new LinkedHashMap<>();
        breakers.keySet().stream().sorted().forEach(name -> stats.put(name, breakers.get(name).getStats()));
        return stats;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }
}
