package com.tradezzz.resilience;

import com.tradezzz.exception.CircuitBreakerOpenException;
import com.tradezzz.exception.CircuitBreakerTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Three-state circuit breaker guarding one named external dependency.
 *
 * <p>All state (state, counters, timestamps) is guarded by the breaker's monitor, so concurrent
 * callers see atomic transitions. The guarded call itself runs outside the monitor.
 *
 * <p>Every guarded call races against {@link CircuitBreakerSettings#getTimeout()}: it is submitted
 * to the shared executor and awaited with {@code get(timeout)}. On timeout the future is cancelled,
 * the call is counted as a failure and any late result is discarded.
 *
 * <p>The OPEN to HALF_OPEN transition is lazy: it is evaluated at the start of the next call once
 * {@code resetTimeout} has elapsed since the circuit opened. No timer thread is involved.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final Executor executor;
    private final CircuitBreakerListener listener;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int halfOpenSuccessCount;
    private long successCount;
    private long totalFailures;
    private long totalRequests;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;
    private Instant openedAt;

    public CircuitBreaker(
            CircuitBreakerSettings settings, Clock clock, Executor executor, CircuitBreakerListener listener) {
        this.settings = settings;
        this.clock = clock;
        this.executor = executor;
        this.listener = listener != null ? listener : CircuitBreakerListener.NO_OP;
    }

    public String getName() {
        return settings.getName();
    }

    public CircuitBreakerSettings getSettings() {
        return settings;
    }

    /**
     * Runs the operation through the breaker.
     *
     * @throws CircuitBreakerOpenException if the circuit is open (the operation is not invoked)
     * @throws CircuitBreakerTimeoutException if the operation exceeds the configured timeout
     */
    public <T> T execute(Supplier<T> operation) {
        acquirePermission();

        T result;
        try {
            result = executeWithTimeout(operation);
        } catch (RuntimeException | Error e) {
            onFailure(e);
            throw e;
        }
        onSuccess();
        return result;
    }

    /**
     * Runs the operation, returning the fallback's value when the circuit is open or the call fails.
     */
    public <T> T executeWithFallback(Supplier<T> operation, Supplier<T> fallback) {
        try {
            return execute(operation);
        } catch (RuntimeException e) {
            log.warn("Circuit breaker {} using fallback: {}", getName(), e.getMessage());
            return fallback.get();
        }
    }

    public synchronized CircuitState getState() {
        checkStateTransition();
        return state;
    }

    public synchronized CircuitBreakerStats getStats() {
        checkStateTransition();
        return CircuitBreakerStats.builder()
                .name(getName())
                .state(state)
                .failureCount(failureCount)
                .successCount(successCount)
                .totalRequests(totalRequests)
                .failureRate(totalRequests > 0 ? (double) totalFailures / totalRequests : 0)
                .lastFailureTime(lastFailureTime)
                .lastSuccessTime(lastSuccessTime)
                .openedAt(openedAt)
                .build();
    }

    /** Forces the circuit back to CLOSED and clears all counters. */
    public synchronized void reset() {
        CircuitState previous = state;
        state = CircuitState.CLOSED;
        failureCount = 0;
        halfOpenSuccessCount = 0;
        successCount = 0;
        totalFailures = 0;
        totalRequests = 0;
        lastFailureTime = null;
        lastSuccessTime = null;
        openedAt = null;
        log.info("Circuit breaker {} reset", getName());
        if (previous != CircuitState.CLOSED) {
            listener.onStateChange(getName(), previous, CircuitState.CLOSED);
        }
    }

    /** Manually trips the circuit, e.g. for maintenance windows on the venue side. */
    public synchronized void open() {
        transitionTo(CircuitState.OPEN);
    }

    // ---- Internal state machine ----

    private synchronized void acquirePermission() {
        checkStateTransition();
        if (state == CircuitState.OPEN) {
            throw new CircuitBreakerOpenException(getName());
        }
        totalRequests++;
    }

    private <T> T executeWithTimeout(Supplier<T> operation) {
        if (settings.getTimeout() <= 0) {
            return operation.get();
        }

        CompletableFuture<T> future = CompletableFuture.supplyAsync(operation, executor);
        try {
            return future.get(settings.getTimeout(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CircuitBreakerTimeoutException(settings.getTimeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while calling " + getName(), e);
        }
    }

    private synchronized void onSuccess() {
        successCount++;
        failureCount = 0;
        lastSuccessTime = clock.instant();

        if (state == CircuitState.HALF_OPEN) {
            halfOpenSuccessCount++;
            if (halfOpenSuccessCount >= settings.getSuccessThreshold()) {
                transitionTo(CircuitState.CLOSED);
            }
        }
    }

    private synchronized void onFailure(Throwable error) {
        failureCount++;
        totalFailures++;
        lastFailureTime = clock.instant();
        log.debug("Circuit breaker {} recorded failure {}: {}", getName(), failureCount, error.getMessage());

        if (state == CircuitState.HALF_OPEN) {
            transitionTo(CircuitState.OPEN);
        } else if (state == CircuitState.CLOSED && failureCount >= settings.getFailureThreshold()) {
            transitionTo(CircuitState.OPEN);
        }
    }

    private void checkStateTransition() {
        if (state == CircuitState.OPEN && openedAt != null) {
            long elapsed = Duration.between(openedAt, clock.instant()).toMillis();
            if (elapsed >= settings.getResetTimeout()) {
                transitionTo(CircuitState.HALF_OPEN);
            }
        }
    }

    private void transitionTo(CircuitState newState) {
        CircuitState oldState = state;
        if (oldState == newState) {
            return;
        }
        state = newState;

        switch (newState) {
            case OPEN -> {
                openedAt = clock.instant();
                halfOpenSuccessCount = 0;
            }
            case HALF_OPEN -> halfOpenSuccessCount = 0;
            case CLOSED -> {
                failureCount = 0;
                halfOpenSuccessCount = 0;
                openedAt = null;
            }
        }

        if (newState == CircuitState.OPEN) {
            log.warn("Circuit breaker {} {} -> {} (failures={})", getName(), oldState, newState, failureCount);
        } else {
            log.info("Circuit breaker {} {} -> {}", getName(), oldState, newState);
        }
        listener.onStateChange(getName(), oldState, newState);
    }
}
