package com.tradezzz.event;

import com.tradezzz.domain.enums.TradingMode;
import com.tradezzz.domain.model.Order;
import com.tradezzz.resilience.CircuitState;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for all TradeZZZ events.
 *
 * <p>All listeners are synchronous {@code @EventListener}s; publication happens on the caller's thread.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Order ----

    public void publishOrderPlaced(Object source, String userId, Order order, TradingMode mode) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, userId, order, OrderEventType.PLACED, mode));
    }

    public void publishOrderRejected(Object source, String userId, Order order, TradingMode mode) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, userId, order, OrderEventType.REJECTED, mode));
    }

    public void publishOrderCancelled(Object source, String userId, Order order, TradingMode mode) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, userId, order, OrderEventType.CANCELLED, mode));
    }

    // ---- Session ----

    public void publishModeChanged(Object source, String userId, TradingMode previousMode, TradingMode newMode) {
        applicationEventPublisher.publishEvent(new TradingModeChangedEvent(source, userId, previousMode, newMode));
    }

    // ---- Resilience ----

    public void publishCircuitBreakerTransition(Object source, String name, CircuitState from, CircuitState to) {
        applicationEventPublisher.publishEvent(new CircuitBreakerStateChangedEvent(source, name, from, to));
    }

    public void publishRateLimitExceeded(Object source, String userId, String category) {
        applicationEventPublisher.publishEvent(new RateLimitExceededEvent(source, userId, category));
    }
}
