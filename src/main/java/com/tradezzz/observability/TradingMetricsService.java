package com.tradezzz.observability;

import com.tradezzz.event.CircuitBreakerStateChangedEvent;
import com.tradezzz.event.OrderEvent;
import com.tradezzz.event.RateLimitExceededEvent;
import com.tradezzz.event.TradingModeChangedEvent;
import com.tradezzz.session.TradingSessionController;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer meters for the trading core.
 *
 * <ul>
 *   <li><b>orders.placed</b>, <b>orders.filled</b>, <b>orders.rejected</b>, <b>orders.cancelled</b> (counters, tagged by mode)</li>
 *   <li><b>ratelimit.rejections</b> (counter, tagged by category)</li>
 *   <li><b>circuitbreaker.transitions</b> (counter, tagged by breaker and target state)</li>
 *   <li><b>trading.mode.switches</b> (counter, tagged by new mode)</li>
 *   <li><b>trading.sessions.active</b>, <b>trading.sessions.live</b> (gauges)</li>
 * </ul>
 *
 * <p>Venue call latency and venue errors are recorded where the calls happen, in
 * {@link com.tradezzz.exchange.ResilientExchangeGateway}.
 */
@Service
public class TradingMetricsService {

    private static final Logger log = LoggerFactory.getLogger(TradingMetricsService.class);

    private final MeterRegistry meterRegistry;

    public TradingMetricsService(MeterRegistry meterRegistry, TradingSessionController sessionController) {
        this.meterRegistry = meterRegistry;

        // Gauges (lazily evaluated by Micrometer during scrape)
        meterRegistry.gauge("trading.sessions.active", sessionController,
                TradingSessionController::getActiveSessionCount);
        meterRegistry.gauge("trading.sessions.live", sessionController,
                TradingSessionController::getLiveSessionCount);
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        String name = switch (event.getEventType()) {
            case PLACED -> "orders.placed";
            case FILLED -> "orders.filled";
            case REJECTED -> "orders.rejected";
            case CANCELLED -> "orders.cancelled";
        };
        counter(name, "mode", event.getMode() == null ? "unknown" : event.getMode().name().toLowerCase())
                .increment();
    }

    @EventListener
    @Order(20)
    public void onRateLimitExceeded(RateLimitExceededEvent event) {
        counter("ratelimit.rejections", "category", event.getCategory()).increment();
    }

    @EventListener
    @Order(20)
    public void onCircuitBreakerTransition(CircuitBreakerStateChangedEvent event) {
        Counter.builder("circuitbreaker.transitions")
                .description("Circuit breaker state changes")
                .tag("breaker", event.getBreakerName())
                .tag("to", event.getToState().name())
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onModeChanged(TradingModeChangedEvent event) {
        counter("trading.mode.switches", "mode", event.getNewMode().name().toLowerCase()).increment();
        log.debug("Recorded mode switch for user {} to {}", event.getUserId(), event.getNewMode());
    }

    private Counter counter(String name, String tagKey, String tagValue) {
        return Counter.builder(name).tag(tagKey, tagValue).register(meterRegistry);
    }
}
