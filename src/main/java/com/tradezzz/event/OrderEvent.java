package com.tradezzz.event;

import com.tradezzz.domain.enums.TradingMode;
import com.tradezzz.domain.model.Order;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the order pipeline whenever an order is placed, filled, cancelled or rejected.
 *
 * <p>Key listeners: {@link com.tradezzz.observability.TradingMetricsService} (order counters).
 */
public class OrderEvent extends ApplicationEvent {

    private final String userId;
    private final Order order;
    private final OrderEventType eventType;
    private final TradingMode mode;

    public OrderEvent(Object source, String userId, Order order, OrderEventType eventType, TradingMode mode) {
        super(source);
        this.userId = userId;
        this.order = order;
        this.eventType = eventType;
        this.mode = mode;
    }

    public String getUserId() {
        return userId;
    }

    /** Order snapshot at publication time. May be null for rejections that never produced an order. */
    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    public TradingMode getMode() {
        return mode;
    }
}
