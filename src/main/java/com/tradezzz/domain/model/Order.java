package com.tradezzz.domain.model;

import com.tradezzz.domain.enums.OrderSide;
import com.tradezzz.domain.enums.OrderStatus;
import com.tradezzz.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An order as reported by a gateway (live venue or paper engine).
 *
 * <p>Orders are mutated only by the engine that owns them and are never deleted:
 * each session keeps an append-only order history.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    private String id;

    /** Venue order id. For paper orders this is a synthetic "paper_" id. */
    private String exchangeOrderId;

    private String clientOrderId;
    private String symbol;
    private OrderSide side;
    private OrderType type;
    private OrderStatus status;
    private BigDecimal quantity;
    private BigDecimal filledQuantity;

    /** Requested limit price, or the execution price for market orders. */
    private BigDecimal price;

    /** Volume-weighted average fill price. */
    private BigDecimal averagePrice;

    private BigDecimal fee;
    private String feeCurrency;

    /** Populated when the order ends in REJECTED. */
    private String rejectReason;

    private Instant createdAt;
    private Instant updatedAt;
}
