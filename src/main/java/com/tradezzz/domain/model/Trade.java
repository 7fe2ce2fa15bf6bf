package com.tradezzz.domain.model;

import com.tradezzz.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable fill record. One trade per matched quantity of an order.
 */
@Value
@Builder
@AllArgsConstructor
public class Trade {

    String id;
    String orderId;
    String symbol;
    OrderSide side;
    BigDecimal quantity;
    BigDecimal price;
    BigDecimal fee;
    String feeCurrency;
    Instant timestamp;
}
