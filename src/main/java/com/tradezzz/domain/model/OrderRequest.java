package com.tradezzz.domain.model;

import com.tradezzz.domain.enums.OrderSide;
import com.tradezzz.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parameters for a new order, identical for live and paper gateways.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OrderRequest {

    /** Canonical BASE/QUOTE symbol. */
    private String symbol;

    private OrderSide side;
    private OrderType type;

    /** Base-asset quantity. */
    private BigDecimal quantity;

    /** Limit price. When null, market orders execute at the ticker price. */
    private BigDecimal price;

    /** Trigger price for STOP_LOSS and TAKE_PROFIT orders. */
    private BigDecimal stopPrice;

    /** Caller-supplied idempotency id; generated by the gateway when absent. */
    private String clientOrderId;
}
