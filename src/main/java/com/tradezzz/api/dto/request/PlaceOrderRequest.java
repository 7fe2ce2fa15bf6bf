package com.tradezzz.api.dto.request;

import com.tradezzz.domain.enums.OrderSide;
import com.tradezzz.domain.enums.OrderType;
import com.tradezzz.domain.model.OrderRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Order placement body. {@code stopLoss} and {@code takeProfit} feed the pre-trade risk check
 * and are not sent to the venue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderRequest {

    @NotBlank
    private String symbol;

    @NotNull
    private OrderSide side;

    @NotNull
    private OrderType type;

    @NotNull
    @Positive
    private BigDecimal quantity;

    @Positive
    private BigDecimal price;

    @Positive
    private BigDecimal stopPrice;

    private String clientOrderId;

    @Positive
    private BigDecimal stopLoss;

    @Positive
    private BigDecimal takeProfit;

    public OrderRequest toOrderRequest() {
        return OrderRequest.builder()
                .symbol(symbol)
                .side(side)
                .type(type)
                .quantity(quantity)
                .price(price)
                .stopPrice(stopPrice)
                .clientOrderId(clientOrderId)
                .build();
    }
}
