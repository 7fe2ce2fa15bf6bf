package com.tradezzz.api.dto.request;

import com.tradezzz.domain.enums.PositionSide;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A proposed or opened trade as seen by the risk engine. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskTradeRequest {

    @NotBlank
    private String symbol;

    @NotNull
    private PositionSide direction;

    @Positive
    private double size;

    @Positive
    private double entryPrice;

    @Positive
    private Double stopLoss;

    @Positive
    private Double takeProfit;
}
