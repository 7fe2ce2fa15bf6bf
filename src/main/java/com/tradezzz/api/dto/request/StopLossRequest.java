package com.tradezzz.api.dto.request;

import com.tradezzz.domain.enums.PositionSide;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Stop placement: ATR-based when {@code atr} is given, percentage-based otherwise. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StopLossRequest {

    @Positive
    private double entryPrice;

    @NotNull
    private PositionSide direction;

    @Positive
    @Builder.Default
    private double riskPercent = 0.02;

    @Positive
    private Double atr;
}
