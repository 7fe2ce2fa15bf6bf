package com.tradezzz.api.dto.request;

import com.tradezzz.domain.enums.PositionSizingMethod;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionSizeRequest {

    @Builder.Default
    private PositionSizingMethod method = PositionSizingMethod.FIXED_PERCENTAGE;

    @Positive
    @DecimalMax("1.0")
    @Builder.Default
    private double riskPercentage = 0.02;

    /** FIXED_AMOUNT only. */
    @PositiveOrZero
    private Double fixedAmount;

    /** VOLATILITY_ADJUSTED only: current volatility (ATR or standard deviation). */
    @PositiveOrZero
    private Double volatility;

    /** VOLATILITY_ADJUSTED only. */
    @PositiveOrZero
    private Double avgVolatility;
}
