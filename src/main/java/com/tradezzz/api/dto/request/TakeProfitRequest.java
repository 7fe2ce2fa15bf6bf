package com.tradezzz.api.dto.request;

import com.tradezzz.domain.enums.PositionSide;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TakeProfitRequest {

    @Positive
    private double entryPrice;

    @Positive
    private double stopLoss;

    @NotNull
    private PositionSide direction;

    @Positive
    @Builder.Default
    private double riskRewardRatio = 2;
}
