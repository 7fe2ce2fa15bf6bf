package com.tradezzz.api.dto.request;

import com.tradezzz.risk.RiskLimits;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of the caller's risk limits. Null fields keep their current value. Percent limits
 * are fractions (0.1 = 10%).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateRiskLimitsRequest {

    @Positive
    @DecimalMax("1.0")
    private Double maxPositionSize;

    @Positive
    @DecimalMax("1.0")
    private Double maxDailyLoss;

    @Positive
    @DecimalMax("1.0")
    private Double maxDrawdown;

    @Positive
    private Integer maxOpenPositions;

    @Positive
    private Integer maxCorrelatedPositions;

    @Positive
    private Double minRiskRewardRatio;

    public RiskLimits applyTo(RiskLimits current) {
        RiskLimits.RiskLimitsBuilder builder = current.toBuilder();
        if (maxPositionSize != null) {
            builder.maxPositionSize(maxPositionSize);
        }
        if (maxDailyLoss != null) {
            builder.maxDailyLoss(maxDailyLoss);
        }
        if (maxDrawdown != null) {
            builder.maxDrawdown(maxDrawdown);
        }
        if (maxOpenPositions != null) {
            builder.maxOpenPositions(maxOpenPositions);
        }
        if (maxCorrelatedPositions != null) {
            builder.maxCorrelatedPositions(maxCorrelatedPositions);
        }
        if (minRiskRewardRatio != null) {
            builder.minRiskRewardRatio(minRiskRewardRatio);
        }
        return builder.build();
    }
}
