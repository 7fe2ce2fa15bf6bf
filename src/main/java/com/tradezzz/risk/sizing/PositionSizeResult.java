package com.tradezzz.risk.sizing;

import com.tradezzz.domain.enums.PositionSizingMethod;
import lombok.Builder;
import lombok.Value;

/**
 * Capital to commit to a trade. {@code positionSize} and {@code riskAmount} are in account currency;
 * {@code riskPercentage} is the fraction of the balance they represent.
 */
@Value
@Builder
public class PositionSizeResult {

    PositionSizingMethod method;
    double positionSize;
    double riskAmount;
    double riskPercentage;
    double maxLoss;

    static PositionSizeResult of(PositionSizingMethod method, double riskAmount, double accountBalance) {
        return PositionSizeResult.builder()
                .method(method)
                .positionSize(riskAmount)
                .riskAmount(riskAmount)
                .riskPercentage(accountBalance > 0 ? riskAmount / accountBalance : 0)
                .maxLoss(riskAmount)
                .build();
    }
}
