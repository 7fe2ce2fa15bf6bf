package com.tradezzz.unit.risk.sizing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.tradezzz.domain.enums.PositionSizingMethod;
import com.tradezzz.risk.sizing.PositionSizeResult;
import com.tradezzz.risk.sizing.PositionSizerFactory;
import com.tradezzz.risk.sizing.PositionSizingContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PositionSizerTest {

    private static final double EPS = 1e-9;

    private final PositionSizerFactory factory = new PositionSizerFactory();

    private PositionSizeResult size(PositionSizingMethod method, PositionSizingContext context) {
        return factory.getSizer(method).size(context);
    }

    @Test
    @DisplayName("Fixed percentage risks the given fraction of the balance")
    void fixedPercentage() {
        PositionSizeResult result = size(PositionSizingMethod.FIXED_PERCENTAGE,
                PositionSizingContext.builder().accountBalance(10_000).riskPercentage(0.02).build());

        assertThat(result.getMethod()).isEqualTo(PositionSizingMethod.FIXED_PERCENTAGE);
        assertThat(result.getRiskAmount()).isCloseTo(200, within(EPS));
        assertThat(result.getRiskPercentage()).isCloseTo(0.02, within(EPS));
    }

    @Test
    @DisplayName("Kelly uses half the full fraction")
    void kelly_half() {
        PositionSizeResult result = size(PositionSizingMethod.KELLY_CRITERION,
                PositionSizingContext.builder().accountBalance(10_000).winRate(0.6).avgWin(2).avgLoss(1).build());

        assertThat(result.getPositionSize()).isCloseTo(2_000, within(EPS));
        assertThat(result.getRiskPercentage()).isCloseTo(0.2, within(EPS));
    }

    @Test
    @DisplayName("Kelly is capped at a quarter of the balance")
    void kelly_capped() {
        PositionSizeResult result = size(PositionSizingMethod.KELLY_CRITERION,
                PositionSizingContext.builder().accountBalance(10_000).winRate(0.9).avgWin(3).avgLoss(1).build());

        assertThat(result.getPositionSize()).isCloseTo(2_500, within(EPS));
    }

    @Test
    @DisplayName("Fixed amount is capped at 10% of the balance")
    void fixedAmount_capped() {
        assertThat(size(PositionSizingMethod.FIXED_AMOUNT,
                PositionSizingContext.builder().accountBalance(10_000).fixedAmount(500).build())
                .getRiskAmount()).isCloseTo(500, within(EPS));
        assertThat(size(PositionSizingMethod.FIXED_AMOUNT,
                PositionSizingContext.builder().accountBalance(10_000).fixedAmount(5_000).build())
                .getRiskAmount()).isCloseTo(1_000, within(EPS));
    }

    @Test
    @DisplayName("Calm markets scale the position up to twice the base")
    void volatility_calmMarket() {
        PositionSizeResult result = size(PositionSizingMethod.VOLATILITY_ADJUSTED,
                PositionSizingContext.builder().accountBalance(10_000).riskPercentage(0.02)
                        .volatility(0.01).avgVolatility(0.04).build());

        assertThat(result.getRiskAmount()).isCloseTo(400, within(EPS));
    }

    @Test
    @DisplayName("Volatile markets scale the position down")
    void volatility_volatileMarket() {
        PositionSizeResult result = size(PositionSizingMethod.VOLATILITY_ADJUSTED,
                PositionSizingContext.builder().accountBalance(10_000).riskPercentage(0.02)
                        .volatility(0.04).avgVolatility(0.02).build());

        assertThat(result.getRiskAmount()).isCloseTo(100, within(EPS));
    }
}
