package com.tradezzz.risk;

import lombok.Builder;
import lombok.Value;

/**
 * Peak-to-trough statistics of an equity curve.
 *
 * <p>Percent fields are fractions (0.25 = 25%). {@code peakValue} and {@code troughValue} bracket
 * the deepest drawdown, not the current one.
 */
@Value
@Builder
public class DrawdownResult {

    double maxDrawdown;
    double maxDrawdownPercent;
    double currentDrawdown;
    double currentDrawdownPercent;
    double peakValue;
    double troughValue;

    public static DrawdownResult empty() {
        return DrawdownResult.builder().build();
    }
}
