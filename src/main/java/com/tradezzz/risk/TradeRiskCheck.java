package com.tradezzz.risk;

import java.util.List;
import lombok.Value;

/**
 * Verdict of the pre-trade gate. A rejection is a normal outcome, not an error.
 *
 * <p>{@code adjustedSize} is set only when the position-size limit clamped the requested size.
 */
@Value
public class TradeRiskCheck {

    boolean allowed;
    String reason;
    List<String> warnings;
    Double adjustedSize;

    public static TradeRiskCheck allowed(List<String> warnings, Double adjustedSize) {
        return new TradeRiskCheck(true, null, List.copyOf(warnings), adjustedSize);
    }

    public static TradeRiskCheck rejected(String reason, List<String> warnings) {
        return new TradeRiskCheck(false, reason, List.copyOf(warnings), null);
    }
}
