package com.tradezzz.exception;

import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Raised at the API boundary when the risk engine refuses a trade.
 * The engine itself reports rejections as a structured result; this only
 * carries that result out of the order pipeline.
 */
@Getter
public class RiskRejectedException extends BaseException {

    private final List<String> warnings;

    public RiskRejectedException(String reason, List<String> warnings) {
        super(ErrorCode.RISK_REJECTED, reason, Map.of("reason", reason, "warnings", List.copyOf(warnings)));
        this.warnings = List.copyOf(warnings);
    }
}
