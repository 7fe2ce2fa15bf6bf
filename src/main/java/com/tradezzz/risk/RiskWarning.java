package com.tradezzz.risk;

import com.tradezzz.domain.enums.WarningSeverity;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RiskWarning {

    RiskWarningType type;
    WarningSeverity severity;
    String message;
    Instant timestamp;
}
