package com.tradezzz.risk;

import com.tradezzz.domain.enums.PositionSide;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** A risk position after close. {@code pnlPercent} is a fraction of the entry price. */
@Value
@Builder
public class ClosedTrade {

    String id;
    String symbol;
    PositionSide direction;
    double entryPrice;
    double exitPrice;
    double size;
    double pnl;
    double pnlPercent;
    Instant openedAt;
    Instant closedAt;
}
