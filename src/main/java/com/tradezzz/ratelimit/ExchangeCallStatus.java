package com.tradezzz.ratelimit;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExchangeCallStatus {

    String exchange;
    int used;
    int limit;
    int remaining;

    /** Rounded percentage of the per-minute budget consumed. */
    int percentUsed;

    /** True once usage reaches 80% of the budget. */
    boolean warning;

    long resetIn;
}
