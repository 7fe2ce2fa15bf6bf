package com.tradezzz.ratelimit;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a fixed-window check.
 *
 * <p>{@code reset} is the number of seconds until the current window ends. {@code retryAfter}
 * is only set on denial and equals {@code reset}. For unlimited categories {@code limit} and
 * {@code remaining} are -1.
 */
@Value
@Builder
public class RateLimitResult {

    boolean allowed;
    int limit;
    int remaining;
    long reset;
    Long retryAfter;

    static RateLimitResult unlimited() {
        return RateLimitResult.builder()
                .allowed(true)
                .limit(TierLimits.UNLIMITED)
                .remaining(TierLimits.UNLIMITED)
                .reset(0)
                .build();
    }
}
