package com.tradezzz.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class RateLimitExceededException extends BaseException {

    /** Seconds until the current window resets. */
    private final long retryAfter;

    public RateLimitExceededException(String message, String category, int limit, long retryAfter) {
        super(
                ErrorCode.RATE_LIMITED,
                message,
                Map.of("category", category, "limit", limit, "retryAfter", retryAfter));
        this.retryAfter = retryAfter;
    }
}
