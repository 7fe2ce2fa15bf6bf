package com.tradezzz.ratelimit;

/**
 * Fixed-window counter for one (user, category) key. Immutable; replaced atomically on each hit.
 */
record RateLimitBucket(int count, long windowStart, int limit, long windowMs) {

    boolean isExpired(long now) {
        return now - windowStart >= windowMs;
    }

    RateLimitBucket increment() {
        return new RateLimitBucket(count + 1, windowStart, limit, windowMs);
    }

    long secondsUntilReset(long now) {
        long remainingMs = Math.max(0, windowStart + windowMs - now);
        return (remainingMs + 999) / 1000;
    }
}
