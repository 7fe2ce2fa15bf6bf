package com.tradezzz.ratelimit;

import com.tradezzz.domain.enums.RateLimitCategory;

public record CategoryStatus(RateLimitCategory category, int used, int limit, int remaining) {}
