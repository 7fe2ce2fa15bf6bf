package com.tradezzz.ratelimit;

import com.tradezzz.domain.enums.SubscriptionTier;
import java.util.List;

public record RateLimitStatus(String userId, SubscriptionTier tier, TierLimits limits, List<CategoryStatus> categories) {}
