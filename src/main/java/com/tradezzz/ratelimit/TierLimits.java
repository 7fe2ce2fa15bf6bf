package com.tradezzz.ratelimit;

import com.tradezzz.domain.enums.RateLimitCategory;
import com.tradezzz.domain.enums.SubscriptionTier;
import lombok.Builder;
import lombok.Value;

/**
 * Fixed ceilings per subscription tier. {@link #UNLIMITED} (-1) disables a ceiling.
 */
@Value
@Builder
public class TierLimits {

    public static final int UNLIMITED = -1;

    SubscriptionTier tier;
    int backtestsPerDay;
    int concurrentStrategies;
    int ordersPerMinute;
    boolean liveTrading;
    int apiRequestsPerMinute;
    boolean priorityExecution;
    boolean dedicatedSupport;

    public static TierLimits forTier(SubscriptionTier tier) {
        return switch (tier) {
            case FREE -> TierLimits.builder()
                    .tier(tier)
                    .backtestsPerDay(5)
                    .concurrentStrategies(1)
                    .ordersPerMinute(10)
                    .liveTrading(false)
                    .apiRequestsPerMinute(60)
                    .build();
            case PRO -> TierLimits.builder()
                    .tier(tier)
                    .backtestsPerDay(50)
                    .concurrentStrategies(5)
                    .ordersPerMinute(60)
                    .liveTrading(true)
                    .apiRequestsPerMinute(300)
                    .build();
            case ELITE -> TierLimits.builder()
                    .tier(tier)
                    .backtestsPerDay(UNLIMITED)
                    .concurrentStrategies(20)
                    .ordersPerMinute(300)
                    .liveTrading(true)
                    .apiRequestsPerMinute(1000)
                    .priorityExecution(true)
                    .build();
            case INSTITUTIONAL -> TierLimits.builder()
                    .tier(tier)
                    .backtestsPerDay(UNLIMITED)
                    .concurrentStrategies(UNLIMITED)
                    .ordersPerMinute(UNLIMITED)
                    .liveTrading(true)
                    .apiRequestsPerMinute(UNLIMITED)
                    .priorityExecution(true)
                    .dedicatedSupport(true)
                    .build();
        };
    }

    /** Ceiling applied to one category's fixed window. */
    public int limitFor(RateLimitCategory category) {
        return switch (category) {
            case API -> apiRequestsPerMinute;
            case ORDERS -> ordersPerMinute;
            case BACKTESTS -> backtestsPerDay;
        };
    }

    public static long windowSecondsFor(RateLimitCategory category) {
        return category == RateLimitCategory.BACKTESTS ? 86_400 : 60;
    }

    public static boolean isUnlimited(int limit) {
        return limit == UNLIMITED;
    }
}
