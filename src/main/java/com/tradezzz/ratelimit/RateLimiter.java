package com.tradezzz.ratelimit;

import com.tradezzz.domain.enums.ExchangeId;
import com.tradezzz.domain.enums.RateLimitCategory;
import com.tradezzz.domain.enums.SubscriptionTier;
import com.tradezzz.event.EventPublisherHelper;
import com.tradezzz.exception.RateLimitExceededException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fixed-window rate limiting per (user, category), per-venue exchange-call budgets and daily
 * usage counters.
 *
 * <p>Buckets are immutable and replaced through {@link ConcurrentHashMap#compute}, so the
 * check-and-increment for one key is atomic even when requests for the same user race.
 *
 * <p>Three independent mechanisms:
 * <ul>
 *   <li><b>Category windows</b>: {@link #checkLimit} with ceilings from the user's {@link TierLimits}</li>
 *   <li><b>Exchange-call budget</b>: one-minute windows keyed by {@code exchange:<code>}, sized from
 *       {@link ExchangeId#getRequestsPerMinute()}, with a warning at 80% usage</li>
 *   <li><b>Daily usage</b>: per-user counters keyed by calendar date (not a rolling window); a stored
 *       date different from today means the counters start over</li>
 * </ul>
 */
@Service
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private static final long EXCHANGE_WINDOW_SECONDS = 60;
    private static final int EXCHANGE_WARNING_PERCENT = 80;
    private static final int MINUTES_PER_DAY = 1440;

    private final Map<String, RateLimitBucket> buckets = new ConcurrentHashMap<>();
    private final Map<String, DailyUsage> dailyUsage = new ConcurrentHashMap<>();

    private final TierLookup tierLookup;
    private final Clock clock;
    private final EventPublisherHelper eventPublisherHelper;

    public RateLimiter(TierLookup tierLookup, Clock clock, EventPublisherHelper eventPublisherHelper) {
        this.tierLookup = tierLookup;
        this.clock = clock;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ========================
    // Fixed windows
    // ========================

    /**
     * Counts one request against the (user, category) window.
     *
     * <p>A fresh bucket is started when none exists or the previous window has elapsed. Under the
     * limit the count is incremented; at or over the limit the request is denied with
     * {@code retryAfter} set to the seconds left in the window. A negative limit means unlimited.
     */
    public RateLimitResult checkLimit(String userId, String category, int limit, long windowSeconds) {
        if (TierLimits.isUnlimited(limit)) {
            return RateLimitResult.unlimited();
        }

        long now = clock.millis();
        long windowMs = windowSeconds * 1000;
        RateLimitResult[] result = new RateLimitResult[1];

        buckets.compute(key(userId, category), (key, existing) -> {
            RateLimitBucket bucket = existing == null || existing.isExpired(now)
                    ? new RateLimitBucket(0, now, limit, windowMs)
                    : existing;
            long reset = bucket.secondsUntilReset(now);

            if (bucket.count() < limit) {
                RateLimitBucket incremented = bucket.increment();
                result[0] = RateLimitResult.builder()
                        .allowed(true)
                        .limit(limit)
                        .remaining(limit - incremented.count())
                        .reset(reset)
                        .build();
                return incremented;
            }

            result[0] = RateLimitResult.builder()
                    .allowed(false)
                    .limit(limit)
                    .remaining(0)
                    .reset(reset)
                    .retryAfter(reset)
                    .build();
            return bucket;
        });

        if (!result[0].isAllowed()) {
            log.debug("Rate limit hit: user={}, category={}, limit={}", userId, category, limit);
        }
        return result[0];
    }

    /** Counts one request in the category using the ceiling from the user's tier. */
    public RateLimitResult consume(String userId, RateLimitCategory category) {
        TierLimits limits = getLimitsForUser(userId);
        return checkLimit(
                userId, category.name().toLowerCase(), limits.limitFor(category), TierLimits.windowSecondsFor(category));
    }

    /**
     * Same as {@link #consume} but fails when the window is exhausted.
     *
     * @throws RateLimitExceededException with the seconds to wait before retrying
     */
    public RateLimitResult enforce(String userId, RateLimitCategory category) {
        RateLimitResult result = consume(userId, category);
        if (!result.isAllowed()) {
            String categoryName = category.name().toLowerCase();
            eventPublisherHelper.publishRateLimitExceeded(this, userId, categoryName);
            throw new RateLimitExceededException(
                    String.format(
                            "Rate limit exceeded for %s (%d per window). Retry after %ds",
                            categoryName, result.getLimit(), result.getRetryAfter()),
                    categoryName,
                    result.getLimit(),
                    result.getRetryAfter());
        }
        return result;
    }

    /** Per-category usage in the current windows for the user's tier. */
    public RateLimitStatus getStatus(String userId) {
        TierLimits limits = getLimitsForUser(userId);
        long now = clock.millis();

        List<CategoryStatus> categories = new ArrayList<>();
        for (RateLimitCategory category : RateLimitCategory.values()) {
            int limit = limits.limitFor(category);
            int used = currentCount(key(userId, category.name().toLowerCase()), now);
            int remaining = TierLimits.isUnlimited(limit) ? TierLimits.UNLIMITED : Math.max(0, limit - used);
            categories.add(new CategoryStatus(category, used, limit, remaining));
        }
        return new RateLimitStatus(userId, limits.getTier(), limits, categories);
    }

    public TierLimits getLimitsForTier(SubscriptionTier tier) {
        return TierLimits.forTier(tier);
    }

    public TierLimits getLimitsForUser(String userId) {
        return getLimitsForTier(tierLookup.getTier(userId));
    }

    // ========================
    // Exchange-call budget
    // ========================

    /** Counts one outbound call to the venue against the user's per-minute budget. */
    public RateLimitResult trackExchangeCall(String userId, String exchange) {
        return checkLimit(
                userId, exchangeCategory(exchange), ExchangeId.requestsPerMinuteFor(exchange), EXCHANGE_WINDOW_SECONDS);
    }

    /** Checks the budget without consuming it. */
    public ActionDecision canMakeExchangeCall(String userId, String exchange) {
        ExchangeCallStatus status = getExchangeStatus(userId, exchange);
        if (status.getRemaining() <= 0) {
            return ActionDecision.deny("Exchange rate limit reached for " + exchange
                    + ". Please wait before making more requests.");
        }
        return ActionDecision.allow();
    }

    public ExchangeCallStatus getExchangeStatus(String userId, String exchange) {
        long now = clock.millis();
        int limit = ExchangeId.requestsPerMinuteFor(exchange);
        RateLimitBucket bucket = buckets.get(key(userId, exchangeCategory(exchange)));
        boolean active = bucket != null && !bucket.isExpired(now);
        int used = active ? bucket.count() : 0;
        int percentUsed = (int) Math.round(used * 100.0 / limit);

        return ExchangeCallStatus.builder()
                .exchange(exchange)
                .used(used)
                .limit(limit)
                .remaining(Math.max(0, limit - used))
                .percentUsed(percentUsed)
                .warning(percentUsed >= EXCHANGE_WARNING_PERCENT)
                .resetIn(active ? bucket.secondsUntilReset(now) : 0)
                .build();
    }

    // ========================
    // Daily usage
    // ========================

    /** Increments today's counter for the action, starting over when the stored date is not today. */
    public int trackUsage(String userId, String action) {
        String today = today();
        int[] count = new int[1];
        dailyUsage.compute(userId, (key, usage) -> {
            DailyUsage current = usage == null || !usage.date().equals(today) ? new DailyUsage(today) : usage;
            count[0] = current.counts().merge(action, 1, Integer::sum);
            return current;
        });
        return count[0];
    }

    /** Today's counters per action; empty when nothing was tracked today. */
    public Map<String, Integer> getDailyUsage(String userId) {
        DailyUsage usage = dailyUsage.get(userId);
        if (usage == null || !usage.date().equals(today())) {
            return Map.of();
        }
        return Map.copyOf(usage.counts());
    }

    /**
     * Checks today's usage against the tier. "backtest" uses the daily backtest ceiling and "order"
     * the per-minute order ceiling spread over a full day. Other actions are not metered.
     */
    public ActionDecision canPerformAction(String userId, String action) {
        TierLimits limits = getLimitsForUser(userId);
        int dailyLimit;
        switch (action) {
            case "backtest" -> dailyLimit = limits.getBacktestsPerDay();
            case "order" -> dailyLimit = TierLimits.isUnlimited(limits.getOrdersPerMinute())
                    ? TierLimits.UNLIMITED
                    : limits.getOrdersPerMinute() * MINUTES_PER_DAY;
            default -> dailyLimit = TierLimits.UNLIMITED;
        }

        if (TierLimits.isUnlimited(dailyLimit)) {
            return ActionDecision.allow();
        }
        int used = getDailyUsage(userId).getOrDefault(action, 0);
        if (used >= dailyLimit) {
            return ActionDecision.deny("Daily limit reached for " + action + ". Upgrade your plan for higher limits.");
        }
        return ActionDecision.allow();
    }

    /** Clears every bucket and usage counter. */
    public void reset() {
        buckets.clear();
        dailyUsage.clear();
        log.info("Rate limiter state cleared");
    }

    // ---- helpers ----

    private int currentCount(String key, long now) {
        RateLimitBucket bucket = buckets.get(key);
        return bucket == null || bucket.isExpired(now) ? 0 : bucket.count();
    }

    private String today() {
        return LocalDate.now(clock).format(DateTimeFormatter.BASIC_ISO_DATE);
    }

    private static String exchangeCategory(String exchange) {
        return "exchange:" + exchange.toLowerCase();
    }

    private static String key(String userId, String category) {
        return userId + ":" + category;
    }

    private record DailyUsage(String date, Map<String, Integer> counts) {

        DailyUsage(String date) {
            this(date, new ConcurrentHashMap<>());
        }
    }
}
