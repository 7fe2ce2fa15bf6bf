package com.tradezzz.ratelimit;

import com.tradezzz.domain.enums.SubscriptionTier;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Process-local tier assignments. Users without an assignment are on FREE.
 */
@Component
public class InMemoryTierLookup implements TierLookup {

    private final Map<String, SubscriptionTier> tiers = new ConcurrentHashMap<>();

    @Override
    public SubscriptionTier getTier(String userId) {
        return tiers.getOrDefault(userId, SubscriptionTier.FREE);
    }

    public void setTier(String userId, SubscriptionTier tier) {
        tiers.put(userId, tier);
    }
}
