package com.tradezzz.ratelimit;

import com.tradezzz.domain.enums.SubscriptionTier;

/**
 * Resolves a user's subscription tier. Implemented by the subscription/billing service;
 * {@link InMemoryTierLookup} is used when none is provided.
 */
public interface TierLookup {

    SubscriptionTier getTier(String userId);
}
