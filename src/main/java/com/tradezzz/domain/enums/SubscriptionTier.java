package com.tradezzz.domain.enums;

public enum SubscriptionTier {
    FREE,
    PRO,
    ELITE,
    INSTITUTIONAL
}
