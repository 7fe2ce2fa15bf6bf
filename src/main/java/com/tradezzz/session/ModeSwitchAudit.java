package com.tradezzz.session;

import com.tradezzz.domain.enums.TradingMode;
import java.time.Instant;

/** One successful trading-mode switch. */
public record ModeSwitchAudit(
        String userId, String action, TradingMode previousMode, TradingMode newMode, Instant timestamp) {}
