package com.tradezzz.config;

import com.tradezzz.risk.RiskLimits;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Risk engine defaults. Binds to {@code tradezzz.risk.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "tradezzz.risk")
@Getter
@Setter
public class RiskProperties {

    /** Starting equity of every new per-user engine. */
    private double initialEquity = 100_000;

    private Limits limits = new Limits();

    /** Warnings kept per user before the oldest are dropped. */
    private int warningHistorySize = 100;

    @Getter
    @Setter
    public static class Limits {
        private double maxPositionSize = 0.1;
        private double maxDailyLoss = 0.05;
        private double maxDrawdown = 0.2;
        private int maxOpenPositions = 10;
        private int maxCorrelatedPositions = 3;
        private double minRiskRewardRatio = 1.5;

        public RiskLimits toRiskLimits() {
            return RiskLimits.builder()
                    .maxPositionSize(maxPositionSize)
                    .maxDailyLoss(maxDailyLoss)
                    .maxDrawdown(maxDrawdown)
                    .maxOpenPositions(maxOpenPositions)
                    .maxCorrelatedPositions(maxCorrelatedPositions)
                    .minRiskRewardRatio(minRiskRewardRatio)
                    .build();
        }
    }
}
