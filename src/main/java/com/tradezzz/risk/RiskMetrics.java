package com.tradezzz.risk;

import lombok.Builder;
import lombok.Value;

/**
 * Portfolio snapshot computed on demand from open positions, closed trades and the equity curve.
 */
@Value
@Builder
public class RiskMetrics {

    double totalEquity;
    double availableCapital;
    double usedMargin;
    double marginUsagePercent;
    double unrealizedPnl;
    double realizedPnl;
    double dailyPnl;
    double dailyPnlPercent;
    int openPositions;
    DrawdownResult drawdown;
    double var95;
    double cvar95;
    double sharpeRatio;
    double sortinoRatio;
    TradeStats tradeStats;
}
