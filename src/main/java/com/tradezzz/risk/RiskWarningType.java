package com.tradezzz.risk;

public enum RiskWarningType {
    TRADE_REJECTED,
    TRADE_WARNING,
    DAILY_LOSS,
    DRAWDOWN
}
