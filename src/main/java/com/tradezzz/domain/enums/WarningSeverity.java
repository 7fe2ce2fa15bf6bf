package com.tradezzz.domain.enums;

public enum WarningSeverity {
    INFO,
    WARNING,
    CRITICAL
}
