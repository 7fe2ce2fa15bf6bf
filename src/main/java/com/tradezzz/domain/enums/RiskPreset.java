package com.tradezzz.domain.enums;

public enum RiskPreset {
    CONSERVATIVE,
    MODERATE,
    AGGRESSIVE
}
