package com.tradezzz.domain.enums;

public enum PositionSide {
    LONG,
    SHORT
}
