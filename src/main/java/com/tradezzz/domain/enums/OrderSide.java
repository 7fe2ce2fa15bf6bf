package com.tradezzz.domain.enums;

public enum OrderSide {
    BUY,
    SELL
}
