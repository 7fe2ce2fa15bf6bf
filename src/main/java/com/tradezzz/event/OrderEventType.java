package com.tradezzz.event;

public enum OrderEventType {
    PLACED,
    FILLED,
    CANCELLED,
    REJECTED
}
