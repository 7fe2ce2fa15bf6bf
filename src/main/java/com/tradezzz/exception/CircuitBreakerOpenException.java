package com.tradezzz.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class CircuitBreakerOpenException extends BaseException {

    private final String breakerName;

    public CircuitBreakerOpenException(String breakerName) {
        super(
                ErrorCode.CIRCUIT_OPEN,
                "Circuit breaker is open for " + breakerName,
                Map.of("breaker", breakerName));
        this.breakerName = breakerName;
    }
}
