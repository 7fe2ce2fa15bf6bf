package com.tradezzz.exception;

public class CircuitBreakerTimeoutException extends BaseException {

    public CircuitBreakerTimeoutException(long timeoutMs) {
        super(ErrorCode.UPSTREAM_TIMEOUT, "Operation timeout after " + timeoutMs + "ms");
    }
}
