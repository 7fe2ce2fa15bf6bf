package com.tradezzz.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    CONNECTION_ERROR("CONNECTION_ERROR", 400),
    ACKNOWLEDGMENT_REQUIRED("ACKNOWLEDGMENT_REQUIRED", 400),
    NOT_FOUND("NOT_FOUND", 404),
    NO_SESSION("NO_SESSION", 409),
    INSUFFICIENT_BALANCE("INSUFFICIENT_BALANCE", 422),
    RISK_REJECTED("RISK_REJECTED", 422),
    RATE_LIMITED("RATE_LIMITED", 429),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    EXCHANGE_ERROR("EXCHANGE_ERROR", 502),
    CIRCUIT_OPEN("CIRCUIT_OPEN", 503),
    UPSTREAM_TIMEOUT("UPSTREAM_TIMEOUT", 504);

    private final String code;
    private final int httpStatus;
}
