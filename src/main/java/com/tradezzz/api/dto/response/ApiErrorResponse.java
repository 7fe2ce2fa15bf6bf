package com.tradezzz.api.dto.response;

import com.tradezzz.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;

/**
 * Error envelope. {@code error.message} is always the specific rejection reason
 * (balance shortfall, risk rule, retry window) rather than a generic failure text.
 */
public record ApiErrorResponse(boolean success, ErrorDetail error) {

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        ErrorDetail errorDetail = ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .path(path)
                .build();
        return new ApiErrorResponse(false, errorDetail);
    }

    @Builder
    public record ErrorDetail(String code, String message, Map<String, Object> details, Instant timestamp, String path) {}
}
