package com.tradezzz.api.dto.response;

import java.time.Instant;

/**
 * Success envelope applied to every controller body by {@link com.tradezzz.config.ApiResponseAdvice}.
 */
public record ApiResponse<T>(boolean success, T data, Instant timestamp) {

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
