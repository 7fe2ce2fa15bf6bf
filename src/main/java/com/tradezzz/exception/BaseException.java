package com.tradezzz.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Root of the tradezzz failure taxonomy.
 *
 * <p>Every failure that reaches a caller carries an {@link ErrorCode}, which fixes both the
 * machine-readable code and the HTTP status {@link GlobalExceptionHandler} answers with, plus an
 * optional details map rendered verbatim into the error body. Subclasses by area:
 * <ul>
 *   <li>trading: {@link InsufficientBalanceException}, {@link RiskRejectedException},
 *       {@link ResourceNotFoundException}</li>
 *   <li>sessions: {@link NoSessionException}, {@link ModeSwitchException}</li>
 *   <li>venues: {@link ExchangeException}, {@link ExchangeConnectionException}</li>
 *   <li>protection: {@link RateLimitExceededException}, {@link CircuitBreakerOpenException},
 *       {@link CircuitBreakerTimeoutException}</li>
 * </ul>
 *
 * <p>Details never contain exchange credentials.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;

    /** Read-only copy of what the subclass supplied. */
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of());
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = copyOf(details);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    public int getHttpStatus() {
        return errorCode.getHttpStatus();
    }

    private static Map<String, Object> copyOf(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
