package com.tradezzz.exception;

/**
 * Opaque venue failure carrying the venue's raw message. Never retried by the core.
 */
public class ExchangeException extends BaseException {

    public ExchangeException(String message) {
        super(ErrorCode.EXCHANGE_ERROR, message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(ErrorCode.EXCHANGE_ERROR, message, cause);
    }
}
