package com.tradezzz.exception;

/**
 * Bad credentials, unknown connection or unsupported venue. Not retryable without new credentials.
 */
public class ExchangeConnectionException extends BaseException {

    public ExchangeConnectionException(String message) {
        super(ErrorCode.CONNECTION_ERROR, message);
    }

    public ExchangeConnectionException(String message, Throwable cause) {
        super(ErrorCode.CONNECTION_ERROR, message, cause);
    }
}
