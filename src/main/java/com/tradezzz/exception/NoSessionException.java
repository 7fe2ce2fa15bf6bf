package com.tradezzz.exception;

/**
 * Thrown when a trading operation is attempted before the user has connected an exchange.
 */
public class NoSessionException extends BaseException {

    public NoSessionException() {
        super(ErrorCode.NO_SESSION, "Connect an exchange first before trading");
    }
}
