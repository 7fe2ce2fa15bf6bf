package com.tradezzz.exception;

public class ModeSwitchException extends BaseException {

    public ModeSwitchException(String message) {
        super(ErrorCode.ACKNOWLEDGMENT_REQUIRED, message);
    }
}
