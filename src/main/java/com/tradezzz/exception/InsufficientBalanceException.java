package com.tradezzz.exception;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Getter;

@Getter
public class InsufficientBalanceException extends BaseException {

    private final String asset;
    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientBalanceException(String asset, BigDecimal required, BigDecimal available) {
        super(
                ErrorCode.INSUFFICIENT_BALANCE,
                String.format(
                        "Insufficient %s balance. Need %s, have %s",
                        asset, required.toPlainString(), available.toPlainString()),
                Map.of("asset", asset, "required", required, "available", available));
        this.asset = asset;
        this.required = required;
        this.available = available;
    }
}
