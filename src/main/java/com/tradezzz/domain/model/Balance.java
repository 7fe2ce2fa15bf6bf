package com.tradezzz.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-asset balance. Invariant: {@code available + locked == total}, both non-negative.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Balance {

    private String asset;
    private BigDecimal available;
    private BigDecimal locked;
    private BigDecimal total;

    public static Balance of(String asset, BigDecimal available, BigDecimal locked) {
        return new Balance(asset, available, locked, available.add(locked));
    }
}
