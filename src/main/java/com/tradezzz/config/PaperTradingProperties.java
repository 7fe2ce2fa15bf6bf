package com.tradezzz.config;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Paper trading account settings. Binds to {@code tradezzz.paper.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "tradezzz.paper")
@Getter
@Setter
public class PaperTradingProperties {

    /** Starting balance per quote asset, restored on every reset. */
    private Map<String, BigDecimal> seedBalances = defaultSeedBalances();

    /** Flat fee on the notional of every market fill, charged in the quote asset. */
    private BigDecimal feeRate = new BigDecimal("0.001");

    /** Positions whose quantity drops below this are removed. */
    private BigDecimal positionEpsilon = new BigDecimal("0.00001");

    private static Map<String, BigDecimal> defaultSeedBalances() {
        Map<String, BigDecimal> seed = new LinkedHashMap<>();
        seed.put("USD", new BigDecimal("100000"));
        seed.put("USDT", new BigDecimal("100000"));
        return seed;
    }
}
