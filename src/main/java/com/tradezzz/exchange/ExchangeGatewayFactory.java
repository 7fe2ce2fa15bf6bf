package com.tradezzz.exchange;

import com.tradezzz.config.ExchangeProperties;
import com.tradezzz.domain.enums.ExchangeId;
import com.tradezzz.domain.model.ExchangeCredentials;
import com.tradezzz.exception.ExchangeConnectionException;
import com.tradezzz.ratelimit.RateLimiter;
import com.tradezzz.resilience.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the live gateway for one user's exchange connection.
 *
 * <p>Every gateway returned here is a venue adapter wrapped in a {@link ResilientExchangeGateway},
 * so the venue's circuit breaker and the user's exchange-call budget apply to every call.
 */
@Component
public class ExchangeGatewayFactory {

    private static final Logger log = LoggerFactory.getLogger(ExchangeGatewayFactory.class);

    private final ExchangeProperties exchangeProperties;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RateLimiter rateLimiter;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ExchangeGatewayFactory(
            ExchangeProperties exchangeProperties,
            CircuitBreakerRegistry circuitBreakerRegistry,
            RateLimiter rateLimiter,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.exchangeProperties = exchangeProperties;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.rateLimiter = rateLimiter;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Creates a guarded gateway for the venue. The gateway is not connected yet.
     *
     * @throws ExchangeConnectionException if the venue has no adapter
     */
    public ExchangeGateway create(String userId, ExchangeId exchangeId, ExchangeCredentials credentials) {
        ExchangeGateway venue = createVenueGateway(exchangeId, credentials);
        log.debug("Created {} gateway for user {} with {}", exchangeId.getCode(), userId, credentials);
        return new ResilientExchangeGateway(
                venue,
                userId,
                circuitBreakerRegistry.getOrCreate("exchange:" + venue.getId()),
                rateLimiter,
                meterRegistry);
    }

    ExchangeGateway createVenueGateway(ExchangeId exchangeId, ExchangeCredentials credentials) {
        return switch (exchangeId) {
            case BINANCE -> {
                ExchangeProperties.Venue binance = exchangeProperties.getBinance();
                yield new BinanceExchangeGateway(
                        credentials,
                        binance.restClientBuilder(credentials.isSandbox()).build(),
                        clock,
                        binance.getRecvWindow());
            }
            case COINBASE -> new CoinbaseExchangeGateway(
                    credentials,
                    exchangeProperties.getCoinbase().restClientBuilder(credentials.isSandbox()).build(),
                    clock);
            default -> throw new ExchangeConnectionException(
                    "Exchange " + exchangeId.getCode() + " not yet supported");
        };
    }
}
