package com.tradezzz.exchange;

import com.tradezzz.domain.model.Balance;
import com.tradezzz.domain.model.Order;
import com.tradezzz.domain.model.OrderBook;
import com.tradezzz.domain.model.OrderRequest;
import com.tradezzz.domain.model.Position;
import com.tradezzz.domain.model.Ticker;
import com.tradezzz.domain.model.Trade;
import com.tradezzz.exception.RateLimitExceededException;
import com.tradezzz.ratelimit.RateLimitResult;
import com.tradezzz.ratelimit.RateLimiter;
import com.tradezzz.resilience.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorates a venue gateway so that every network call:
 * <ol>
 *   <li>is counted against the user's per-minute budget for the venue, failing with
 *       {@link RateLimitExceededException} once the budget is spent</li>
 *   <li>runs through the venue's circuit breaker, with its timeout</li>
 *   <li>is timed on {@code exchange.call.latency} and, on failure, counted on {@code exchange.errors},
 *       both tagged by venue and operation</li>
 * </ol>
 *
 * <p>Venue exceptions propagate unchanged. Name, id and connection flag are read straight from the
 * wrapped gateway and are not metered.
 */
public class ResilientExchangeGateway implements ExchangeGateway {

    private static final Logger log = LoggerFactory.getLogger(ResilientExchangeGateway.class);

    private final ExchangeGateway delegate;
    private final String userId;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final MeterRegistry meterRegistry;

    public ResilientExchangeGateway(
            ExchangeGateway delegate,
            String userId,
            CircuitBreaker circuitBreaker,
            RateLimiter rateLimiter,
            MeterRegistry meterRegistry) {
        this.delegate = delegate;
        this.userId = userId;
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
        this.meterRegistry = meterRegistry;
    }

    public ExchangeGateway getDelegate() {
        return delegate;
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public String getId() {
        return delegate.getId();
    }

    @Override
    public boolean isConnected() {
        return delegate.isConnected();
    }

    @Override
    public void connect() {
        guarded("connect", () -> {
            delegate.connect();
            return null;
        });
    }

    @Override
    public void disconnect() {
        delegate.disconnect();
    }

    @Override
    public boolean testConnection() {
        return guarded("testConnection", delegate::testConnection);
    }

    @Override
    public Ticker getTicker(String symbol) {
        return guarded("getTicker", () -> delegate.getTicker(symbol));
    }

    @Override
    public List<Ticker> getTickers(List<String> symbols) {
        return guarded("getTickers", () -> delegate.getTickers(symbols));
    }

    @Override
    public OrderBook getOrderBook(String symbol, int limit) {
        return guarded("getOrderBook", () -> delegate.getOrderBook(symbol, limit));
    }

    @Override
    public List<String> getTradingPairs() {
        return guarded("getTradingPairs", delegate::getTradingPairs);
    }

    @Override
    public List<Balance> getBalances() {
        return guarded("getBalances", delegate::getBalances);
    }

    @Override
    public Optional<Balance> getBalance(String asset) {
        return guarded("getBalance", () -> delegate.getBalance(asset));
    }

    @Override
    public Order createOrder(OrderRequest orderRequest) {
        return guarded("createOrder", () -> delegate.createOrder(orderRequest));
    }

    @Override
    public boolean cancelOrder(String orderId, String symbol) {
        return guarded("cancelOrder", () -> delegate.cancelOrder(orderId, symbol));
    }

    @Override
    public Optional<Order> getOrder(String orderId, String symbol) {
        return guarded("getOrder", () -> delegate.getOrder(orderId, symbol));
    }

    @Override
    public List<Order> getOpenOrders(String symbol) {
        return guarded("getOpenOrders", () -> delegate.getOpenOrders(symbol));
    }

    @Override
    public List<Order> getOrderHistory(String symbol, int limit) {
        return guarded("getOrderHistory", () -> delegate.getOrderHistory(symbol, limit));
    }

    @Override
    public List<Position> getPositions() {
        return guarded("getPositions", delegate::getPositions);
    }

    @Override
    public List<Trade> getTrades(String symbol, int limit) {
        return guarded("getTrades", () -> delegate.getTrades(symbol, limit));
    }

    private <T> T guarded(String operation, Supplier<T> call) {
        String exchange = delegate.getId();
        // Counting and admission are one atomic step per (user, venue) window
        RateLimitResult budget = rateLimiter.trackExchangeCall(userId, exchange);
        if (!budget.isAllowed()) {
            log.warn("Exchange budget exhausted: user={}, exchange={}, operation={}", userId, exchange, operation);
            throw new RateLimitExceededException(
                    "Exchange rate limit reached for " + exchange + ". Please wait before making more requests.",
                    "exchange:" + exchange,
                    budget.getLimit(),
                    budget.getRetryAfter());
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return circuitBreaker.execute(call);
        } catch (RuntimeException e) {
            Counter.builder("exchange.errors")
                    .description("Failed calls to exchange APIs")
                    .tag("exchange", exchange)
                    .tag("operation", operation)
                    .register(meterRegistry)
                    .increment();
            log.error("{} {} failed for user {}: {}", exchange, operation, userId, e.getMessage());
            throw e;
        } finally {
            sample.stop(Timer.builder("exchange.call.latency")
                    .description("Latency of exchange API calls")
                    .tag("exchange", exchange)
                    .tag("operation", operation)
                    .publishPercentiles(0.5, 0.95, 0.99)
                    .register(meterRegistry));
        }
    }
}
