package com.tradezzz.exchange;

import com.tradezzz.domain.model.Balance;
import com.tradezzz.domain.model.Order;
import com.tradezzz.domain.model.OrderBook;
import com.tradezzz.domain.model.OrderRequest;
import com.tradezzz.domain.model.Position;
import com.tradezzz.domain.model.Ticker;
import com.tradezzz.domain.model.Trade;
import java.util.List;
import java.util.Optional;

/**
 * Uniform market-data, account and order operations against one exchange account.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link BinanceExchangeGateway} and {@link CoinbaseExchangeGateway} call the venue's REST API</li>
 *   <li>{@link ResilientExchangeGateway} decorates a venue gateway with a circuit breaker and the
 *       per-user exchange-call budget</li>
 *   <li>{@link com.tradezzz.simulator.PaperExecutionEngine} wraps a venue gateway for prices and
 *       keeps balances, orders and positions locally</li>
 * </ul>
 *
 * <p>Symbols are always canonical {@code BASE/QUOTE} strings (e.g. "BTC/USDT"). Each venue maps them
 * to its native identifiers and back; the mapping is total and reversible for every pair returned by
 * {@link #getTradingPairs()}.
 *
 * <p>All operations are blocking network calls and may fail with
 * {@link com.tradezzz.exception.ExchangeException} carrying the venue's raw message.
 */
public interface ExchangeGateway {

    int DEFAULT_LIMIT = 50;

    /** Human-readable venue name, e.g. "Binance" or "Binance (Paper)". */
    String getName();

    /** Venue id, e.g. "binance" or "binance_paper". */
    String getId();

    // ---- Connection ----

    boolean isConnected();

    /**
     * Verifies credentials and marks the gateway connected.
     *
     * @throws com.tradezzz.exception.ExchangeException if the venue rejects the credentials
     */
    void connect();

    void disconnect();

    /**
     * Performs an authenticated round trip. This is the sole gate that keeps bad credentials
     * from ever reaching a trading session.
     *
     * @return true if the venue accepted the credentials
     */
    boolean testConnection();

    // ---- Market data ----

    Ticker getTicker(String symbol);

    /**
     * Tickers for the given symbols, or for the venue's default list when {@code symbols} is null or
     * empty. Symbols that fail are skipped.
     */
    List<Ticker> getTickers(List<String> symbols);

    OrderBook getOrderBook(String symbol, int limit);

    /** All tradable pairs in canonical form. */
    List<String> getTradingPairs();

    // ---- Account ----

    /** Balances with a non-zero total. */
    List<Balance> getBalances();

    Optional<Balance> getBalance(String asset);

    // ---- Trading ----

    Order createOrder(OrderRequest orderRequest);

    /**
     * Cancels an order.
     *
     * @param symbol canonical symbol; required by venues that key orders by symbol
     * @return false if the order was not cancellable
     */
    boolean cancelOrder(String orderId, String symbol);

    Optional<Order> getOrder(String orderId, String symbol);

    List<Order> getOpenOrders(String symbol);

    /** Most recent orders first, at most {@code limit}. {@code symbol} may be null for all symbols. */
    List<Order> getOrderHistory(String symbol, int limit);

    // ---- Portfolio ----

    List<Position> getPositions();

    /** Most recent fills first, at most {@code limit}. */
    List<Trade> getTrades(String symbol, int limit);
}
