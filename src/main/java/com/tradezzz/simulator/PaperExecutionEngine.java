package com.tradezzz.simulator;

import com.tradezzz.config.PaperTradingProperties;
import com.tradezzz.domain.enums.OrderSide;
import com.tradezzz.domain.enums.OrderStatus;
import com.tradezzz.domain.enums.OrderType;
import com.tradezzz.domain.enums.PositionSide;
import com.tradezzz.domain.model.Balance;
import com.tradezzz.domain.model.Order;
import com.tradezzz.domain.model.OrderBook;
import com.tradezzz.domain.model.OrderRequest;
import com.tradezzz.domain.model.Position;
import com.tradezzz.domain.model.Ticker;
import com.tradezzz.domain.model.Trade;
import com.tradezzz.domain.model.TradingPair;
import com.tradezzz.exception.ExchangeException;
import com.tradezzz.exception.InsufficientBalanceException;
import com.tradezzz.exchange.ExchangeGateway;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paper trading on top of a live venue gateway.
 *
 * <p>Market data and trading pairs come from the wrapped gateway, so paper fills use the venue's
 * current prices. Balances, orders, trades and positions live only in memory.
 *
 * <p>Fill rules:
 * <ul>
 *   <li>The execution price is the request's price when given, else the current ticker price.</li>
 *   <li>MARKET BUY needs {@code quantity × price} of available quote; MARKET SELL needs
 *       {@code quantity} of available base. A buy debits exactly the notional and a sell credits
 *       the full proceeds.</li>
 *   <li>The fee, {@code feeRate × notional} in the quote asset, is recorded on the order and trade
 *       for reporting only and never moves a balance.</li>
 *   <li>A failed balance check records the order as REJECTED, leaves balances untouched and throws
 *       {@link InsufficientBalanceException}.</li>
 *   <li>LIMIT, STOP_LOSS and TAKE_PROFIT orders are stored OPEN and never filled by the engine.</li>
 * </ul>
 *
 * <p>All operations on the ledger run under one lock per engine, so two concurrent buys for the same
 * account cannot both pass the balance check.
 */
public class PaperExecutionEngine implements ExchangeGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperExecutionEngine.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ExchangeGateway gateway;
    private final Clock clock;
    private final BigDecimal feeRate;
    private final BigDecimal positionEpsilon;
    private final PaperLedger ledger;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Order> orders = new LinkedHashMap<>();
    private final List<Trade> trades = new ArrayList<>();
    private volatile boolean connected;

    public PaperExecutionEngine(ExchangeGateway gateway, PaperTradingProperties properties, Clock clock) {
        this.gateway = gateway;
        this.clock = clock;
        this.feeRate = properties.getFeeRate();
        this.positionEpsilon = properties.getPositionEpsilon();
        this.ledger = new PaperLedger(properties.getSeedBalances(), properties.getPositionEpsilon());
    }

    public ExchangeGateway getGateway() {
        return gateway;
    }

    @Override
    public String getName() {
        return gateway.getName() + " (Paper)";
    }

    @Override
    public String getId() {
        return gateway.getId() + "_paper";
    }

    // ---- Connection ----

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void connect() {
        if (!gateway.isConnected()) {
            gateway.connect();
        }
        connected = true;
    }

    @Override
    public void disconnect() {
        connected = false;
    }

    @Override
    public boolean testConnection() {
        return gateway.testConnection();
    }

    // ---- Market data ----

    @Override
    public Ticker getTicker(String symbol) {
        return gateway.getTicker(symbol);
    }

    @Override
    public List<Ticker> getTickers(List<String> symbols) {
        return gateway.getTickers(symbols);
    }

    @Override
    public OrderBook getOrderBook(String symbol, int limit) {
        return gateway.getOrderBook(symbol, limit);
    }

    @Override
    public List<String> getTradingPairs() {
        return gateway.getTradingPairs();
    }

    // ---- Account ----

    @Override
    public List<Balance> getBalances() {
        lock.lock();
        try {
            return ledger.nonZeroBalances();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Balance> getBalance(String asset) {
        lock.lock();
        try {
            return Optional.ofNullable(ledger.balance(asset.toUpperCase()));
        } finally {
            lock.unlock();
        }
    }

    /** Restores the seed balances and forgets every order, trade and position. */
    public void reset() {
        lock.lock();
        try {
            ledger.reset();
            orders.clear();
            trades.clear();
            log.info("Paper account on {} reset", getId());
        } finally {
            lock.unlock();
        }
    }

    // ---- Trading ----

    @Override
    public Order createOrder(OrderRequest request) {
        validate(request);
        TradingPair pair = TradingPair.parse(request.getSymbol());
        String symbol = pair.symbol();

        lock.lock();
        try {
            BigDecimal price = executionPrice(request, symbol);
            if (price == null || price.signum() <= 0) {
                throw new ExchangeException("No price available for " + symbol);
            }

            Instant now = clock.instant();
            Order order = Order.builder()
                    .id("PAPER-" + UUID.randomUUID().toString().substring(0, 8))
                    .exchangeOrderId("paper_" + now.toEpochMilli())
                    .clientOrderId(request.getClientOrderId() != null
                            ? request.getClientOrderId()
                            : UUID.randomUUID().toString())
                    .symbol(symbol)
                    .side(request.getSide())
                    .type(request.getType())
                    .status(OrderStatus.PENDING)
                    .quantity(request.getQuantity())
                    .filledQuantity(BigDecimal.ZERO)
                    .price(price)
                    .fee(BigDecimal.ZERO)
                    .feeCurrency(pair.quote())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            orders.put(order.getId(), order);

            if (request.getType() != OrderType.MARKET) {
                order.setStatus(OrderStatus.OPEN);
                log.debug("Paper {} order {} stored open: {} {} @ {}",
                        order.getType(), order.getId(), order.getSide(), order.getQuantity(), price);
                return copy(order);
            }

            fillMarketOrder(order, pair, price);
            return copy(order);
        } finally {
            lock.unlock();
        }
    }

    private BigDecimal executionPrice(OrderRequest request, String symbol) {
        if (request.getPrice() != null) {
            return request.getPrice();
        }
        if (request.getType() != OrderType.MARKET && request.getStopPrice() != null) {
            return request.getStopPrice();
        }
        return gateway.getTicker(symbol).getPrice();
    }

    private void fillMarketOrder(Order order, TradingPair pair, BigDecimal price) {
        BigDecimal quantity = order.getQuantity();
        BigDecimal notional = quantity.multiply(price);
        BigDecimal fee = notional.multiply(feeRate);

        if (order.getSide() == OrderSide.BUY) {
            BigDecimal available = ledger.available(pair.quote());
            if (available.compareTo(notional) < 0) {
                reject(order, pair.quote(), notional, available);
            }
        } else {
            BigDecimal available = ledger.available(pair.base());
            if (available.compareTo(quantity) < 0) {
                reject(order, pair.base(), quantity, available);
            }
        }

        ledger.applyFill(pair.symbol(), pair.base(), pair.quote(), order.getSide(), quantity, price);

        Instant now = clock.instant();
        order.setStatus(OrderStatus.FILLED);
        order.setFilledQuantity(quantity);
        order.setAveragePrice(price);
        order.setFee(fee);
        order.setUpdatedAt(now);

        trades.add(Trade.builder()
                .id("PTRADE-" + UUID.randomUUID().toString().substring(0, 8))
                .orderId(order.getId())
                .symbol(pair.symbol())
                .side(order.getSide())
                .quantity(quantity)
                .price(price)
                .fee(fee)
                .feeCurrency(pair.quote())
                .timestamp(now)
                .build());

        log.debug("Paper fill {}: {} {} {} @ {} fee={}",
                order.getId(), order.getSide(), quantity, pair.symbol(), price, fee);
    }

    private void reject(Order order, String asset, BigDecimal required, BigDecimal available) {
        InsufficientBalanceException exception = new InsufficientBalanceException(asset, required, available);
        order.setStatus(OrderStatus.REJECTED);
        order.setRejectReason(exception.getMessage());
        order.setUpdatedAt(clock.instant());
        log.warn("Paper order {} rejected: {}", order.getId(), exception.getMessage());
        throw exception;
    }

    @Override
    public boolean cancelOrder(String orderId, String symbol) {
        lock.lock();
        try {
            Order order = orders.get(orderId);
            if (order == null || !order.getStatus().isCancellable()) {
                return false;
            }
            order.setStatus(OrderStatus.CANCELLED);
            order.setUpdatedAt(clock.instant());
            log.debug("Paper order {} cancelled", orderId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Order> getOrder(String orderId, String symbol) {
        lock.lock();
        try {
            return Optional.ofNullable(orders.get(orderId)).map(PaperExecutionEngine::copy);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Order> getOpenOrders(String symbol) {
        lock.lock();
        try {
            return orders.values().stream()
                    .filter(order -> order.getStatus().isCancellable())
                    .filter(order -> symbol == null || order.getSymbol().equals(symbol))
                    .map(PaperExecutionEngine::copy)
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Order> getOrderHistory(String symbol, int limit) {
        lock.lock();
        try {
            List<Order> matching = orders.values().stream()
                    .filter(order -> symbol == null || order.getSymbol().equals(symbol))
                    .map(PaperExecutionEngine::copy)
                    .collect(Collectors.toList());
            return newestFirst(matching, limit);
        } finally {
            lock.unlock();
        }
    }

    // ---- Portfolio ----

    /**
     * Open positions marked to the current ticker price. Prices are fetched outside the lock from a
     * snapshot of the holdings.
     */
    @Override
    public List<Position> getPositions() {
        List<PaperLedger.Holding> holdings;
        lock.lock();
        try {
            holdings = ledger.holdings();
        } finally {
            lock.unlock();
        }

        List<Position> positions = new ArrayList<>();
        for (PaperLedger.Holding holding : holdings) {
            if (holding.quantity().compareTo(positionEpsilon) < 0) {
                continue;
            }
            BigDecimal currentPrice = gateway.getTicker(holding.symbol()).getPrice();
            BigDecimal entryPrice = holding.entryPrice();
            BigDecimal pnl = currentPrice.subtract(entryPrice).multiply(holding.quantity());
            BigDecimal pnlPercent = entryPrice.signum() > 0
                    ? currentPrice.subtract(entryPrice).multiply(HUNDRED).divide(entryPrice, 4, RoundingMode.HALF_UP)
                    : BigDecimal.ZERO;
            positions.add(Position.builder()
                    .symbol(holding.symbol())
                    .side(PositionSide.LONG)
                    .quantity(holding.quantity())
                    .entryPrice(entryPrice)
                    .currentPrice(currentPrice)
                    .unrealizedPnl(pnl)
                    .unrealizedPnlPercent(pnlPercent)
                    .build());
        }
        return positions;
    }

    @Override
    public List<Trade> getTrades(String symbol, int limit) {
        lock.lock();
        try {
            List<Trade> matching = trades.stream()
                    .filter(trade -> symbol == null || trade.getSymbol().equals(symbol))
                    .collect(Collectors.toList());
            return newestFirst(matching, limit);
        } finally {
            lock.unlock();
        }
    }

    // ---- helpers ----

    private static void validate(OrderRequest request) {
        if (request.getSide() == null || request.getType() == null) {
            throw new IllegalArgumentException("Order side and type are required");
        }
        if (request.getQuantity() == null || request.getQuantity().signum() <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive");
        }
        if (request.getType() != OrderType.MARKET && request.getPrice() == null && request.getStopPrice() == null) {
            throw new IllegalArgumentException(request.getType() + " orders require a price");
        }
        if (request.getPrice() != null && request.getPrice().signum() <= 0) {
            throw new IllegalArgumentException("Order price must be positive");
        }
    }

    private static <T> List<T> newestFirst(List<T> chronological, int limit) {
        List<T> reversed = new ArrayList<>(chronological);
        Collections.reverse(reversed);
        return new ArrayList<>(reversed.subList(0, Math.min(Math.max(limit, 0), reversed.size())));
    }

    private static Order copy(Order order) {
        return order.toBuilder().build();
    }
}
