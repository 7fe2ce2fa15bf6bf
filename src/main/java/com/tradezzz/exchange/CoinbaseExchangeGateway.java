package com.tradezzz.exchange;

import static com.tradezzz.exchange.VenueJson.decimal;
import static com.tradezzz.exchange.VenueJson.decimalAt;
import static com.tradezzz.exchange.VenueJson.decimalOrNull;
import static com.tradezzz.exchange.VenueJson.isoInstant;
import static com.tradezzz.exchange.VenueJson.text;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tradezzz.domain.enums.ExchangeId;
import com.tradezzz.domain.enums.OrderSide;
import com.tradezzz.domain.enums.OrderStatus;
import com.tradezzz.domain.enums.OrderType;
import com.tradezzz.domain.enums.PositionSide;
import com.tradezzz.domain.model.Balance;
import com.tradezzz.domain.model.ExchangeCredentials;
import com.tradezzz.domain.model.Order;
import com.tradezzz.domain.model.OrderBook;
import com.tradezzz.domain.model.OrderBookLevel;
import com.tradezzz.domain.model.OrderRequest;
import com.tradezzz.domain.model.Position;
import com.tradezzz.domain.model.Ticker;
import com.tradezzz.domain.model.Trade;
import com.tradezzz.domain.model.TradingPair;
import com.tradezzz.exception.ExchangeException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Coinbase Advanced Trade (brokerage API v3) adapter for one account.
 *
 * <p>Private requests carry {@code CB-ACCESS-KEY}, {@code CB-ACCESS-TIMESTAMP} (epoch seconds) and
 * {@code CB-ACCESS-SIGN}, the hex HMAC-SHA256 of {@code timestamp + method + requestPath + body}.
 * Canonical {@code BTC/USD} maps to the product id {@code BTC-USD} and back.
 */
public class CoinbaseExchangeGateway implements ExchangeGateway {

    private static final Logger log = LoggerFactory.getLogger(CoinbaseExchangeGateway.class);

    static final String API_PREFIX = "/api/v3/brokerage";

    private static final List<String> DEFAULT_SYMBOLS =
            List.of("BTC/USD", "ETH/USD", "SOL/USD", "XRP/USD", "ADA/USD", "DOGE/USD");

    private static final Set<String> CASH_ASSETS = Set.of("USD", "USDT");

    // Bid/ask are not part of the stats payload; quoted one basis point either side of last.
    private static final BigDecimal BID_FACTOR = new BigDecimal("0.9999");
    private static final BigDecimal ASK_FACTOR = new BigDecimal("1.0001");

    private final ExchangeCredentials credentials;
    private final RestClient restClient;
    private final Clock clock;

    private volatile List<String> cachedProducts;
    private volatile boolean connected;
    private volatile boolean verified;

    public CoinbaseExchangeGateway(ExchangeCredentials credentials, RestClient restClient, Clock clock) {
        this.credentials = credentials;
        this.restClient = restClient;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return ExchangeId.COINBASE.getDisplayName();
    }

    @Override
    public String getId() {
        return ExchangeId.COINBASE.getCode();
    }

    // ---- Connection ----

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void connect() {
        if (!verified && !testConnection()) {
            throw new ExchangeException("Coinbase rejected the API credentials");
        }
        connected = true;
        log.info("Connected to Coinbase, sandbox={}", credentials.isSandbox());
    }

    @Override
    public void disconnect() {
        connected = false;
        verified = false;
    }

    @Override
    public boolean testConnection() {
        try {
            request(HttpMethod.GET, "/accounts", null, false);
            verified = true;
            return true;
        } catch (ExchangeException e) {
            log.warn("Coinbase connection test failed: {}", e.getMessage());
            return false;
        }
    }

    // ---- Market data ----

    @Override
    public Ticker getTicker(String symbol) {
        String productId = toProductId(symbol);
        JsonNode ticker = request(HttpMethod.GET, "/products/" + productId + "/ticker", null, true);
        JsonNode stats = request(HttpMethod.GET, "/products/" + productId + "/stats", null, true);

        BigDecimal price = decimalOrNull(stats, "last");
        if (price == null) {
            price = decimal(ticker.path("trades").path(0), "price");
        }
        BigDecimal open = decimal(stats, "open");
        BigDecimal change = price.subtract(open);
        BigDecimal changePercent = open.signum() > 0
                ? change.multiply(BigDecimal.valueOf(100)).divide(open, 4, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        BigDecimal bid = decimalOrNull(ticker, "best_bid");
        BigDecimal ask = decimalOrNull(ticker, "best_ask");

        return Ticker.builder()
                .symbol(symbol)
                .price(price)
                .bid(bid != null ? bid : price.multiply(BID_FACTOR))
                .ask(ask != null ? ask : price.multiply(ASK_FACTOR))
                .volume24h(decimal(stats, "volume"))
                .change24h(change)
                .changePercent24h(changePercent)
                .high24h(decimal(stats, "high"))
                .low24h(decimal(stats, "low"))
                .timestamp(clock.instant())
                .build();
    }

    @Override
    public List<Ticker> getTickers(List<String> symbols) {
        List<String> requested = symbols == null || symbols.isEmpty() ? DEFAULT_SYMBOLS : symbols;
        List<Ticker> tickers = new ArrayList<>();
        for (String symbol : requested) {
            try {
                tickers.add(getTicker(symbol));
            } catch (ExchangeException e) {
                log.warn("Skipping Coinbase ticker {}: {}", symbol, e.getMessage());
            }
        }
        return tickers;
    }

    @Override
    public OrderBook getOrderBook(String symbol, int limit) {
        JsonNode book = request(HttpMethod.GET, "/products/" + toProductId(symbol) + "/book?level=2", null, true);
        return OrderBook.builder()
                .symbol(symbol)
                .bids(levels(book.path("bids"), limit))
                .asks(levels(book.path("asks"), limit))
                .timestamp(clock.instant())
                .build();
    }

    @Override
    public List<String> getTradingPairs() {
        List<String> cached = cachedProducts;
        if (cached != null) {
            return cached;
        }
        JsonNode products = request(HttpMethod.GET, "/products", null, true);
        List<String> pairs = new ArrayList<>();
        for (JsonNode product : products.path("products")) {
            if ("online".equals(text(product, "status"))) {
                pairs.add(toSymbol(text(product, "product_id")));
            }
        }
        cachedProducts = Collections.unmodifiableList(pairs);
        return cachedProducts;
    }

    // ---- Account ----

    @Override
    public List<Balance> getBalances() {
        JsonNode accounts = request(HttpMethod.GET, "/accounts", null, false);
        List<Balance> balances = new ArrayList<>();
        for (JsonNode account : accounts.path("accounts")) {
            Balance balance = Balance.of(
                    text(account, "currency"),
                    decimal(account.path("available_balance"), "value"),
                    decimal(account.path("hold"), "value"));
            if (balance.getTotal().signum() > 0) {
                balances.add(balance);
            }
        }
        return balances;
    }

    @Override
    public Optional<Balance> getBalance(String asset) {
        return getBalances().stream()
                .filter(balance -> balance.getAsset().equalsIgnoreCase(asset))
                .findFirst();
    }

    // ---- Trading ----

    @Override
    public Order createOrder(OrderRequest request) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("client_order_id",
                request.getClientOrderId() != null ? request.getClientOrderId() : UUID.randomUUID().toString());
        body.put("product_id", toProductId(request.getSymbol()));
        body.put("side", request.getSide().name());
        body.set("order_configuration", orderConfiguration(request));

        JsonNode result = request(HttpMethod.POST, "/orders", body, false);
        if (!result.path("success").asBoolean(false)) {
            String reason = text(result, "failure_reason");
            if (reason == null) {
                reason = text(result.path("error_response"), "message");
            }
            throw new ExchangeException("Order failed: " + (reason != null ? reason : "Unknown error"));
        }

        String orderId = text(result, "order_id");
        if (orderId == null) {
            orderId = text(result.path("success_response"), "order_id");
        }
        Order order = getOrder(orderId, request.getSymbol())
                .orElseThrow(() -> new ExchangeException("Order created but could not be retrieved"));
        log.info("Coinbase order placed: id={}, symbol={}, side={}, type={}, status={}",
                order.getId(), order.getSymbol(), order.getSide(), order.getType(), order.getStatus());
        return order;
    }

    @Override
    public boolean cancelOrder(String orderId, String symbol) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.putArray("order_ids").add(orderId);
        try {
            JsonNode result = request(HttpMethod.POST, "/orders/batch_cancel", body, false);
            JsonNode first = result.path("results").path(0);
            return first.isMissingNode() || first.path("success").asBoolean(true);
        } catch (ExchangeException e) {
            if (e.getCause() instanceof HttpClientErrorException) {
                log.warn("Coinbase order {} not cancelled: {}", orderId, e.getMessage());
                return false;
            }
            throw e;
        }
    }

    @Override
    public Optional<Order> getOrder(String orderId, String symbol) {
        try {
            JsonNode result = request(HttpMethod.GET, "/orders/historical/" + orderId, null, false);
            return Optional.of(toOrder(result.path("order")));
        } catch (ExchangeException e) {
            if (e.getCause() instanceof HttpClientErrorException) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public List<Order> getOpenOrders(String symbol) {
        StringBuilder path = new StringBuilder("/orders/historical/batch?order_status=OPEN");
        if (symbol != null) {
            path.append("&product_id=").append(toProductId(symbol));
        }
        return toOrders(request(HttpMethod.GET, path.toString(), null, false));
    }

    @Override
    public List<Order> getOrderHistory(String symbol, int limit) {
        StringBuilder path = new StringBuilder("/orders/historical/batch?limit=").append(limit);
        if (symbol != null) {
            path.append("&product_id=").append(toProductId(symbol));
        }
        return toOrders(request(HttpMethod.GET, path.toString(), null, false));
    }

    // ---- Portfolio ----

    @Override
    public List<Position> getPositions() {
        List<Position> positions = new ArrayList<>();
        for (Balance balance : getBalances()) {
            if (CASH_ASSETS.contains(balance.getAsset())) {
                continue;
            }
            String symbol = balance.getAsset() + "/USD";
            try {
                positions.add(Position.builder()
                        .symbol(symbol)
                        .side(PositionSide.LONG)
                        .quantity(balance.getTotal())
                        .entryPrice(BigDecimal.ZERO)
                        .currentPrice(getTicker(symbol).getPrice())
                        .unrealizedPnl(BigDecimal.ZERO)
                        .unrealizedPnlPercent(BigDecimal.ZERO)
                        .build());
            } catch (ExchangeException e) {
                log.debug("No USD market for {}: {}", balance.getAsset(), e.getMessage());
            }
        }
        return positions;
    }

    @Override
    public List<Trade> getTrades(String symbol, int limit) {
        StringBuilder path = new StringBuilder("/orders/historical/fills?limit=").append(limit);
        if (symbol != null) {
            path.append("&product_id=").append(toProductId(symbol));
        }
        JsonNode result = request(HttpMethod.GET, path.toString(), null, false);
        List<Trade> trades = new ArrayList<>();
        for (JsonNode fill : result.path("fills")) {
            trades.add(Trade.builder()
                    .id(text(fill, "entry_id"))
                    .orderId(text(fill, "order_id"))
                    .symbol(toSymbol(text(fill, "product_id")))
                    .side(OrderSide.valueOf(text(fill, "side").toUpperCase()))
                    .quantity(decimal(fill, "size"))
                    .price(decimal(fill, "price"))
                    .fee(decimal(fill, "commission"))
                    .feeCurrency("USD")
                    .timestamp(isoInstant(fill, "trade_time"))
                    .build());
        }
        return trades;
    }

    // ---- Symbol mapping ----

    static String toProductId(String symbol) {
        TradingPair pair = TradingPair.parse(symbol);
        return pair.base() + "-" + pair.quote();
    }

    static String toSymbol(String productId) {
        return productId.replace('-', '/');
    }

    // ---- Orders ----

    private ObjectNode orderConfiguration(OrderRequest request) {
        ObjectNode configuration = JsonNodeFactory.instance.objectNode();
        String baseSize = plain(request.getQuantity());
        switch (request.getType()) {
            case MARKET -> {
                ObjectNode market = configuration.putObject("market_market_ioc");
                if (request.getSide() == OrderSide.BUY) {
                    BigDecimal price = request.getPrice() != null
                            ? request.getPrice()
                            : getTicker(request.getSymbol()).getPrice();
                    market.put("quote_size", plain(request.getQuantity().multiply(price)));
                } else {
                    market.put("base_size", baseSize);
                }
            }
            case LIMIT -> {
                if (request.getPrice() == null) {
                    throw new IllegalArgumentException("Limit orders require a price");
                }
                ObjectNode limit = configuration.putObject("limit_limit_gtc");
                limit.put("base_size", baseSize);
                limit.put("limit_price", plain(request.getPrice()));
            }
            case STOP_LOSS, TAKE_PROFIT -> {
                if (request.getStopPrice() == null) {
                    throw new IllegalArgumentException(request.getType() + " orders require a stopPrice");
                }
                boolean triggersBelow = (request.getType() == OrderType.STOP_LOSS) == (request.getSide() == OrderSide.SELL);
                ObjectNode stop = configuration.putObject("stop_limit_stop_limit_gtc");
                stop.put("base_size", baseSize);
                stop.put("limit_price", plain(request.getPrice() != null ? request.getPrice() : request.getStopPrice()));
                stop.put("stop_price", plain(request.getStopPrice()));
                stop.put("stop_direction", triggersBelow ? "STOP_DIRECTION_STOP_DOWN" : "STOP_DIRECTION_STOP_UP");
            }
        }
        return configuration;
    }

    private List<Order> toOrders(JsonNode result) {
        List<Order> orders = new ArrayList<>();
        for (JsonNode node : result.path("orders")) {
            orders.add(toOrder(node));
        }
        return orders;
    }

    private Order toOrder(JsonNode node) {
        JsonNode configuration = node.path("order_configuration");
        JsonNode sized = firstPresent(configuration,
                "limit_limit_gtc", "stop_limit_stop_limit_gtc", "market_market_ioc");
        String orderType = text(node, "order_type");

        return Order.builder()
                .id(text(node, "order_id"))
                .exchangeOrderId(text(node, "order_id"))
                .clientOrderId(text(node, "client_order_id"))
                .symbol(toSymbol(text(node, "product_id")))
                .side(OrderSide.valueOf(text(node, "side").toUpperCase()))
                .type(mapType(orderType))
                .status(mapStatus(text(node, "status")))
                .quantity(decimal(sized, "base_size"))
                .filledQuantity(decimal(node, "filled_size"))
                .price(decimalOrNull(sized, "limit_price"))
                .averagePrice(decimalOrNull(node, "average_filled_price"))
                .fee(decimal(node, "total_fees"))
                .feeCurrency("USD")
                .createdAt(isoInstant(node, "created_time"))
                .updatedAt(clock.instant())
                .build();
    }

    static OrderStatus mapStatus(String status) {
        if (status == null) {
            return OrderStatus.PENDING;
        }
        return switch (status) {
            case "OPEN" -> OrderStatus.OPEN;
            case "FILLED" -> OrderStatus.FILLED;
            case "CANCELLED" -> OrderStatus.CANCELLED;
            case "EXPIRED", "FAILED" -> OrderStatus.REJECTED;
            default -> OrderStatus.PENDING;
        };
    }

    private static OrderType mapType(String orderType) {
        if (orderType == null) {
            return OrderType.MARKET;
        }
        if (orderType.contains("STOP")) {
            return OrderType.STOP_LOSS;
        }
        return orderType.contains("LIMIT") ? OrderType.LIMIT : OrderType.MARKET;
    }

    private static JsonNode firstPresent(JsonNode parent, String... fields) {
        for (String field : fields) {
            if (parent.has(field)) {
                return parent.get(field);
            }
        }
        return parent.path(fields[fields.length - 1]);
    }

    private static List<OrderBookLevel> levels(JsonNode entries, int limit) {
        List<OrderBookLevel> levels = new ArrayList<>();
        for (JsonNode entry : entries) {
            if (levels.size() >= limit) {
                break;
            }
            levels.add(new OrderBookLevel(decimalAt(entry, 0), decimalAt(entry, 1)));
        }
        return levels;
    }

    // ---- HTTP ----

    private JsonNode request(HttpMethod method, String path, JsonNode body, boolean isPublic) {
        String requestPath = API_PREFIX + path;
        String payload = body == null ? "" : body.toString();

        RestClient.RequestBodySpec spec = restClient.method(method)
                .uri(requestPath)
                .contentType(MediaType.APPLICATION_JSON);
        if (!isPublic) {
            String timestamp = String.valueOf(clock.instant().getEpochSecond());
            spec.header("CB-ACCESS-KEY", credentials.getApiKey())
                    .header("CB-ACCESS-TIMESTAMP", timestamp)
                    .header("CB-ACCESS-SIGN", HmacSigner.sign(
                            timestamp + method.name() + requestPath + payload, credentials.getApiSecret()));
        }
        if (body != null) {
            spec.body(payload);
        }
        return send(() -> spec.retrieve().body(JsonNode.class));
    }

    private static JsonNode send(Supplier<JsonNode> call) {
        try {
            return call.get();
        } catch (RestClientResponseException e) {
            throw new ExchangeException(
                    "Coinbase API error: HTTP " + e.getStatusCode().value() + " " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new ExchangeException("Coinbase request failed: " + e.getMessage(), e);
        }
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
