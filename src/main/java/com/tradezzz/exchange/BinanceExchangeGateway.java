package com.tradezzz.exchange;

import static com.tradezzz.exchange.VenueJson.decimal;
import static com.tradezzz.exchange.VenueJson.decimalAt;
import static com.tradezzz.exchange.VenueJson.decimalOrNull;
import static com.tradezzz.exchange.VenueJson.epochMillis;
import static com.tradezzz.exchange.VenueJson.text;

import com.fasterxml.jackson.databind.JsonNode;
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
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Binance spot REST v3 adapter for one account.
 *
 * <p>Public endpoints are called unsigned. Account and order endpoints append {@code recvWindow} and
 * {@code timestamp}, sign the resulting query string with HMAC-SHA256 over the API secret and send
 * the key in the {@code X-MBX-APIKEY} header.
 *
 * <p>Canonical {@code BTC/USDT} maps to {@code BTCUSDT}. The reverse mapping uses the base and quote
 * assets published by {@code /api/v3/exchangeInfo}, with a quote-suffix match as a fallback for
 * symbols not seen yet.
 */
public class BinanceExchangeGateway implements ExchangeGateway {

    private static final Logger log = LoggerFactory.getLogger(BinanceExchangeGateway.class);

    static final String API_KEY_HEADER = "X-MBX-APIKEY";

    private static final int MAX_LIST_LIMIT = 1000;

    private static final List<String> DEFAULT_SYMBOLS =
            List.of("BTC/USDT", "ETH/USDT", "BNB/USDT", "SOL/USDT", "XRP/USDT", "ADA/USDT", "DOGE/USDT");

    private static final List<String> KNOWN_QUOTES =
            List.of("USDT", "USDC", "FDUSD", "BUSD", "TUSD", "BTC", "ETH", "BNB", "EUR", "TRY", "BRL");

    private static final Set<String> STABLE_ASSETS = Set.of("USDT", "USDC", "FDUSD", "BUSD", "TUSD", "USD");

    private final ExchangeCredentials credentials;
    private final RestClient restClient;
    private final Clock clock;
    private final long recvWindow;

    private final Map<String, String> canonicalByVenueSymbol = new ConcurrentHashMap<>();
    private volatile List<String> tradingPairs;
    private volatile boolean connected;
    private volatile boolean verified;

    public BinanceExchangeGateway(
            ExchangeCredentials credentials, RestClient restClient, Clock clock, long recvWindow) {
        this.credentials = credentials;
        this.restClient = restClient;
        this.clock = clock;
        this.recvWindow = recvWindow;
    }

    @Override
    public String getName() {
        return ExchangeId.BINANCE.getDisplayName();
    }

    @Override
    public String getId() {
        return ExchangeId.BINANCE.getCode();
    }

    // ---- Connection ----

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void connect() {
        if (!verified && !testConnection()) {
            throw new ExchangeException("Binance rejected the API credentials");
        }
        connected = true;
        log.info("Connected to Binance, sandbox={}", credentials.isSandbox());
    }

    @Override
    public void disconnect() {
        connected = false;
        verified = false;
        tradingPairs = null;
    }

    @Override
    public boolean testConnection() {
        try {
            signed(HttpMethod.GET, "/api/v3/account", new LinkedHashMap<>());
            verified = true;
            return true;
        } catch (ExchangeException e) {
            log.warn("Binance connection test failed: {}", e.getMessage());
            return false;
        }
    }

    // ---- Market data ----

    @Override
    public Ticker getTicker(String symbol) {
        JsonNode node = publicGet("/api/v3/ticker/24hr", params("symbol", toVenueSymbol(symbol)));
        return Ticker.builder()
                .symbol(symbol)
                .price(decimal(node, "lastPrice"))
                .bid(decimal(node, "bidPrice"))
                .ask(decimal(node, "askPrice"))
                .volume24h(decimal(node, "volume"))
                .change24h(decimal(node, "priceChange"))
                .changePercent24h(decimal(node, "priceChangePercent"))
                .high24h(decimal(node, "highPrice"))
                .low24h(decimal(node, "lowPrice"))
                .timestamp(node.has("closeTime") ? epochMillis(node, "closeTime") : clock.instant())
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
                log.warn("Skipping Binance ticker {}: {}", symbol, e.getMessage());
            }
        }
        return tickers;
    }

    @Override
    public OrderBook getOrderBook(String symbol, int limit) {
        JsonNode node = publicGet(
                "/api/v3/depth", params("symbol", toVenueSymbol(symbol), "limit", String.valueOf(limit)));
        return OrderBook.builder()
                .symbol(symbol)
                .bids(levels(node.path("bids")))
                .asks(levels(node.path("asks")))
                .timestamp(clock.instant())
                .build();
    }

    @Override
    public List<String> getTradingPairs() {
        List<String> cached = tradingPairs;
        if (cached != null) {
            return cached;
        }
        JsonNode info = publicGet("/api/v3/exchangeInfo", params());
        List<String> pairs = new ArrayList<>();
        for (JsonNode entry : info.path("symbols")) {
            if (!"TRADING".equals(text(entry, "status"))) {
                continue;
            }
            String canonical = text(entry, "baseAsset") + "/" + text(entry, "quoteAsset");
            canonicalByVenueSymbol.put(text(entry, "symbol"), canonical);
            pairs.add(canonical);
        }
        tradingPairs = Collections.unmodifiableList(pairs);
        return tradingPairs;
    }

    // ---- Account ----

    @Override
    public List<Balance> getBalances() {
        JsonNode account = signed(HttpMethod.GET, "/api/v3/account", new LinkedHashMap<>());
        List<Balance> balances = new ArrayList<>();
        for (JsonNode entry : account.path("balances")) {
            Balance balance = Balance.of(text(entry, "asset"), decimal(entry, "free"), decimal(entry, "locked"));
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
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toVenueSymbol(request.getSymbol()));
        params.put("side", request.getSide().name());
        params.put("quantity", plain(request.getQuantity()));

        switch (request.getType()) {
            case MARKET -> params.put("type", "MARKET");
            case LIMIT -> {
                if (request.getPrice() == null) {
                    throw new IllegalArgumentException("Limit orders require a price");
                }
                params.put("type", "LIMIT");
                params.put("timeInForce", "GTC");
                params.put("price", plain(request.getPrice()));
            }
            case STOP_LOSS, TAKE_PROFIT -> {
                if (request.getStopPrice() == null) {
                    throw new IllegalArgumentException(request.getType() + " orders require a stopPrice");
                }
                if (request.getPrice() != null) {
                    params.put("type", request.getType().name() + "_LIMIT");
                    params.put("timeInForce", "GTC");
                    params.put("price", plain(request.getPrice()));
                } else {
                    params.put("type", request.getType().name());
                }
                params.put("stopPrice", plain(request.getStopPrice()));
            }
        }
        if (request.getClientOrderId() != null) {
            params.put("newClientOrderId", request.getClientOrderId());
        }
        params.put("newOrderRespType", "FULL");

        Order order = toOrder(signed(HttpMethod.POST, "/api/v3/order", params), request.getSymbol());
        log.info("Binance order placed: id={}, symbol={}, side={}, type={}, status={}",
                order.getId(), order.getSymbol(), order.getSide(), order.getType(), order.getStatus());
        return order;
    }

    @Override
    public boolean cancelOrder(String orderId, String symbol) {
        Map<String, String> params = orderParams(orderId, requireSymbol(symbol, "cancel an order"));
        try {
            signed(HttpMethod.DELETE, "/api/v3/order", params);
            return true;
        } catch (ExchangeException e) {
            if (e.getCause() instanceof HttpClientErrorException) {
                log.warn("Binance order {} not cancelled: {}", orderId, e.getMessage());
                return false;
            }
            throw e;
        }
    }

    @Override
    public Optional<Order> getOrder(String orderId, String symbol) {
        Map<String, String> params = orderParams(orderId, requireSymbol(symbol, "look up an order"));
        try {
            return Optional.of(toOrder(signed(HttpMethod.GET, "/api/v3/order", params), symbol));
        } catch (ExchangeException e) {
            if (e.getCause() instanceof HttpClientErrorException) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public List<Order> getOpenOrders(String symbol) {
        Map<String, String> params = new LinkedHashMap<>();
        if (symbol != null) {
            params.put("symbol", toVenueSymbol(symbol));
        }
        List<Order> orders = new ArrayList<>();
        for (JsonNode node : signed(HttpMethod.GET, "/api/v3/openOrders", params)) {
            orders.add(toOrder(node, symbol));
        }
        return orders;
    }

    @Override
    public List<Order> getOrderHistory(String symbol, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toVenueSymbol(requireSymbol(symbol, "list order history")));
        params.put("limit", String.valueOf(clampLimit(limit)));
        List<Order> orders = new ArrayList<>();
        for (JsonNode node : signed(HttpMethod.GET, "/api/v3/allOrders", params)) {
            orders.add(toOrder(node, symbol));
        }
        Collections.reverse(orders);
        return orders;
    }

    // ---- Portfolio ----

    @Override
    public List<Position> getPositions() {
        List<Position> positions = new ArrayList<>();
        for (Balance balance : getBalances()) {
            if (STABLE_ASSETS.contains(balance.getAsset())) {
                continue;
            }
            String symbol = balance.getAsset() + "/USDT";
            try {
                BigDecimal price = getTicker(symbol).getPrice();
                positions.add(Position.builder()
                        .symbol(symbol)
                        .side(PositionSide.LONG)
                        .quantity(balance.getTotal())
                        .entryPrice(BigDecimal.ZERO)
                        .currentPrice(price)
                        .unrealizedPnl(BigDecimal.ZERO)
                        .unrealizedPnlPercent(BigDecimal.ZERO)
                        .build());
            } catch (ExchangeException e) {
                log.debug("No USDT market for {}: {}", balance.getAsset(), e.getMessage());
            }
        }
        return positions;
    }

    @Override
    public List<Trade> getTrades(String symbol, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toVenueSymbol(requireSymbol(symbol, "list trades")));
        params.put("limit", String.valueOf(clampLimit(limit)));
        List<Trade> trades = new ArrayList<>();
        for (JsonNode node : signed(HttpMethod.GET, "/api/v3/myTrades", params)) {
            trades.add(Trade.builder()
                    .id(text(node, "id"))
                    .orderId(text(node, "orderId"))
                    .symbol(symbol)
                    .side(node.path("isBuyer").asBoolean() ? OrderSide.BUY : OrderSide.SELL)
                    .quantity(decimal(node, "qty"))
                    .price(decimal(node, "price"))
                    .fee(decimal(node, "commission"))
                    .feeCurrency(text(node, "commissionAsset"))
                    .timestamp(epochMillis(node, "time"))
                    .build());
        }
        Collections.reverse(trades);
        return trades;
    }

    // ---- Symbol mapping ----

    String toVenueSymbol(String symbol) {
        TradingPair pair = TradingPair.parse(symbol);
        String venueSymbol = pair.base() + pair.quote();
        canonicalByVenueSymbol.putIfAbsent(venueSymbol, pair.symbol());
        return venueSymbol;
    }

    String toCanonicalSymbol(String venueSymbol) {
        String known = canonicalByVenueSymbol.get(venueSymbol);
        if (known != null) {
            return known;
        }
        for (String quote : KNOWN_QUOTES) {
            if (venueSymbol.endsWith(quote) && venueSymbol.length() > quote.length()) {
                return venueSymbol.substring(0, venueSymbol.length() - quote.length()) + "/" + quote;
            }
        }
        return venueSymbol;
    }

    // ---- Parsing ----

    private Order toOrder(JsonNode node, String requestedSymbol) {
        BigDecimal executed = decimal(node, "executedQty");
        BigDecimal quoteFilled = decimal(node, "cummulativeQuoteQty");
        BigDecimal averagePrice = executed.signum() > 0
                ? quoteFilled.divide(executed, 8, RoundingMode.HALF_UP)
                : null;

        BigDecimal fee = BigDecimal.ZERO;
        String feeCurrency = null;
        for (JsonNode fill : node.path("fills")) {
            fee = fee.add(decimal(fill, "commission"));
            feeCurrency = text(fill, "commissionAsset");
        }

        BigDecimal price = decimalOrNull(node, "price");
        if (price == null || price.signum() == 0) {
            price = averagePrice;
        }

        String orderId = text(node, "orderId");
        Instant createdAt = node.has("time") ? epochMillis(node, "time") : epochMillis(node, "transactTime");
        Instant updatedAt = node.has("updateTime") ? epochMillis(node, "updateTime") : createdAt;

        return Order.builder()
                .id(orderId)
                .exchangeOrderId(orderId)
                .clientOrderId(text(node, "clientOrderId"))
                .symbol(requestedSymbol != null ? requestedSymbol : toCanonicalSymbol(text(node, "symbol")))
                .side(OrderSide.valueOf(text(node, "side")))
                .type(mapType(text(node, "type")))
                .status(mapStatus(text(node, "status")))
                .quantity(decimal(node, "origQty"))
                .filledQuantity(executed)
                .price(price)
                .averagePrice(averagePrice)
                .fee(fee)
                .feeCurrency(feeCurrency)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    static OrderStatus mapStatus(String status) {
        if (status == null) {
            return OrderStatus.PENDING;
        }
        return switch (status) {
            case "NEW", "PENDING_CANCEL" -> OrderStatus.OPEN;
            case "PARTIALLY_FILLED" -> OrderStatus.PARTIALLY_FILLED;
            case "FILLED" -> OrderStatus.FILLED;
            case "CANCELED" -> OrderStatus.CANCELLED;
            case "EXPIRED", "EXPIRED_IN_MATCH", "REJECTED" -> OrderStatus.REJECTED;
            default -> OrderStatus.PENDING;
        };
    }

    static OrderType mapType(String type) {
        if (type == null) {
            return OrderType.MARKET;
        }
        return switch (type) {
            case "LIMIT", "LIMIT_MAKER" -> OrderType.LIMIT;
            case "STOP_LOSS", "STOP_LOSS_LIMIT" -> OrderType.STOP_LOSS;
            case "TAKE_PROFIT", "TAKE_PROFIT_LIMIT" -> OrderType.TAKE_PROFIT;
            default -> OrderType.MARKET;
        };
    }

    private static List<OrderBookLevel> levels(JsonNode entries) {
        List<OrderBookLevel> levels = new ArrayList<>();
        for (JsonNode entry : entries) {
            levels.add(new OrderBookLevel(decimalAt(entry, 0), decimalAt(entry, 1)));
        }
        return levels;
    }

    // ---- HTTP ----

    private JsonNode publicGet(String path, Map<String, String> params) {
        String uri = params.isEmpty() ? path : path + "?" + query(params);
        return send(() -> restClient.get().uri(uri).retrieve().body(JsonNode.class));
    }

    private JsonNode signed(HttpMethod method, String path, Map<String, String> params) {
        params.put("recvWindow", String.valueOf(recvWindow));
        params.put("timestamp", String.valueOf(clock.millis()));
        String query = query(params);
        String uri = path + "?" + query + "&signature=" + HmacSigner.sign(query, credentials.getApiSecret());
        return send(() -> restClient.method(method)
                .uri(uri)
                .header(API_KEY_HEADER, credentials.getApiKey())
                .retrieve()
                .body(JsonNode.class));
    }

    private JsonNode send(Supplier<JsonNode> call) {
        try {
            return call.get();
        } catch (RestClientResponseException e) {
            throw new ExchangeException(
                    "Binance API error: HTTP " + e.getStatusCode().value() + " " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new ExchangeException("Binance request failed: " + e.getMessage(), e);
        }
    }

    private Map<String, String> orderParams(String orderId, String symbol) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", toVenueSymbol(symbol));
        params.put("orderId", orderId);
        return params;
    }

    private static String requireSymbol(String symbol, String action) {
        if (symbol == null || symbol.isBlank()) {
            throw new ExchangeException("Binance requires a symbol to " + action);
        }
        return symbol;
    }

    private static Map<String, String> params(String... keyValues) {
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            params.put(keyValues[i], keyValues[i + 1]);
        }
        return params;
    }

    private static int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
    }

    private static String query(Map<String, String> params) {
        return params.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("&"));
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
