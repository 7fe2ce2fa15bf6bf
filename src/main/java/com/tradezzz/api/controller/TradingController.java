package com.tradezzz.api.controller;

import com.tradezzz.api.dto.request.ConnectRequest;
import com.tradezzz.api.dto.request.PlaceOrderRequest;
import com.tradezzz.api.dto.request.RegisterConnectionRequest;
import com.tradezzz.api.dto.request.SwitchModeRequest;
import com.tradezzz.api.dto.response.ConnectionResponse;
import com.tradezzz.domain.model.Balance;
import com.tradezzz.domain.model.ExchangeCredentials;
import com.tradezzz.domain.model.Order;
import com.tradezzz.domain.model.OrderBook;
import com.tradezzz.domain.model.Position;
import com.tradezzz.domain.model.Ticker;
import com.tradezzz.domain.model.Trade;
import com.tradezzz.exception.ResourceNotFoundException;
import com.tradezzz.ratelimit.ApiRateLimitInterceptor;
import com.tradezzz.service.TradingService;
import com.tradezzz.session.ModeSwitchAudit;
import com.tradezzz.session.TradingSessionController;
import com.tradezzz.session.TradingState;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the caller's trading session: connection, mode, market data and orders.
 *
 * <p>Every call is scoped to the user in the {@code X-User-Id} header. Market data and order calls
 * go to the session's active gateway, so the same endpoints serve paper and live trading.
 */
@RestController
@RequestMapping("/api/trading")
public class TradingController {

    private static final Logger log = LoggerFactory.getLogger(TradingController.class);

    private static final String DEFAULT_LIMIT = "50";

    private final TradingSessionController sessionController;
    private final TradingService tradingService;

    public TradingController(TradingSessionController sessionController, TradingService tradingService) {
        this.sessionController = sessionController;
        this.tradingService = tradingService;
    }

    // ==================== Session ====================

    @PostMapping("/connections")
    public ResponseEntity<ConnectionResponse> registerConnection(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @Valid @RequestBody RegisterConnectionRequest request) {
        ExchangeCredentials credentials = ExchangeCredentials.builder()
                .apiKey(request.getApiKey())
                .apiSecret(request.getApiSecret())
                .passphrase(request.getPassphrase())
                .sandbox(request.isSandbox())
                .build();
        ConnectionResponse body = ConnectionResponse.from(
                sessionController.registerConnection(userId, request.getExchange(), credentials));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/connect")
    public ResponseEntity<TradingState> connect(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @Valid @RequestBody ConnectRequest request) {
        log.info("Connect requested by user {} for connection {}", userId, request.getConnectionId());
        return ResponseEntity.ok(sessionController.connectExchange(userId, request.getConnectionId()));
    }

    @DeleteMapping("/connect")
    public ResponseEntity<TradingState> disconnect(@RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        sessionController.disconnectExchange(userId);
        return ResponseEntity.ok(sessionController.getState(userId));
    }

    @GetMapping("/state")
    public ResponseEntity<TradingState> getState(@RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        return ResponseEntity.ok(sessionController.getState(userId));
    }

    @PutMapping("/mode")
    public ResponseEntity<TradingState> switchMode(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @Valid @RequestBody SwitchModeRequest request) {
        return ResponseEntity.ok(sessionController.switchMode(userId, request.getMode(), request.isAcknowledged()));
    }

    @GetMapping("/mode/audit")
    public ResponseEntity<List<ModeSwitchAudit>> getModeAudit(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        return ResponseEntity.ok(sessionController.getModeAuditLog(userId));
    }

    // ==================== Market data ====================

    @GetMapping("/ticker")
    public ResponseEntity<Ticker> getTicker(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId, @RequestParam String symbol) {
        return ResponseEntity.ok(sessionController.getTicker(userId, symbol));
    }

    /** Tickers for a comma-separated symbol list, or the venue's default list when omitted. */
    @GetMapping("/tickers")
    public ResponseEntity<List<Ticker>> getTickers(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @RequestParam(required = false) List<String> symbols) {
        return ResponseEntity.ok(sessionController.getTickers(userId, symbols));
    }

    @GetMapping("/orderbook")
    public ResponseEntity<OrderBook> getOrderBook(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @RequestParam String symbol,
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(sessionController.getOrderBook(userId, symbol, limit));
    }

    @GetMapping("/pairs")
    public ResponseEntity<List<String>> getTradingPairs(@RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        return ResponseEntity.ok(sessionController.getTradingPairs(userId));
    }

    // ==================== Account ====================

    @GetMapping("/balances")
    public ResponseEntity<List<Balance>> getBalances(@RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        return ResponseEntity.ok(sessionController.getBalances(userId));
    }

    @GetMapping("/balances/{asset}")
    public ResponseEntity<Balance> getBalance(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId, @PathVariable String asset) {
        return ResponseEntity.ok(sessionController.getBalance(userId, asset)
                .orElseThrow(() -> new ResourceNotFoundException("Balance", asset)));
    }

    @GetMapping("/positions")
    public ResponseEntity<List<Position>> getPositions(@RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        return ResponseEntity.ok(sessionController.getPositions(userId));
    }

    @GetMapping("/trades")
    public ResponseEntity<List<Trade>> getTrades(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @RequestParam(required = false) String symbol,
            @RequestParam(defaultValue = DEFAULT_LIMIT) int limit) {
        return ResponseEntity.ok(sessionController.getTrades(userId, symbol, limit));
    }

    @GetMapping("/portfolio/value")
    public ResponseEntity<Map<String, BigDecimal>> getPortfolioValue(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        return ResponseEntity.ok(Map.of("totalValue", sessionController.getPortfolioValue(userId)));
    }

    @PostMapping("/paper/reset")
    public ResponseEntity<List<Balance>> resetPaperAccount(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId) {
        sessionController.resetPaperAccount(userId);
        log.info("Paper account reset for user {}", userId);
        return ResponseEntity.ok(sessionController.requireSession(userId).getPaperEngine().getBalances());
    }

    // ==================== Orders ====================

    @PostMapping("/orders")
    public ResponseEntity<Order> placeOrder(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @Valid @RequestBody PlaceOrderRequest request) {
        Order order = tradingService.placeOrder(
                userId, request.toOrderRequest(), request.getStopLoss(), request.getTakeProfit());
        return ResponseEntity.status(HttpStatus.CREATED).body(order);
    }

    @DeleteMapping("/orders/{orderId}")
    public ResponseEntity<Map<String, Object>> cancelOrder(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @PathVariable String orderId,
            @RequestParam(required = false) String symbol) {
        boolean cancelled = tradingService.cancelOrder(userId, orderId, symbol);
        return ResponseEntity.ok(Map.of("orderId", orderId, "cancelled", cancelled));
    }

    @GetMapping("/orders/{orderId}")
    public ResponseEntity<Order> getOrder(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @PathVariable String orderId,
            @RequestParam(required = false) String symbol) {
        return ResponseEntity.ok(sessionController.getOrder(userId, orderId, symbol)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId)));
    }

    @GetMapping("/orders/open")
    public ResponseEntity<List<Order>> getOpenOrders(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @RequestParam(required = false) String symbol) {
        return ResponseEntity.ok(sessionController.getOpenOrders(userId, symbol));
    }

    @GetMapping("/orders/history")
    public ResponseEntity<List<Order>> getOrderHistory(
            @RequestHeader(ApiRateLimitInterceptor.USER_HEADER) String userId,
            @RequestParam(required = false) String symbol,
            @RequestParam(defaultValue = DEFAULT_LIMIT) int limit) {
        return ResponseEntity.ok(sessionController.getOrderHistory(userId, symbol, limit));
    }
}
