package com.tradezzz.session;

import com.tradezzz.config.PaperTradingProperties;
import com.tradezzz.domain.enums.ExchangeId;
import com.tradezzz.domain.enums.TradingMode;
import com.tradezzz.domain.model.Balance;
import com.tradezzz.domain.model.ExchangeCredentials;
import com.tradezzz.domain.model.Order;
import com.tradezzz.domain.model.OrderBook;
import com.tradezzz.domain.model.OrderRequest;
import com.tradezzz.domain.model.Position;
import com.tradezzz.domain.model.Ticker;
import com.tradezzz.domain.model.Trade;
import com.tradezzz.event.EventPublisherHelper;
import com.tradezzz.exception.ExchangeConnectionException;
import com.tradezzz.exception.ModeSwitchException;
import com.tradezzz.exception.NoSessionException;
import com.tradezzz.exchange.ExchangeGateway;
import com.tradezzz.exchange.ExchangeGatewayFactory;
import com.tradezzz.simulator.PaperExecutionEngine;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns each user's trading session and routes every exchange operation to the gateway that matches
 * the session's mode.
 *
 * <p>Per-user lifecycle:
 * <pre>
 *   disconnected --connectExchange--> connected(PAPER) <--switchMode--> connected(LIVE)
 *        ^                                   |
 *        +---------disconnectExchange--------+
 * </pre>
 *
 * <p>A session is only created after the venue accepted the credentials through
 * {@link ExchangeGateway#testConnection()}. Every operation without a session fails with
 * {@link NoSessionException}. Venue errors propagate unchanged.
 */
@Service
public class TradingSessionController {

    private static final Logger log = LoggerFactory.getLogger(TradingSessionController.class);

    private static final String CONNECTION_NOT_FOUND = "Exchange connection not found";
    private static final String CONNECTION_FAILED =
            "Failed to connect to exchange. Please check your API credentials.";
    private static final String LIVE_ACKNOWLEDGMENT_REQUIRED =
            "Switching to live trading requires explicit acknowledgment that real money will be at risk";
    private static final Set<String> CASH_ASSETS = Set.of("USD", "USDT");

    private final Map<String, TradingSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, List<ModeSwitchAudit>> modeAuditLog = new ConcurrentHashMap<>();

    private final ExchangeConnectionStore connectionStore;
    private final CredentialCipher credentialCipher;
    private final ExchangeGatewayFactory gatewayFactory;
    private final PaperTradingProperties paperTradingProperties;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public TradingSessionController(
            ExchangeConnectionStore connectionStore,
            CredentialCipher credentialCipher,
            ExchangeGatewayFactory gatewayFactory,
            PaperTradingProperties paperTradingProperties,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.connectionStore = connectionStore;
        this.credentialCipher = credentialCipher;
        this.gatewayFactory = gatewayFactory;
        this.paperTradingProperties = paperTradingProperties;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ========================
    // Connections
    // ========================

    /**
     * Encrypts and stores a user's credentials for later {@link #connectExchange} calls.
     *
     * @throws ExchangeConnectionException if the venue is unknown
     */
    public ExchangeConnection registerConnection(String userId, String exchange, ExchangeCredentials credentials) {
        ExchangeId exchangeId = resolveExchange(exchange);
        ExchangeConnection stored = connectionStore.save(ExchangeConnection.builder()
                .userId(userId)
                .exchange(exchangeId.getCode())
                .encryptedApiKey(credentialCipher.encrypt(credentials.getApiKey()))
                .encryptedApiSecret(credentialCipher.encrypt(credentials.getApiSecret()))
                .encryptedPassphrase(credentials.getPassphrase() != null
                        ? credentialCipher.encrypt(credentials.getPassphrase())
                        : null)
                .sandbox(credentials.isSandbox())
                .build());
        log.info("Stored {} connection {} for user {} ({})", exchangeId.getCode(), stored.getId(), userId, credentials);
        return stored;
    }

    /**
     * Resolves the stored connection, verifies the credentials against the venue and starts a
     * session in PAPER mode. An existing session for the user is replaced.
     *
     * @throws ExchangeConnectionException if the connection does not exist or belong to the user, the
     *         venue is not supported, or the venue rejects the credentials
     */
    public TradingState connectExchange(String userId, String connectionId) {
        ExchangeConnection connection = connectionStore.findConnectionById(connectionId)
                .filter(candidate -> userId.equals(candidate.getUserId()))
                .orElseThrow(() -> new ExchangeConnectionException(CONNECTION_NOT_FOUND));

        ExchangeId exchangeId = resolveExchange(connection.getExchange());
        ExchangeCredentials credentials = decrypt(connection);
        ExchangeGateway liveGateway = gatewayFactory.create(userId, exchangeId, credentials);

        if (!verify(liveGateway)) {
            log.warn("Credential check failed for user {} on {}", userId, exchangeId.getCode());
            throw new ExchangeConnectionException(CONNECTION_FAILED);
        }
        liveGateway.connect();

        PaperExecutionEngine paperEngine = new PaperExecutionEngine(liveGateway, paperTradingProperties, clock);
        paperEngine.connect();

        TradingSession session = new TradingSession(userId, exchangeId, liveGateway, paperEngine, clock.instant());
        TradingSession previous = sessions.put(userId, session);
        if (previous != null) {
            closeQuietly(previous);
        }

        log.info("User {} connected to {} in {} mode", userId, exchangeId.getDisplayName(), session.getMode());
        return toState(session);
    }

    /** Ends the user's session. Disconnect failures are logged and otherwise ignored. */
    public void disconnectExchange(String userId) {
        TradingSession session = sessions.remove(userId);
        if (session == null) {
            log.debug("No session to disconnect for user {}", userId);
            return;
        }
        closeQuietly(session);
        log.info("User {} disconnected from {}", userId, session.getExchangeId().getDisplayName());
    }

    // ========================
    // Mode
    // ========================

    /**
     * Selects which gateway serves the user's operations. No balances move.
     *
     * @throws ModeSwitchException if switching to LIVE without acknowledgment
     * @throws NoSessionException if the user has no session
     */
    public TradingState switchMode(String userId, TradingMode newMode, boolean acknowledged) {
        if (newMode == TradingMode.LIVE && !acknowledged) {
            throw new ModeSwitchException(LIVE_ACKNOWLEDGMENT_REQUIRED);
        }
        TradingSession session = requireSession(userId);

        TradingMode previousMode;
        synchronized (session) {
            previousMode = session.getMode();
            session.setMode(newMode);
        }

        if (previousMode != newMode) {
            modeAuditLog.computeIfAbsent(userId, key -> new CopyOnWriteArrayList<>())
                    .add(new ModeSwitchAudit(
                            userId,
                            "mode_switched_to_" + newMode.name().toLowerCase(),
                            previousMode,
                            newMode,
                            clock.instant()));
            eventPublisherHelper.publishModeChanged(this, userId, previousMode, newMode);
            log.info("User {} switched trading mode {} -> {}", userId, previousMode, newMode);
        }
        return toState(session);
    }

    public TradingState getState(String userId) {
        TradingSession session = sessions.get(userId);
        return session == null ? TradingState.disconnected() : toState(session);
    }

    public List<ModeSwitchAudit> getModeAuditLog(String userId) {
        return List.copyOf(modeAuditLog.getOrDefault(userId, List.of()));
    }

    public Optional<TradingSession> findSession(String userId) {
        return Optional.ofNullable(sessions.get(userId));
    }

    /**
     * @throws NoSessionException if the user has not connected an exchange
     */
    public TradingSession requireSession(String userId) {
        TradingSession session = sessions.get(userId);
        if (session == null) {
            throw new NoSessionException();
        }
        return session;
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }

    public int getLiveSessionCount() {
        return (int) sessions.values().stream()
                .filter(session -> session.getMode() == TradingMode.LIVE)
                .count();
    }

    // ========================
    // Delegated operations
    // ========================

    public Ticker getTicker(String userId, String symbol) {
        return gateway(userId).getTicker(symbol);
    }

    public List<Ticker> getTickers(String userId, List<String> symbols) {
        return gateway(userId).getTickers(symbols);
    }

    public OrderBook getOrderBook(String userId, String symbol, int limit) {
        return gateway(userId).getOrderBook(symbol, limit);
    }

    public List<String> getTradingPairs(String userId) {
        return gateway(userId).getTradingPairs();
    }

    public List<Balance> getBalances(String userId) {
        return gateway(userId).getBalances();
    }

    public Optional<Balance> getBalance(String userId, String asset) {
        return gateway(userId).getBalance(asset);
    }

    public Order createOrder(String userId, OrderRequest request) {
        return gateway(userId).createOrder(request);
    }

    public boolean cancelOrder(String userId, String orderId, String symbol) {
        return gateway(userId).cancelOrder(orderId, symbol);
    }

    public Optional<Order> getOrder(String userId, String orderId, String symbol) {
        return gateway(userId).getOrder(orderId, symbol);
    }

    public List<Order> getOpenOrders(String userId, String symbol) {
        return gateway(userId).getOpenOrders(symbol);
    }

    public List<Order> getOrderHistory(String userId, String symbol, int limit) {
        return gateway(userId).getOrderHistory(symbol, limit);
    }

    public List<Position> getPositions(String userId) {
        return gateway(userId).getPositions();
    }

    public List<Trade> getTrades(String userId, String symbol, int limit) {
        return gateway(userId).getTrades(symbol, limit);
    }

    /** USD and USDT totals plus every position marked to its current price. */
    public BigDecimal getPortfolioValue(String userId) {
        ExchangeGateway gateway = gateway(userId);
        BigDecimal total = BigDecimal.ZERO;
        for (Balance balance : gateway.getBalances()) {
            if (CASH_ASSETS.contains(balance.getAsset())) {
                total = total.add(balance.getTotal());
            }
        }
        for (Position position : gateway.getPositions()) {
            total = total.add(position.getQuantity().multiply(position.getCurrentPrice()));
        }
        return total;
    }

    /** Restores the paper account's seed balances, regardless of the current mode. */
    public void resetPaperAccount(String userId) {
        requireSession(userId).getPaperEngine().reset();
    }

    // ---- helpers ----

    private ExchangeGateway gateway(String userId) {
        return requireSession(userId).activeGateway();
    }

    private TradingState toState(TradingSession session) {
        ExchangeGateway active = session.activeGateway();
        return TradingState.builder()
                .mode(session.getMode())
                .exchangeId(active.getId())
                .exchangeName(active.getName())
                .connected(true)
                .canTrade(true)
                .build();
    }

    private static ExchangeId resolveExchange(String exchange) {
        try {
            return ExchangeId.fromCode(exchange);
        } catch (IllegalArgumentException e) {
            throw new ExchangeConnectionException("Exchange " + exchange + " not yet supported", e);
        }
    }

    private ExchangeCredentials decrypt(ExchangeConnection connection) {
        try {
            return ExchangeCredentials.builder()
                    .apiKey(credentialCipher.decrypt(connection.getEncryptedApiKey()))
                    .apiSecret(credentialCipher.decrypt(connection.getEncryptedApiSecret()))
                    .passphrase(connection.getEncryptedPassphrase() != null
                            ? credentialCipher.decrypt(connection.getEncryptedPassphrase())
                            : null)
                    .sandbox(connection.isSandbox())
                    .build();
        } catch (IllegalStateException e) {
            log.error("Stored credentials for connection {} could not be decrypted", connection.getId());
            throw new ExchangeConnectionException(CONNECTION_FAILED, e);
        }
    }

    private static boolean verify(ExchangeGateway gateway) {
        try {
            return gateway.testConnection();
        } catch (RuntimeException e) {
            log.warn("Connection test against {} failed: {}", gateway.getId(), e.getMessage());
            return false;
        }
    }

    private static void closeQuietly(TradingSession session) {
        try {
            session.getPaperEngine().disconnect();
            session.getLiveGateway().disconnect();
        } catch (RuntimeException e) {
            log.warn("Disconnect of {} for user {} failed: {}",
                    session.getExchangeId().getCode(), session.getUserId(), e.getMessage());
        }
    }
}
