package com.tradezzz.service;

import com.tradezzz.domain.enums.OrderSide;
import com.tradezzz.domain.enums.OrderStatus;
import com.tradezzz.domain.enums.PositionSide;
import com.tradezzz.domain.enums.RateLimitCategory;
import com.tradezzz.domain.enums.TradingMode;
import com.tradezzz.domain.model.Order;
import com.tradezzz.domain.model.OrderRequest;
import com.tradezzz.event.EventPublisherHelper;
import com.tradezzz.exception.BaseException;
import com.tradezzz.exception.RateLimitExceededException;
import com.tradezzz.exception.RiskRejectedException;
import com.tradezzz.ratelimit.ActionDecision;
import com.tradezzz.ratelimit.RateLimited;
import com.tradezzz.ratelimit.RateLimiter;
import com.tradezzz.ratelimit.TierLimits;
import com.tradezzz.risk.RiskService;
import com.tradezzz.risk.TradeRiskCheck;
import com.tradezzz.session.TradingSessionController;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Order pipeline for API callers.
 *
 * <p>Order of checks on placement:
 * <ol>
 *   <li>Per-minute order budget ({@link RateLimited}, enforced before the method body)</li>
 *   <li>Daily order budget for the user's tier</li>
 *   <li>Risk gate, for BUY orders only. A clamped size replaces the requested quantity.</li>
 *   <li>Execution on the session's active gateway (paper or live)</li>
 * </ol>
 *
 * <p>Every outcome past the rate limits is published as an {@code OrderEvent}.
 */
@Service
public class TradingService {

    private static final Logger log = LoggerFactory.getLogger(TradingService.class);

    static final String ORDER_ACTION = "order";
    private static final int QUANTITY_SCALE = 8;

    private final TradingSessionController sessionController;
    private final RiskService riskService;
    private final RateLimiter rateLimiter;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public TradingService(
            TradingSessionController sessionController,
            RiskService riskService,
            RateLimiter rateLimiter,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.sessionController = sessionController;
        this.riskService = riskService;
        this.rateLimiter = rateLimiter;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Places an order through the full pipeline.
     *
     * @param stopLoss   protective stop used only by the risk gate, may be null
     * @param takeProfit target used only by the risk gate, may be null
     * @throws RiskRejectedException      when the risk gate refuses a buy
     * @throws RateLimitExceededException when the per-minute or daily order budget is spent
     */
    @RateLimited(RateLimitCategory.ORDERS)
    public Order placeOrder(String userId, OrderRequest request, BigDecimal stopLoss, BigDecimal takeProfit) {
        TradingMode mode = sessionController.requireSession(userId).getMode();

        ActionDecision daily = rateLimiter.canPerformAction(userId, ORDER_ACTION);
        if (!daily.allowed()) {
            eventPublisherHelper.publishRateLimitExceeded(this, userId, "daily:" + ORDER_ACTION);
            throw new RateLimitExceededException(
                    daily.reason(), "daily:" + ORDER_ACTION, dailyOrderLimit(userId), secondsUntilMidnight());
        }

        OrderRequest effective = request;
        if (request.getSide() == OrderSide.BUY) {
            effective = applyRiskGate(userId, request, stopLoss, takeProfit, mode);
        }

        Order order;
        try {
            order = sessionController.createOrder(userId, effective);
        } catch (BaseException e) {
            log.warn("Order on {} for user {} rejected: {}", request.getSymbol(), userId, e.getMessage());
            eventPublisherHelper.publishOrderRejected(this, userId, rejectedSnapshot(effective, e.getMessage()), mode);
            throw e;
        }

        rateLimiter.trackUsage(userId, ORDER_ACTION);
        eventPublisherHelper.publishOrderPlaced(this, userId, order, mode);
        log.info("Order {} placed for user {} in {} mode: {} {} {} -> {}",
                order.getId(), userId, mode, order.getSide(), order.getQuantity(), order.getSymbol(), order.getStatus());
        return order;
    }

    public boolean cancelOrder(String userId, String orderId, String symbol) {
        TradingMode mode = sessionController.requireSession(userId).getMode();
        boolean cancelled = sessionController.cancelOrder(userId, orderId, symbol);
        if (cancelled) {
            sessionController.getOrder(userId, orderId, symbol)
                    .ifPresent(order -> eventPublisherHelper.publishOrderCancelled(this, userId, order, mode));
            log.info("Order {} cancelled for user {}", orderId, userId);
        }
        return cancelled;
    }

    // ---- Risk gate ----

    private OrderRequest applyRiskGate(String userId, OrderRequest request, BigDecimal stopLoss,
                                       BigDecimal takeProfit, TradingMode mode) {
        BigDecimal entry = request.getPrice() != null
                ? request.getPrice()
                : sessionController.getTicker(userId, request.getSymbol()).getPrice();

        TradeRiskCheck check = riskService.checkTradeRisk(
                userId,
                request.getSymbol(),
                PositionSide.LONG,
                request.getQuantity().doubleValue(),
                entry.doubleValue(),
                stopLoss == null ? null : stopLoss.doubleValue(),
                takeProfit == null ? null : takeProfit.doubleValue());

        if (!check.isAllowed()) {
            eventPublisherHelper.publishOrderRejected(this, userId, rejectedSnapshot(request, check.getReason()), mode);
            throw new RiskRejectedException(check.getReason(), check.getWarnings());
        }
        if (check.getAdjustedSize() == null) {
            return request;
        }
        BigDecimal adjusted = BigDecimal.valueOf(check.getAdjustedSize()).setScale(QUANTITY_SCALE, RoundingMode.DOWN);
        log.info("Risk gate reduced {} quantity for user {} from {} to {}",
                request.getSymbol(), userId, request.getQuantity(), adjusted);
        return request.toBuilder().quantity(adjusted).build();
    }

    // ---- helpers ----

    private Order rejectedSnapshot(OrderRequest request, String reason) {
        return Order.builder()
                .clientOrderId(request.getClientOrderId())
                .symbol(request.getSymbol())
                .side(request.getSide())
                .type(request.getType())
                .status(OrderStatus.REJECTED)
                .quantity(request.getQuantity())
                .filledQuantity(BigDecimal.ZERO)
                .price(request.getPrice())
                .rejectReason(reason)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
    }

    private int dailyOrderLimit(String userId) {
        TierLimits limits = rateLimiter.getLimitsForUser(userId);
        return limits.getOrdersPerMinute() * 1440;
    }

    private long secondsUntilMidnight() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime midnight = LocalDate.now(clock).plusDays(1).atStartOfDay(clock.getZone());
        return Duration.between(now, midnight).getSeconds();
    }
}
