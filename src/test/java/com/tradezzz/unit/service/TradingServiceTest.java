package com.tradezzz.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tradezzz.domain.enums.ExchangeId;
import com.tradezzz.domain.enums.OrderSide;
import com.tradezzz.domain.enums.OrderStatus;
import com.tradezzz.domain.enums.OrderType;
import com.tradezzz.domain.enums.PositionSide;
import com.tradezzz.domain.enums.SubscriptionTier;
import com.tradezzz.domain.enums.TradingMode;
import com.tradezzz.domain.model.Order;
import com.tradezzz.domain.model.OrderRequest;
import com.tradezzz.domain.model.Ticker;
import com.tradezzz.event.EventPublisherHelper;
import com.tradezzz.exception.InsufficientBalanceException;
import com.tradezzz.exception.NoSessionException;
import com.tradezzz.exception.RateLimitExceededException;
import com.tradezzz.exception.RiskRejectedException;
import com.tradezzz.exchange.ExchangeGateway;
import com.tradezzz.ratelimit.ActionDecision;
import com.tradezzz.ratelimit.RateLimiter;
import com.tradezzz.ratelimit.TierLimits;
import com.tradezzz.risk.RiskService;
import com.tradezzz.risk.TradeRiskCheck;
import com.tradezzz.service.TradingService;
import com.tradezzz.session.TradingSession;
import com.tradezzz.session.TradingSessionController;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for TradingService's order pipeline: daily budget, BUY-only risk gate, execution and
 * the events published for each outcome.
 */
@ExtendWith(MockitoExtension.class)
class TradingServiceTest {

    private static final String USER = "user-1";
    private static final String SYMBOL = "BTC/USDT";

    @Mock
    private TradingSessionController sessionController;

    @Mock
    private RiskService riskService;

    @Mock
    private RateLimiter rateLimiter;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private ExchangeGateway liveGateway;

    private TradingService tradingService;

    @BeforeEach
    void setUp() {
        tradingService = new TradingService(
                sessionController,
                riskService,
                rateLimiter,
                eventPublisherHelper,
                Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    private void givenPaperSession() {
        TradingSession session = new TradingSession(
                USER, ExchangeId.BINANCE, liveGateway, null, Instant.parse("2025-03-01T09:00:00Z"));
        when(sessionController.requireSession(USER)).thenReturn(session);
    }

    private static OrderRequest marketOrder(OrderSide side, String quantity) {
        return OrderRequest.builder()
                .symbol(SYMBOL)
                .side(side)
                .type(OrderType.MARKET)
                .quantity(new BigDecimal(quantity))
                .build();
    }

    private static Order filled(OrderRequest request) {
        return Order.builder()
                .id("PAPER-1")
                .symbol(request.getSymbol())
                .side(request.getSide())
                .type(request.getType())
                .status(OrderStatus.FILLED)
                .quantity(request.getQuantity())
                .build();
    }

    @Nested
    @DisplayName("Placement")
    class Placement {

        @BeforeEach
        void allowDailyBudget() {
            givenPaperSession();
            when(rateLimiter.canPerformAction(USER, "order")).thenReturn(ActionDecision.allow());
        }

        @Test
        @DisplayName("Market buy is risk-checked at the ticker price, executed and published")
        void buy_happyPath() {
            OrderRequest request = marketOrder(OrderSide.BUY, "0.1");
            when(sessionController.getTicker(USER, SYMBOL))
                    .thenReturn(Ticker.builder().symbol(SYMBOL).price(new BigDecimal("50000")).build());
            when(riskService.checkTradeRisk(USER, SYMBOL, PositionSide.LONG, 0.1, 50000.0, 48000.0, 56000.0))
                    .thenReturn(TradeRiskCheck.allowed(List.of(), null));
            Order order = filled(request);
            when(sessionController.createOrder(USER, request)).thenReturn(order);

            Order placed = tradingService.placeOrder(USER, request, new BigDecimal("48000"), new BigDecimal("56000"));

            assertThat(placed).isSameAs(order);
            verify(rateLimiter).trackUsage(USER, "order");
            verify(eventPublisherHelper).publishOrderPlaced(tradingService, USER, order, TradingMode.PAPER);
        }

        @Test
        @DisplayName("A limit buy is risk-checked at its own price")
        void limitBuy_usesRequestPrice() {
            OrderRequest request = marketOrder(OrderSide.BUY, "1").toBuilder()
                    .type(OrderType.LIMIT)
                    .price(new BigDecimal("45000"))
                    .build();
            when(riskService.checkTradeRisk(USER, SYMBOL, PositionSide.LONG, 1.0, 45000.0, null, null))
                    .thenReturn(TradeRiskCheck.allowed(List.of(), null));
            when(sessionController.createOrder(USER, request)).thenReturn(filled(request));

            tradingService.placeOrder(USER, request, null, null);

            verify(sessionController, never()).getTicker(anyString(), anyString());
        }

        @Test
        @DisplayName("A clamped size replaces the requested quantity")
        void buy_clampedSize() {
            OrderRequest request = marketOrder(OrderSide.BUY, "1").toBuilder().price(new BigDecimal("50000")).build();
            when(riskService.checkTradeRisk(USER, SYMBOL, PositionSide.LONG, 1.0, 50000.0, null, null))
                    .thenReturn(TradeRiskCheck.allowed(List.of("Position size reduced"), 0.2));
            when(sessionController.createOrder(eq(USER), any(OrderRequest.class)))
                    .thenAnswer(invocation -> filled(invocation.getArgument(1)));

            Order placed = tradingService.placeOrder(USER, request, null, null);

            ArgumentCaptor<OrderRequest> sent = ArgumentCaptor.forClass(OrderRequest.class);
            verify(sessionController).createOrder(eq(USER), sent.capture());
            assertThat(sent.getValue().getQuantity()).isEqualByComparingTo("0.2");
            assertThat(placed.getQuantity()).isEqualByComparingTo("0.2");
        }

        @Test
        @DisplayName("A risk rejection stops the order and publishes a rejected snapshot")
        void buy_riskRejected() {
            OrderRequest request = marketOrder(OrderSide.BUY, "1").toBuilder().price(new BigDecimal("100")).build();
            when(riskService.checkTradeRisk(USER, SYMBOL, PositionSide.LONG, 1.0, 100.0, 95.0, 102.0))
                    .thenReturn(TradeRiskCheck.rejected("Risk/reward ratio 0.40 below minimum 1.5", List.of()));

            assertThatThrownBy(() -> tradingService.placeOrder(
                            USER, request, new BigDecimal("95"), new BigDecimal("102")))
                    .isInstanceOf(RiskRejectedException.class)
                    .hasMessage("Risk/reward ratio 0.40 below minimum 1.5");

            verify(sessionController, never()).createOrder(anyString(), any());
            verify(eventPublisherHelper).publishOrderRejected(eq(tradingService), eq(USER),
                    argThat(order -> order.getStatus() == OrderStatus.REJECTED
                            && order.getRejectReason().startsWith("Risk/reward")),
                    eq(TradingMode.PAPER));
            verify(rateLimiter, never()).trackUsage(anyString(), anyString());
        }

        @Test
        @DisplayName("Sells skip the risk gate")
        void sell_skipsRiskGate() {
            OrderRequest request = marketOrder(OrderSide.SELL, "0.5");
            when(sessionController.createOrder(USER, request)).thenReturn(filled(request));

            tradingService.placeOrder(USER, request, null, null);

            verifyNoInteractions(riskService);
        }

        @Test
        @DisplayName("Execution failures publish a rejection and propagate")
        void executionFailure() {
            OrderRequest request = marketOrder(OrderSide.SELL, "5");
            when(sessionController.createOrder(USER, request)).thenThrow(
                    new InsufficientBalanceException("BTC", new BigDecimal("5"), BigDecimal.ZERO));

            assertThatThrownBy(() -> tradingService.placeOrder(USER, request, null, null))
                    .isInstanceOf(InsufficientBalanceException.class);

            verify(eventPublisherHelper).publishOrderRejected(eq(tradingService), eq(USER),
                    argThat(order -> order.getStatus() == OrderStatus.REJECTED), eq(TradingMode.PAPER));
            verify(rateLimiter, never()).trackUsage(anyString(), anyString());
        }
    }

    @Nested
    @DisplayName("Budgets and sessions")
    class Budgets {

        @Test
        @DisplayName("A spent daily order budget is refused before execution")
        void dailyBudgetSpent() {
            givenPaperSession();
            when(rateLimiter.canPerformAction(USER, "order"))
                    .thenReturn(ActionDecision.deny("Daily limit reached for order. Upgrade your plan for higher limits."));
            when(rateLimiter.getLimitsForUser(USER)).thenReturn(TierLimits.forTier(SubscriptionTier.FREE));

            assertThatThrownBy(() -> tradingService.placeOrder(USER, marketOrder(OrderSide.BUY, "1"), null, null))
                    .isInstanceOf(RateLimitExceededException.class)
                    .hasMessageStartingWith("Daily limit reached for order")
                    .satisfies(e -> assertThat(((RateLimitExceededException) e).getRetryAfter())
                            .isEqualTo(14L * 3600));

            verify(eventPublisherHelper).publishRateLimitExceeded(tradingService, USER, "daily:order");
            verify(sessionController, never()).createOrder(anyString(), any());
        }

        @Test
        @DisplayName("Orders without a session fail")
        void noSession() {
            when(sessionController.requireSession(USER)).thenThrow(new NoSessionException());

            assertThatThrownBy(() -> tradingService.placeOrder(USER, marketOrder(OrderSide.BUY, "1"), null, null))
                    .isInstanceOf(NoSessionException.class);
            verifyNoInteractions(rateLimiter, riskService);
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("A successful cancel publishes the cancelled order")
        void cancel_publishes() {
            givenPaperSession();
            Order cancelled = Order.builder().id("PAPER-1").status(OrderStatus.CANCELLED).build();
            when(sessionController.cancelOrder(USER, "PAPER-1", SYMBOL)).thenReturn(true);
            when(sessionController.getOrder(USER, "PAPER-1", SYMBOL)).thenReturn(Optional.of(cancelled));

            assertThat(tradingService.cancelOrder(USER, "PAPER-1", SYMBOL)).isTrue();

            verify(eventPublisherHelper).publishOrderCancelled(tradingService, USER, cancelled, TradingMode.PAPER);
        }

        @Test
        @DisplayName("A refused cancel publishes nothing")
        void cancel_refused() {
            givenPaperSession();
            when(sessionController.cancelOrder(USER, "PAPER-1", SYMBOL)).thenReturn(false);

            assertThat(tradingService.cancelOrder(USER, "PAPER-1", SYMBOL)).isFalse();

            verifyNoInteractions(eventPublisherHelper);
        }
    }
}
