package com.tradezzz.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradezzz.api.controller.TradingController;
import com.tradezzz.config.ApiResponseAdvice;
import com.tradezzz.domain.enums.OrderSide;
import com.tradezzz.domain.enums.OrderStatus;
import com.tradezzz.domain.enums.OrderType;
import com.tradezzz.domain.enums.TradingMode;
import com.tradezzz.domain.model.ExchangeCredentials;
import com.tradezzz.domain.model.Order;
import com.tradezzz.domain.model.OrderRequest;
import com.tradezzz.exception.GlobalExceptionHandler;
import com.tradezzz.exception.ModeSwitchException;
import com.tradezzz.exception.NoSessionException;
import com.tradezzz.exception.RateLimitExceededException;
import com.tradezzz.exception.RiskRejectedException;
import com.tradezzz.service.TradingService;
import com.tradezzz.session.ExchangeConnection;
import com.tradezzz.session.TradingSessionController;
import com.tradezzz.session.TradingState;
import java.math.BigDecimal;
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
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for TradingController, including the success envelope and the error
 * bodies produced by GlobalExceptionHandler.
 */
@ExtendWith(MockitoExtension.class)
class TradingControllerTest {

    private static final String USER = "user-1";
    private static final String USER_HEADER = "X-User-Id";

    private MockMvc mockMvc;

    @Mock
    private TradingSessionController sessionController;

    @Mock
    private TradingService tradingService;

    @BeforeEach
    void setUp() {
        TradingController controller = new TradingController(sessionController, tradingService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private static Order filledBuy() {
        return Order.builder()
                .id("PAPER-1")
                .symbol("BTC/USDT")
                .side(OrderSide.BUY)
                .type(OrderType.MARKET)
                .status(OrderStatus.FILLED)
                .quantity(new BigDecimal("0.5"))
                .filledQuantity(new BigDecimal("0.5"))
                .averagePrice(new BigDecimal("50000"))
                .build();
    }

    @Nested
    @DisplayName("Session endpoints")
    class Session {

        @Test
        @DisplayName("POST /api/trading/connections stores credentials and echoes only the connection id")
        void registerConnection() throws Exception {
            when(sessionController.registerConnection(eq(USER), eq("binance"), any(ExchangeCredentials.class)))
                    .thenReturn(ExchangeConnection.builder()
                            .id("conn-1")
                            .userId(USER)
                            .exchange("binance")
                            .encryptedApiKey("ZW5jcnlwdGVk")
                            .encryptedApiSecret("ZW5jcnlwdGVk")
                            .build());

            mockMvc.perform(post("/api/trading/connections")
                            .header(USER_HEADER, USER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"exchange":"binance","apiKey":"key-123","apiSecret":"secret-456"}
                                    """))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.id").value("conn-1"))
                    .andExpect(jsonPath("$.data.exchange").value("binance"))
                    .andExpect(content().string(not(containsString("secret-456"))))
                    .andExpect(content().string(not(containsString("ZW5jcnlwdGVk"))));

            ArgumentCaptor<ExchangeCredentials> credentials = ArgumentCaptor.forClass(ExchangeCredentials.class);
            verify(sessionController).registerConnection(eq(USER), eq("binance"), credentials.capture());
            assertThat(credentials.getValue().getApiKey()).isEqualTo("key-123");
            assertThat(credentials.getValue().getApiSecret()).isEqualTo("secret-456");
        }

        @Test
        @DisplayName("GET /api/trading/state returns the session snapshot")
        void getState() throws Exception {
            when(sessionController.getState(USER)).thenReturn(TradingState.builder()
                    .mode(TradingMode.PAPER)
                    .exchangeId("binance_paper")
                    .exchangeName("Binance (Paper)")
                    .connected(true)
                    .canTrade(true)
                    .build());

            mockMvc.perform(get("/api/trading/state").header(USER_HEADER, USER))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.mode").value("PAPER"))
                    .andExpect(jsonPath("$.data.exchangeId").value("binance_paper"))
                    .andExpect(jsonPath("$.data.canTrade").value(true));
        }

        @Test
        @DisplayName("PUT /api/trading/mode without acknowledgment is a 400")
        void switchMode_requiresAcknowledgment() throws Exception {
            when(sessionController.switchMode(USER, TradingMode.LIVE, false)).thenThrow(
                    new ModeSwitchException("Switching to live trading requires acknowledgment"));

            mockMvc.perform(put("/api/trading/mode")
                            .header(USER_HEADER, USER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"mode\":\"LIVE\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("ACKNOWLEDGMENT_REQUIRED"));
        }

        @Test
        @DisplayName("Requests without the user header are rejected")
        void missingUserHeader() throws Exception {
            mockMvc.perform(get("/api/trading/state"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.message").value("Missing required header: X-User-Id"));
        }

        @Test
        @DisplayName("Trading without a session is a 409")
        void noSession() throws Exception {
            when(sessionController.getBalances(USER)).thenThrow(new NoSessionException());

            mockMvc.perform(get("/api/trading/balances").header(USER_HEADER, USER))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error.code").value("NO_SESSION"))
                    .andExpect(jsonPath("$.error.message").value("Connect an exchange first before trading"));
        }
    }

    @Nested
    @DisplayName("Order endpoints")
    class Orders {

        @Test
        @DisplayName("POST /api/trading/orders passes stop and target to the pipeline and returns 201")
        void placeOrder() throws Exception {
            when(tradingService.placeOrder(eq(USER), any(OrderRequest.class), any(), any())).thenReturn(filledBuy());

            mockMvc.perform(post("/api/trading/orders")
                            .header(USER_HEADER, USER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"symbol":"BTC/USDT","side":"BUY","type":"MARKET","quantity":0.5,
                                     "stopLoss":48000,"takeProfit":56000}
                                    """))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.data.id").value("PAPER-1"))
                    .andExpect(jsonPath("$.data.status").value("FILLED"));

            ArgumentCaptor<OrderRequest> request = ArgumentCaptor.forClass(OrderRequest.class);
            ArgumentCaptor<BigDecimal> stopLoss = ArgumentCaptor.forClass(BigDecimal.class);
            verify(tradingService).placeOrder(eq(USER), request.capture(), stopLoss.capture(), any());
            assertThat(request.getValue().getQuantity()).isEqualByComparingTo("0.5");
            assertThat(stopLoss.getValue()).isEqualByComparingTo("48000");
        }

        @Test
        @DisplayName("Invalid order bodies fail validation before reaching the pipeline")
        void placeOrder_validation() throws Exception {
            mockMvc.perform(post("/api/trading/orders")
                            .header(USER_HEADER, USER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"symbol\":\"BTC/USDT\",\"side\":\"BUY\",\"type\":\"MARKET\",\"quantity\":-1}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.details.quantity").exists());

            verify(tradingService, never()).placeOrder(anyString(), any(), any(), any());
        }

        @Test
        @DisplayName("A risk rejection is a 422 carrying the rule that failed")
        void placeOrder_riskRejected() throws Exception {
            when(tradingService.placeOrder(eq(USER), any(OrderRequest.class), any(), any())).thenThrow(
                    new RiskRejectedException("Max open positions (10) reached", List.of()));

            mockMvc.perform(post("/api/trading/orders")
                            .header(USER_HEADER, USER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"symbol\":\"BTC/USDT\",\"side\":\"BUY\",\"type\":\"MARKET\",\"quantity\":1}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.error.code").value("RISK_REJECTED"))
                    .andExpect(jsonPath("$.error.message").value("Max open positions (10) reached"))
                    .andExpect(jsonPath("$.error.details.reason").value("Max open positions (10) reached"));
        }

        @Test
        @DisplayName("A spent order budget is a 429 with Retry-After")
        void placeOrder_rateLimited() throws Exception {
            when(tradingService.placeOrder(eq(USER), any(OrderRequest.class), any(), any())).thenThrow(
                    new RateLimitExceededException("Rate limit exceeded for orders", "orders", 10, 42));

            mockMvc.perform(post("/api/trading/orders")
                            .header(USER_HEADER, USER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"symbol\":\"BTC/USDT\",\"side\":\"SELL\",\"type\":\"MARKET\",\"quantity\":1}"))
                    .andExpect(status().isTooManyRequests())
                    .andExpect(header().string("Retry-After", "42"))
                    .andExpect(jsonPath("$.error.code").value("RATE_LIMITED"));
        }

        @Test
        @DisplayName("DELETE /api/trading/orders/{id} reports whether the order was cancelled")
        void cancelOrder() throws Exception {
            when(tradingService.cancelOrder(USER, "PAPER-1", null)).thenReturn(true);

            mockMvc.perform(delete("/api/trading/orders/PAPER-1").header(USER_HEADER, USER))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.orderId").value("PAPER-1"))
                    .andExpect(jsonPath("$.data.cancelled").value(true));
        }

        @Test
        @DisplayName("GET /api/trading/orders/open lists open orders rather than looking up an id")
        void openOrders() throws Exception {
            when(sessionController.getOpenOrders(USER, null)).thenReturn(List.of(filledBuy().toBuilder()
                    .status(OrderStatus.OPEN)
                    .type(OrderType.LIMIT)
                    .build()));

            mockMvc.perform(get("/api/trading/orders/open").header(USER_HEADER, USER))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data[0].status").value("OPEN"));

            verify(sessionController, never()).getOrder(anyString(), anyString(), isNull());
        }

        @Test
        @DisplayName("Unknown orders are a 404")
        void getOrder_notFound() throws Exception {
            when(sessionController.getOrder(USER, "PAPER-404", null)).thenReturn(Optional.empty());

            mockMvc.perform(get("/api/trading/orders/PAPER-404").header(USER_HEADER, USER))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error.message").value("Order not found: PAPER-404"));
        }
    }
}
