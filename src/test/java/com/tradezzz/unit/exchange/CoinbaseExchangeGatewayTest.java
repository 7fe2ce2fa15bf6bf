package com.tradezzz.unit.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.tradezzz.domain.enums.OrderSide;
import com.tradezzz.domain.enums.OrderStatus;
import com.tradezzz.domain.enums.OrderType;
import com.tradezzz.domain.model.Balance;
import com.tradezzz.domain.model.ExchangeCredentials;
import com.tradezzz.domain.model.Order;
import com.tradezzz.domain.model.OrderRequest;
import com.tradezzz.domain.model.Ticker;
import com.tradezzz.domain.model.Trade;
import com.tradezzz.exception.ExchangeException;
import com.tradezzz.exchange.CoinbaseExchangeGateway;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HexFormat;
import java.util.List;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class CoinbaseExchangeGatewayTest {

    private static final String BASE_URL = "https://api.coinbase.com";
    private static final String API = BASE_URL + "/api/v3/brokerage";
    private static final long NOW_SECONDS = 1_700_000_000L;
    private static final String SECRET = "coinbase-secret";

    private MockRestServiceServer server;
    private CoinbaseExchangeGateway gateway;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        ExchangeCredentials credentials = ExchangeCredentials.builder()
                .apiKey("coinbase-key")
                .apiSecret(SECRET)
                .build();
        gateway = new CoinbaseExchangeGateway(
                credentials, builder.build(), Clock.fixed(Instant.ofEpochSecond(NOW_SECONDS), ZoneOffset.UTC));
    }

    private static String hmac(String payload) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
    }

    private void expectOrderLookup(String orderId, String status) {
        server.expect(requestTo(API + "/orders/historical/" + orderId))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"order":{"order_id":"%s","client_order_id":"c1","product_id":"BTC-USD","side":"BUY",
                          "order_type":"LIMIT","status":"%s",
                          "order_configuration":{"limit_limit_gtc":{"base_size":"0.1","limit_price":"40000"}},
                          "filled_size":"0","total_fees":"0","created_time":"2023-11-14T22:13:20Z"}}
                        """.formatted(orderId, status), MediaType.APPLICATION_JSON));
    }

    @Nested
    @DisplayName("Market data")
    class MarketData {

        @Test
        @DisplayName("Ticker combines the product ticker with 24h stats")
        void ticker() {
            server.expect(requestTo(API + "/products/BTC-USD/ticker"))
                    .andRespond(withSuccess("""
                            {"trades":[{"price":"42000"}],"best_bid":"41999","best_ask":"42001"}
                            """, MediaType.APPLICATION_JSON));
            server.expect(requestTo(API + "/products/BTC-USD/stats"))
                    .andRespond(withSuccess("""
                            {"open":"40000","high":"43000","low":"39000","volume":"1234","last":"42000"}
                            """, MediaType.APPLICATION_JSON));

            Ticker ticker = gateway.getTicker("BTC/USD");

            assertThat(ticker.getPrice()).isEqualByComparingTo("42000");
            assertThat(ticker.getBid()).isEqualByComparingTo("41999");
            assertThat(ticker.getAsk()).isEqualByComparingTo("42001");
            assertThat(ticker.getChange24h()).isEqualByComparingTo("2000");
            assertThat(ticker.getChangePercent24h()).isEqualByComparingTo("5");
            assertThat(ticker.getHigh24h()).isEqualByComparingTo("43000");
            server.verify();
        }

        @Test
        @DisplayName("Missing best bid and ask are quoted a basis point around last")
        void ticker_fallbackQuotes() {
            server.expect(requestTo(API + "/products/ETH-USD/ticker"))
                    .andRespond(withSuccess("{\"trades\":[{\"price\":\"2000\"}]}", MediaType.APPLICATION_JSON));
            server.expect(requestTo(API + "/products/ETH-USD/stats"))
                    .andRespond(withSuccess("{\"open\":\"0\"}", MediaType.APPLICATION_JSON));

            Ticker ticker = gateway.getTicker("ETH/USD");

            assertThat(ticker.getPrice()).isEqualByComparingTo("2000");
            assertThat(ticker.getBid()).isEqualByComparingTo("1999.8");
            assertThat(ticker.getAsk()).isEqualByComparingTo("2000.2");
            assertThat(ticker.getChangePercent24h()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Only online products are listed, as BASE/QUOTE")
        void tradingPairs() {
            server.expect(requestTo(API + "/products"))
                    .andRespond(withSuccess("""
                            {"products":[{"product_id":"BTC-USD","status":"online"},
                                         {"product_id":"OLD-USD","status":"delisted"}]}
                            """, MediaType.APPLICATION_JSON));

            assertThat(gateway.getTradingPairs()).containsExactly("BTC/USD");
        }
    }

    @Nested
    @DisplayName("Signed requests")
    class Signed {

        @Test
        @DisplayName("Accounts call is signed over timestamp, method and full path")
        void balances_signed() throws Exception {
            String timestamp = String.valueOf(NOW_SECONDS);
            server.expect(requestTo(API + "/accounts"))
                    .andExpect(header("CB-ACCESS-KEY", "coinbase-key"))
                    .andExpect(header("CB-ACCESS-TIMESTAMP", timestamp))
                    .andExpect(header("CB-ACCESS-SIGN", hmac(timestamp + "GET/api/v3/brokerage/accounts")))
                    .andRespond(withSuccess("""
                            {"accounts":[
                              {"currency":"BTC","available_balance":{"value":"1.0"},"hold":{"value":"0.5"}},
                              {"currency":"USD","available_balance":{"value":"0"},"hold":{"value":"0"}}]}
                            """, MediaType.APPLICATION_JSON));

            List<Balance> balances = gateway.getBalances();

            assertThat(balances).hasSize(1);
            assertThat(balances.get(0).getAvailable()).isEqualByComparingTo("1.0");
            assertThat(balances.get(0).getLocked()).isEqualByComparingTo("0.5");
            assertThat(balances.get(0).getTotal()).isEqualByComparingTo("1.5");
            server.verify();
        }

        @Test
        @DisplayName("Limit order is posted as limit_limit_gtc and re-read after creation")
        void createLimitOrder() {
            server.expect(requestTo(API + "/orders"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.product_id").value("BTC-USD"))
                    .andExpect(jsonPath("$.client_order_id").value("c1"))
                    .andExpect(jsonPath("$.order_configuration.limit_limit_gtc.base_size").value("0.1"))
                    .andExpect(jsonPath("$.order_configuration.limit_limit_gtc.limit_price").value("40000"))
                    .andRespond(withSuccess("""
                            {"success":true,"success_response":{"order_id":"o-1"}}
                            """, MediaType.APPLICATION_JSON));
            expectOrderLookup("o-1", "OPEN");

            Order order = gateway.createOrder(OrderRequest.builder()
                    .symbol("BTC/USD")
                    .side(OrderSide.BUY)
                    .type(OrderType.LIMIT)
                    .quantity(new BigDecimal("0.10"))
                    .price(new BigDecimal("40000"))
                    .clientOrderId("c1")
                    .build());

            assertThat(order.getId()).isEqualTo("o-1");
            assertThat(order.getSymbol()).isEqualTo("BTC/USD");
            assertThat(order.getType()).isEqualTo(OrderType.LIMIT);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.OPEN);
            assertThat(order.getQuantity()).isEqualByComparingTo("0.1");
            assertThat(order.getPrice()).isEqualByComparingTo("40000");
            server.verify();
        }

        @Test
        @DisplayName("Market buy is sized in quote using the given price")
        void createMarketBuy_quoteSize() {
            server.expect(requestTo(API + "/orders"))
                    .andExpect(jsonPath("$.order_configuration.market_market_ioc.quote_size").value("4200"))
                    .andRespond(withSuccess("""
                            {"success":true,"order_id":"o-2"}
                            """, MediaType.APPLICATION_JSON));
            expectOrderLookup("o-2", "FILLED");

            Order order = gateway.createOrder(OrderRequest.builder()
                    .symbol("BTC/USD")
                    .side(OrderSide.BUY)
                    .type(OrderType.MARKET)
                    .quantity(new BigDecimal("0.1"))
                    .price(new BigDecimal("42000"))
                    .build());

            assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
        }

        @Test
        @DisplayName("A refused order surfaces the failure reason")
        void createOrder_failure() {
            server.expect(requestTo(API + "/orders"))
                    .andRespond(withSuccess("""
                            {"success":false,"failure_reason":"INSUFFICIENT_FUND"}
                            """, MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> gateway.createOrder(OrderRequest.builder()
                            .symbol("BTC/USD")
                            .side(OrderSide.SELL)
                            .type(OrderType.MARKET)
                            .quantity(new BigDecimal("5"))
                            .build()))
                    .isInstanceOf(ExchangeException.class)
                    .hasMessage("Order failed: INSUFFICIENT_FUND");
        }

        @Test
        @DisplayName("Unknown orders are empty rather than errors")
        void getOrder_notFound() {
            server.expect(requestTo(API + "/orders/historical/missing"))
                    .andRespond(withResourceNotFound());

            assertThat(gateway.getOrder("missing", "BTC/USD")).isEmpty();
        }

        @Test
        @DisplayName("Cancel reports the per-order result")
        void cancel() {
            server.expect(requestTo(API + "/orders/batch_cancel"))
                    .andExpect(jsonPath("$.order_ids[0]").value("o-1"))
                    .andRespond(withSuccess("""
                            {"results":[{"success":false,"failure_reason":"UNKNOWN_CANCEL_ORDER"}]}
                            """, MediaType.APPLICATION_JSON));

            assertThat(gateway.cancelOrder("o-1", "BTC/USD")).isFalse();
        }

        @Test
        @DisplayName("Fills map to trades")
        void fills() {
            server.expect(requestTo(API + "/orders/historical/fills?limit=10&product_id=BTC-USD"))
                    .andRespond(withSuccess("""
                            {"fills":[{"entry_id":"f1","order_id":"o-1","product_id":"BTC-USD","side":"BUY",
                                       "size":"0.1","price":"40000","commission":"2.4",
                                       "trade_time":"2023-11-14T22:13:20Z"}]}
                            """, MediaType.APPLICATION_JSON));

            List<Trade> trades = gateway.getTrades("BTC/USD", 10);

            assertThat(trades).hasSize(1);
            assertThat(trades.get(0).getSymbol()).isEqualTo("BTC/USD");
            assertThat(trades.get(0).getFee()).isEqualByComparingTo("2.4");
            assertThat(trades.get(0).getTimestamp()).isEqualTo(Instant.ofEpochSecond(NOW_SECONDS));
        }
    }
}
