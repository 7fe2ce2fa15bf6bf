package com.tradezzz.unit.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

import com.tradezzz.domain.enums.OrderSide;
import com.tradezzz.domain.enums.OrderStatus;
import com.tradezzz.domain.enums.OrderType;
import com.tradezzz.domain.model.Balance;
import com.tradezzz.domain.model.ExchangeCredentials;
import com.tradezzz.domain.model.Order;
import com.tradezzz.domain.model.OrderBook;
import com.tradezzz.domain.model.OrderRequest;
import com.tradezzz.domain.model.Ticker;
import com.tradezzz.exception.ExchangeException;
import com.tradezzz.exchange.BinanceExchangeGateway;
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

/**
 * Unit tests for BinanceExchangeGateway against a mocked REST server: symbol mapping, payload
 * parsing, request signing and error translation.
 */
class BinanceExchangeGatewayTest {

    private static final String BASE_URL = "https://api.binance.com";
    private static final long NOW_MILLIS = 1_700_000_000_000L;
    private static final String SECRET = "binance-secret";

    private MockRestServiceServer server;
    private BinanceExchangeGateway gateway;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        ExchangeCredentials credentials = ExchangeCredentials.builder()
                .apiKey("binance-key")
                .apiSecret(SECRET)
                .build();
        gateway = new BinanceExchangeGateway(
                credentials, builder.build(), Clock.fixed(Instant.ofEpochMilli(NOW_MILLIS), ZoneOffset.UTC), 5000);
    }

    private static String hmac(String payload) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
    }

    @Nested
    @DisplayName("Market data")
    class MarketData {

        @Test
        @DisplayName("Ticker maps BTC/USDT to BTCUSDT and parses 24h stats")
        void ticker() {
            server.expect(requestTo(BASE_URL + "/api/v3/ticker/24hr?symbol=BTCUSDT"))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess("""
                            {"symbol":"BTCUSDT","lastPrice":"50000.10","bidPrice":"50000.00","askPrice":"50000.20",
                             "volume":"1234.5","priceChange":"-250.5","priceChangePercent":"-0.498",
                             "highPrice":"51000","lowPrice":"49000","closeTime":1700000000000}
                            """, MediaType.APPLICATION_JSON));

            Ticker ticker = gateway.getTicker("BTC/USDT");

            assertThat(ticker.getSymbol()).isEqualTo("BTC/USDT");
            assertThat(ticker.getPrice()).isEqualByComparingTo("50000.10");
            assertThat(ticker.getBid()).isEqualByComparingTo("50000.00");
            assertThat(ticker.getAsk()).isEqualByComparingTo("50000.20");
            assertThat(ticker.getChange24h()).isEqualByComparingTo("-250.5");
            assertThat(ticker.getTimestamp()).isEqualTo(Instant.ofEpochMilli(NOW_MILLIS));
            server.verify();
        }

        @Test
        @DisplayName("Order book levels are price and quantity pairs")
        void orderBook() {
            server.expect(requestTo(BASE_URL + "/api/v3/depth?symbol=ETHUSDT&limit=5"))
                    .andRespond(withSuccess("""
                            {"bids":[["3000.1","1.5"],["3000.0","2"]],"asks":[["3000.2","0.7"]]}
                            """, MediaType.APPLICATION_JSON));

            OrderBook book = gateway.getOrderBook("ETH/USDT", 5);

            assertThat(book.getBids()).hasSize(2);
            assertThat(book.getBids().get(0).getPrice()).isEqualByComparingTo("3000.1");
            assertThat(book.getAsks().get(0).getQuantity()).isEqualByComparingTo("0.7");
        }

        @Test
        @DisplayName("Trading pairs keep only symbols in TRADING status and are cached")
        void tradingPairs_cached() {
            server.expect(requestTo(BASE_URL + "/api/v3/exchangeInfo"))
                    .andRespond(withSuccess("""
                            {"symbols":[
                              {"symbol":"BTCUSDT","status":"TRADING","baseAsset":"BTC","quoteAsset":"USDT"},
                              {"symbol":"LUNAUSDT","status":"BREAK","baseAsset":"LUNA","quoteAsset":"USDT"},
                              {"symbol":"ETHBTC","status":"TRADING","baseAsset":"ETH","quoteAsset":"BTC"}]}
                            """, MediaType.APPLICATION_JSON));

            List<String> pairs = gateway.getTradingPairs();

            assertThat(pairs).containsExactly("BTC/USDT", "ETH/BTC");
            assertThat(gateway.getTradingPairs()).isSameAs(pairs);
            server.verify();
        }

        @Test
        @DisplayName("Venue errors become ExchangeException with status and body")
        void venueError_translated() {
            server.expect(requestTo(BASE_URL + "/api/v3/ticker/24hr?symbol=FOOUSDT"))
                    .andRespond(withBadRequest()
                            .body("{\"code\":-1121,\"msg\":\"Invalid symbol.\"}")
                            .contentType(MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> gateway.getTicker("FOO/USDT"))
                    .isInstanceOf(ExchangeException.class)
                    .hasMessageContaining("HTTP 400")
                    .hasMessageContaining("Invalid symbol.");
        }

        @Test
        @DisplayName("Tickers for several symbols skip the ones that fail")
        void tickers_skipFailures() {
            server.expect(requestTo(BASE_URL + "/api/v3/ticker/24hr?symbol=BTCUSDT"))
                    .andRespond(withSuccess("{\"lastPrice\":\"50000\"}", MediaType.APPLICATION_JSON));
            server.expect(requestTo(BASE_URL + "/api/v3/ticker/24hr?symbol=FOOUSDT"))
                    .andRespond(withBadRequest());

            assertThat(gateway.getTickers(List.of("BTC/USDT", "FOO/USDT")))
                    .extracting(Ticker::getSymbol)
                    .containsExactly("BTC/USDT");
        }
    }

    @Nested
    @DisplayName("Signed requests")
    class Signed {

        @Test
        @DisplayName("Account call is signed over recvWindow and timestamp with the API key header")
        void balances_signed() throws Exception {
            String query = "recvWindow=5000&timestamp=" + NOW_MILLIS;
            server.expect(requestTo(BASE_URL + "/api/v3/account?" + query + "&signature=" + hmac(query)))
                    .andExpect(header("X-MBX-APIKEY", "binance-key"))
                    .andRespond(withSuccess("""
                            {"balances":[{"asset":"BTC","free":"0.5","locked":"0.1"},
                                         {"asset":"ETH","free":"0","locked":"0"}]}
                            """, MediaType.APPLICATION_JSON));

            List<Balance> balances = gateway.getBalances();

            assertThat(balances).hasSize(1);
            assertThat(balances.get(0).getAsset()).isEqualTo("BTC");
            assertThat(balances.get(0).getTotal()).isEqualByComparingTo("0.6");
            server.verify();
        }

        @Test
        @DisplayName("Market order response with fills yields average price and fee")
        void createMarketOrder() {
            server.expect(requestTo(startsWith(BASE_URL
                            + "/api/v3/order?symbol=BTCUSDT&side=BUY&quantity=0.5&type=MARKET&newOrderRespType=FULL"
                            + "&recvWindow=5000")))
                    .andExpect(method(HttpMethod.POST))
                    .andRespond(withSuccess("""
                            {"symbol":"BTCUSDT","orderId":28,"clientOrderId":"abc","transactTime":1700000000000,
                             "price":"0.00000000","origQty":"0.5","executedQty":"0.5","cummulativeQuoteQty":"25000",
                             "status":"FILLED","type":"MARKET","side":"BUY",
                             "fills":[{"price":"50000","qty":"0.5","commission":"0.0005","commissionAsset":"BTC"}]}
                            """, MediaType.APPLICATION_JSON));

            Order order = gateway.createOrder(OrderRequest.builder()
                    .symbol("BTC/USDT")
                    .side(OrderSide.BUY)
                    .type(OrderType.MARKET)
                    .quantity(new BigDecimal("0.50"))
                    .build());

            assertThat(order.getId()).isEqualTo("28");
            assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(order.getAveragePrice()).isEqualByComparingTo("50000");
            assertThat(order.getPrice()).isEqualByComparingTo("50000");
            assertThat(order.getFee()).isEqualByComparingTo("0.0005");
            assertThat(order.getFeeCurrency()).isEqualTo("BTC");
            server.verify();
        }

        @Test
        @DisplayName("Limit order sends GTC time in force and price")
        void createLimitOrder() {
            server.expect(requestTo(startsWith(BASE_URL
                            + "/api/v3/order?symbol=ETHUSDT&side=SELL&quantity=2&type=LIMIT&timeInForce=GTC&price=3500")))
                    .andRespond(withSuccess("""
                            {"symbol":"ETHUSDT","orderId":29,"clientOrderId":"x","transactTime":1700000000000,
                             "price":"3500","origQty":"2","executedQty":"0","cummulativeQuoteQty":"0",
                             "status":"NEW","type":"LIMIT","side":"SELL","fills":[]}
                            """, MediaType.APPLICATION_JSON));

            Order order = gateway.createOrder(OrderRequest.builder()
                    .symbol("ETH/USDT")
                    .side(OrderSide.SELL)
                    .type(OrderType.LIMIT)
                    .quantity(new BigDecimal("2"))
                    .price(new BigDecimal("3500"))
                    .build());

            assertThat(order.getStatus()).isEqualTo(OrderStatus.OPEN);
            assertThat(order.getType()).isEqualTo(OrderType.LIMIT);
            assertThat(order.getAveragePrice()).isNull();
        }

        @Test
        @DisplayName("Open orders without a symbol map venue symbols back to canonical form")
        void openOrders_canonicalSymbols() {
            server.expect(requestTo(startsWith(BASE_URL + "/api/v3/openOrders?recvWindow=5000")))
                    .andRespond(withSuccess("""
                            [{"symbol":"ETHBTC","orderId":7,"clientOrderId":"c","time":1700000000000,
                              "price":"0.05","origQty":"1","executedQty":"0","cummulativeQuoteQty":"0",
                              "status":"PARTIALLY_FILLED","type":"LIMIT","side":"BUY"}]
                            """, MediaType.APPLICATION_JSON));

            List<Order> orders = gateway.getOpenOrders(null);

            assertThat(orders).hasSize(1);
            assertThat(orders.get(0).getSymbol()).isEqualTo("ETH/BTC");
            assertThat(orders.get(0).getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
        }

        @Test
        @DisplayName("A rejected cancel returns false instead of failing")
        void cancel_clientError_false() {
            server.expect(requestTo(startsWith(BASE_URL + "/api/v3/order?symbol=BTCUSDT&orderId=99")))
                    .andExpect(method(HttpMethod.DELETE))
                    .andRespond(withBadRequest().body("{\"code\":-2011,\"msg\":\"Unknown order sent.\"}"));

            assertThat(gateway.cancelOrder("99", "BTC/USDT")).isFalse();
        }

        @Test
        @DisplayName("Server errors on cancel propagate")
        void cancel_serverError_propagates() {
            server.expect(requestTo(startsWith(BASE_URL + "/api/v3/order?symbol=BTCUSDT&orderId=99")))
                    .andRespond(withServerError());

            assertThatThrownBy(() -> gateway.cancelOrder("99", "BTC/USDT")).isInstanceOf(ExchangeException.class);
        }

        @Test
        @DisplayName("Cancel without a symbol is refused before any request")
        void cancel_requiresSymbol() {
            assertThatThrownBy(() -> gateway.cancelOrder("99", null))
                    .isInstanceOf(ExchangeException.class)
                    .hasMessage("Binance requires a symbol to cancel an order");
        }
    }

    @Nested
    @DisplayName("Connection")
    class Connection {

        @Test
        @DisplayName("Connect verifies credentials once")
        void connect_verifies() {
            server.expect(requestTo(startsWith(BASE_URL + "/api/v3/account")))
                    .andRespond(withSuccess("{\"balances\":[]}", MediaType.APPLICATION_JSON));

            gateway.connect();

            assertThat(gateway.isConnected()).isTrue();
            server.verify();
        }

        @Test
        @DisplayName("Rejected credentials fail the connect")
        void connect_rejected() {
            server.expect(requestTo(startsWith(BASE_URL + "/api/v3/account")))
                    .andRespond(withUnauthorizedRequest());

            assertThatThrownBy(() -> gateway.connect())
                    .isInstanceOf(ExchangeException.class)
                    .hasMessage("Binance rejected the API credentials");
            assertThat(gateway.isConnected()).isFalse();
        }
    }
}
