package com.tradezzz.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Endpoints and HTTP timeouts for the venue REST APIs. Binds to {@code tradezzz.exchange.*}.
 *
 * <p>Each venue adapter gets its own {@link RestClient} built from these settings, pointed at either
 * the production or the sandbox base URL depending on the connection's credentials.
 */
@Configuration
@ConfigurationProperties(prefix = "tradezzz.exchange")
@Getter
@Setter
public class ExchangeProperties {

    private Venue binance = new Venue("https://api.binance.com", "https://testnet.binance.vision");

    private Venue coinbase = new Venue("https://api.coinbase.com", "https://api-sandbox.coinbase.com");

    @Getter
    @Setter
    public static class Venue {

        private String baseUrl;

        private String sandboxUrl;

        /** Connection timeout in milliseconds. */
        private int connectTimeout = 5000;

        /** Read timeout in milliseconds. */
        private int readTimeout = 10000;

        /** Signed-request validity window in milliseconds. Only Binance reads it. */
        private long recvWindow = 5000;

        public Venue() {}

        public Venue(String baseUrl, String sandboxUrl) {
            this.baseUrl = baseUrl;
            this.sandboxUrl = sandboxUrl;
        }

        public RestClient.Builder restClientBuilder(boolean sandbox) {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(connectTimeout);
            requestFactory.setReadTimeout(readTimeout);
            return RestClient.builder()
                    .baseUrl(sandbox && sandboxUrl != null ? sandboxUrl : baseUrl)
                    .requestFactory(requestFactory);
        }
    }
}
