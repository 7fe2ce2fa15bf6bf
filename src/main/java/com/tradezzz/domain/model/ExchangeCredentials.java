package com.tradezzz.domain.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Decrypted API credentials for one exchange account, owned by exactly one user.
 *
 * <p>Read-only once a session is created. {@link #toString()} masks the key and
 * never includes the secret or passphrase, so instances are safe to pass to log statements.
 */
@Getter
@Builder
public class ExchangeCredentials {

    private final String apiKey;
    private final String apiSecret;
    private final String passphrase;

    /** Route requests to the venue's sandbox / testnet. */
    private final boolean sandbox;

    public static String maskApiKey(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }

    @Override
    public String toString() {
        return "ExchangeCredentials{apiKey=" + maskApiKey(apiKey) + ", sandbox=" + sandbox + "}";
    }
}
