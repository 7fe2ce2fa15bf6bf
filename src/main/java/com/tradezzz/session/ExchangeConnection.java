package com.tradezzz.session;

import lombok.Builder;
import lombok.Value;

/**
 * A stored exchange connection. Key, secret and passphrase are encrypted at rest and only decrypted
 * when a session is created.
 */
@Value
@Builder(toBuilder = true)
public class ExchangeConnection {

    String id;
    String userId;

    /** Venue code, e.g. "binance". */
    String exchange;

    String encryptedApiKey;
    String encryptedApiSecret;

    /** Null for venues without a passphrase. */
    String encryptedPassphrase;

    boolean sandbox;
}
