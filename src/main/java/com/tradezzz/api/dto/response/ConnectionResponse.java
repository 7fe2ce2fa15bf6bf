package com.tradezzz.api.dto.response;

import com.tradezzz.session.ExchangeConnection;

/** A stored exchange connection without its encrypted secrets. */
public record ConnectionResponse(String id, String exchange, boolean sandbox) {

    public static ConnectionResponse from(ExchangeConnection connection) {
        return new ConnectionResponse(connection.getId(), connection.getExchange(), connection.isSandbox());
    }
}
