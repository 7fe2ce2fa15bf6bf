package com.tradezzz.session;

import java.util.Optional;

/**
 * Storage of users' encrypted exchange connections.
 */
public interface ExchangeConnectionStore {

    Optional<ExchangeConnection> findConnectionById(String id);

    /** Stores the connection, assigning an id when it has none. */
    ExchangeConnection save(ExchangeConnection connection);
}
