package com.tradezzz.session;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Process-local connection store. Contents are lost on restart.
 */
@Component
public class InMemoryExchangeConnectionStore implements ExchangeConnectionStore {

    private final Map<String, ExchangeConnection> connections = new ConcurrentHashMap<>();

    @Override
    public Optional<ExchangeConnection> findConnectionById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(connections.get(id));
    }

    @Override
    public ExchangeConnection save(ExchangeConnection connection) {
        ExchangeConnection stored = connection.getId() != null
                ? connection
                : connection.toBuilder().id("conn_" + UUID.randomUUID()).build();
        connections.put(stored.getId(), stored);
        return stored;
    }
}
