package com.tradezzz.session;

import com.tradezzz.domain.enums.ExchangeId;
import com.tradezzz.domain.enums.TradingMode;
import com.tradezzz.exchange.ExchangeGateway;
import com.tradezzz.simulator.PaperExecutionEngine;
import java.time.Instant;

/**
 * One user's connected exchange: the guarded live gateway, the paper engine wrapping it and the
 * currently selected mode. Created on a verified connect and discarded on disconnect.
 */
public class TradingSession {

    private final String userId;
    private final ExchangeId exchangeId;
    private final ExchangeGateway liveGateway;
    private final PaperExecutionEngine paperEngine;
    private final Instant connectedAt;
    private volatile TradingMode mode = TradingMode.PAPER;

    public TradingSession(
            String userId,
            ExchangeId exchangeId,
            ExchangeGateway liveGateway,
            PaperExecutionEngine paperEngine,
            Instant connectedAt) {
        this.userId = userId;
        this.exchangeId = exchangeId;
        this.liveGateway = liveGateway;
        this.paperEngine = paperEngine;
        this.connectedAt = connectedAt;
    }

    /** The gateway matching the current mode. */
    public ExchangeGateway activeGateway() {
        return mode == TradingMode.LIVE ? liveGateway : paperEngine;
    }

    public String getUserId() {
        return userId;
    }

    public ExchangeId getExchangeId() {
        return exchangeId;
    }

    public ExchangeGateway getLiveGateway() {
        return liveGateway;
    }

    public PaperExecutionEngine getPaperEngine() {
        return paperEngine;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public TradingMode getMode() {
        return mode;
    }

    void setMode(TradingMode mode) {
        this.mode = mode;
    }
}
