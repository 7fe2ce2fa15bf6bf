package com.tradezzz.simulator;

import com.tradezzz.domain.enums.OrderSide;
import com.tradezzz.domain.model.Balance;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Balances and cost-basis positions of one paper account.
 *
 * <p>Not thread-safe: {@link PaperExecutionEngine} serializes all access under its lock.
 *
 * <p>Buys add to the holding and recompute the weighted-average entry price. Sells reduce the
 * holding at an unchanged entry price, so the cost basis shrinks in proportion to the quantity
 * sold. A holding below the epsilon is dropped.
 */
class PaperLedger {

    private static final Logger log = LoggerFactory.getLogger(PaperLedger.class);

    private static final int PRICE_SCALE = 8;

    private final Map<String, BigDecimal> seedBalances;
    private final BigDecimal positionEpsilon;

    private final Map<String, Balance> balances = new LinkedHashMap<>();
    private final Map<String, Holding> holdings = new LinkedHashMap<>();

    PaperLedger(Map<String, BigDecimal> seedBalances, BigDecimal positionEpsilon) {
        this.seedBalances = Map.copyOf(seedBalances);
        this.positionEpsilon = positionEpsilon;
        reset();
    }

    /** Cost-basis aggregate of one symbol's fills. */
    record Holding(String symbol, BigDecimal quantity, BigDecimal entryPrice) {}

    void reset() {
        balances.clear();
        holdings.clear();
        seedBalances.forEach((asset, amount) -> balances.put(asset, Balance.of(asset, amount, BigDecimal.ZERO)));
    }

    BigDecimal available(String asset) {
        Balance balance = balances.get(asset);
        return balance == null ? BigDecimal.ZERO : balance.getAvailable();
    }

    Balance balance(String asset) {
        Balance balance = balances.get(asset);
        return balance == null ? null : copy(balance);
    }

    /** Assets with a non-zero available or locked amount. */
    List<Balance> nonZeroBalances() {
        List<Balance> result = new ArrayList<>();
        for (Balance balance : balances.values()) {
            if (balance.getAvailable().signum() != 0 || balance.getLocked().signum() != 0) {
                result.add(copy(balance));
            }
        }
        return result;
    }

    List<Holding> holdings() {
        return new ArrayList<>(holdings.values());
    }

    /**
     * Books a fill that has already passed the balance check: moves base and quote by the quantity
     * and notional and updates the holding.
     */
    void applyFill(String symbol, String base, String quote, OrderSide side,
                   BigDecimal quantity, BigDecimal price) {
        BigDecimal notional = quantity.multiply(price);
        if (side == OrderSide.BUY) {
            adjust(quote, notional.negate());
            adjust(base, quantity);
            addToHolding(symbol, quantity, price);
        } else {
            adjust(base, quantity.negate());
            adjust(quote, notional);
            reduceHolding(symbol, quantity);
        }
    }

    private void adjust(String asset, BigDecimal delta) {
        Balance current = balances.get(asset);
        BigDecimal available = current == null ? BigDecimal.ZERO : current.getAvailable();
        BigDecimal locked = current == null ? BigDecimal.ZERO : current.getLocked();
        balances.put(asset, Balance.of(asset, available.add(delta), locked));
    }

    private void addToHolding(String symbol, BigDecimal quantity, BigDecimal price) {
        Holding existing = holdings.get(symbol);
        if (existing == null) {
            holdings.put(symbol, new Holding(symbol, quantity, price));
            return;
        }
        BigDecimal newQuantity = existing.quantity().add(quantity);
        BigDecimal totalCost = existing.entryPrice().multiply(existing.quantity()).add(price.multiply(quantity));
        BigDecimal entryPrice = totalCost.divide(newQuantity, PRICE_SCALE, RoundingMode.HALF_UP);
        holdings.put(symbol, new Holding(symbol, newQuantity, entryPrice));
        log.debug("Paper holding {} increased to {} @ {}", symbol, newQuantity, entryPrice);
    }

    private void reduceHolding(String symbol, BigDecimal quantity) {
        Holding existing = holdings.get(symbol);
        if (existing == null) {
            return;
        }
        BigDecimal remaining = existing.quantity().subtract(quantity);
        if (remaining.compareTo(positionEpsilon) < 0) {
            holdings.remove(symbol);
            log.debug("Paper holding {} closed", symbol);
        } else {
            holdings.put(symbol, new Holding(symbol, remaining, existing.entryPrice()));
        }
    }

    private static Balance copy(Balance balance) {
        return Balance.of(balance.getAsset(), balance.getAvailable(), balance.getLocked());
    }
}
