package com.tradezzz.risk;

import com.tradezzz.domain.enums.PositionSide;
import com.tradezzz.domain.enums.PositionSizingMethod;
import com.tradezzz.risk.sizing.PositionSizeResult;
import com.tradezzz.risk.sizing.PositionSizerFactory;
import com.tradezzz.risk.sizing.PositionSizingContext;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One user's risk book: limits, tracked positions, closed trades and the equity curve.
 *
 * <p>The equity curve starts at the initial equity and gains one point per closed trade. All
 * statistics in {@link #getMetrics()} derive from it. Every public method is synchronized, so a
 * single engine can be shared across request threads.
 */
public class RiskEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskEngine.class);

    private final double initialEquity;
    private final PositionSizerFactory sizerFactory;
    private final Clock clock;

    private RiskLimits limits;
    private double currentEquity;
    private final List<Double> equityCurve = new ArrayList<>();
    private final List<Double> dailyReturns = new ArrayList<>();
    private final Map<String, RiskPosition> positions = new LinkedHashMap<>();
    private final List<ClosedTrade> trades = new ArrayList<>();

    public RiskEngine(double initialEquity, RiskLimits limits, PositionSizerFactory sizerFactory, Clock clock) {
        this.initialEquity = initialEquity;
        this.currentEquity = initialEquity;
        this.limits = limits;
        this.sizerFactory = sizerFactory;
        this.clock = clock;
        this.equityCurve.add(initialEquity);
    }

    // ==================== Pre-trade gate ====================

    /**
     * Evaluates a proposed trade against the limits, in order: open-position count, position size
     * (clamped, not rejected), risk/reward, drawdown, daily loss, then duplicate symbol (warning only).
     * The first hard failure wins. When either stop or target is missing the risk/reward rule is skipped.
     */
    public synchronized TradeRiskCheck checkTradeRisk(String symbol, PositionSide direction, double size,
                                                      double entryPrice, Double stopLoss, Double takeProfit) {
        if (size <= 0 || entryPrice <= 0) {
            throw new IllegalArgumentException("Trade size and entry price must be positive");
        }
        List<String> warnings = new ArrayList<>();

        if (positions.size() >= limits.getMaxOpenPositions()) {
            return reject(symbol, String.format(Locale.ROOT, "Max open positions (%d) reached",
                    limits.getMaxOpenPositions()), warnings);
        }
        if (currentEquity <= 0) {
            return reject(symbol, "Account equity is depleted", warnings);
        }

        double adjustedSize = size;
        double positionPercent = size * entryPrice / currentEquity;
        if (positionPercent > limits.getMaxPositionSize()) {
            adjustedSize = limits.getMaxPositionSize() * currentEquity / entryPrice;
            warnings.add(String.format(Locale.ROOT, "Position size reduced from %.4f to %.4f (max %s%%)",
                    size, adjustedSize, percent(limits.getMaxPositionSize())));
        }

        if (stopLoss != null && takeProfit != null) {
            RiskRewardResult rr = RiskCalculations.riskReward(entryPrice, stopLoss, takeProfit);
            if (rr.getRiskRewardRatio() < limits.getMinRiskRewardRatio()) {
                return reject(symbol, String.format(Locale.ROOT, "Risk/reward ratio %.2f below minimum %s",
                        rr.getRiskRewardRatio(), plain(limits.getMinRiskRewardRatio())), warnings);
            }
        }

        DrawdownResult drawdown = RiskCalculations.drawdown(equityCurve);
        if (drawdown.getCurrentDrawdownPercent() >= limits.getMaxDrawdown()) {
            return reject(symbol, String.format(Locale.ROOT, "Current drawdown %.1f%% exceeds limit %s%%",
                    drawdown.getCurrentDrawdownPercent() * 100, percent(limits.getMaxDrawdown())), warnings);
        }

        if (dailyPnlPercent() <= -limits.getMaxDailyLoss()) {
            return reject(symbol, String.format(Locale.ROOT, "Daily loss limit (%s%%) reached",
                    percent(limits.getMaxDailyLoss())), warnings);
        }

        for (RiskPosition position : positions.values()) {
            if (position.getSymbol().equals(symbol)) {
                warnings.add("Already have open position in " + symbol);
                break;
            }
        }

        return TradeRiskCheck.allowed(warnings, adjustedSize != size ? adjustedSize : null);
    }

    private TradeRiskCheck reject(String symbol, String reason, List<String> warnings) {
        log.warn("Trade on {} rejected by risk gate: {}", symbol, reason);
        return TradeRiskCheck.rejected(reason, warnings);
    }

    // ==================== Sizing ====================

    /**
     * Sizes a trade from current equity. Kelly inputs come from closed-trade history, falling back
     * to even odds when there is none.
     */
    public synchronized PositionSizeResult calculatePosition(PositionSizingMethod method, double riskPercentage) {
        return calculatePosition(method, PositionSizingContext.builder().riskPercentage(riskPercentage));
    }

    /**
     * Sizes a trade with caller-supplied extras (fixed amount, volatility). Balance and Kelly inputs
     * are always overwritten from the engine's state.
     */
    public synchronized PositionSizeResult calculatePosition(PositionSizingMethod method,
                                                             PositionSizingContext.PositionSizingContextBuilder context) {
        TradeStats stats = RiskCalculations.tradeStats(pnls());
        PositionSizingContext resolved = context
                .accountBalance(currentEquity)
                .winRate(stats.getWinRate() > 0 ? stats.getWinRate() : 0.5)
                .avgWin(stats.getAvgWin() > 0 ? stats.getAvgWin() : 1)
                .avgLoss(stats.getAvgLoss() > 0 ? stats.getAvgLoss() : 1)
                .build();
        return sizerFactory.getSizer(method).size(resolved);
    }

    // ==================== Position lifecycle ====================

    public synchronized RiskPosition openPosition(String symbol, PositionSide direction, double size,
                                                  double entryPrice, Double stopLoss, Double takeProfit) {
        RiskPosition position = RiskPosition.builder()
                .id("pos_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12))
                .symbol(symbol)
                .direction(direction)
                .entryPrice(entryPrice)
                .currentPrice(entryPrice)
                .size(size)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .openedAt(clock.instant())
                .unrealizedPnl(0)
                .build();
        positions.put(position.getId(), position);
        log.info("Risk position {} opened: {} {} {} @ {}", position.getId(), direction, size, symbol, entryPrice);
        return position.toBuilder().build();
    }

    public synchronized Optional<RiskPosition> updatePosition(String id, double currentPrice) {
        RiskPosition position = positions.get(id);
        if (position == null) {
            return Optional.empty();
        }
        position.setCurrentPrice(currentPrice);
        position.setUnrealizedPnl(position.favourableMove(currentPrice) * position.getSize());
        return Optional.of(position.toBuilder().build());
    }

    /** Realizes the position's P&L into equity and appends the new equity to the curve. */
    public synchronized Optional<ClosedTrade> closePosition(String id, double exitPrice) {
        RiskPosition position = positions.remove(id);
        if (position == null) {
            return Optional.empty();
        }
        double move = position.favourableMove(exitPrice);
        double pnl = move * position.getSize();
        ClosedTrade trade = ClosedTrade.builder()
                .id("trade_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12))
                .symbol(position.getSymbol())
                .direction(position.getDirection())
                .entryPrice(position.getEntryPrice())
                .exitPrice(exitPrice)
                .size(position.getSize())
                .pnl(pnl)
                .pnlPercent(move / position.getEntryPrice())
                .openedAt(position.getOpenedAt())
                .closedAt(clock.instant())
                .build();
        trades.add(trade);
        currentEquity += pnl;
        equityCurve.add(currentEquity);
        log.info("Risk position {} closed at {}, pnl {}", id, exitPrice, pnl);
        return Optional.of(trade);
    }

    public synchronized List<RiskPosition> getPositions() {
        List<RiskPosition> result = new ArrayList<>();
        for (RiskPosition position : positions.values()) {
            result.add(position.toBuilder().build());
        }
        return result;
    }

    public synchronized Optional<RiskPosition> getPosition(String id) {
        RiskPosition position = positions.get(id);
        return position == null ? Optional.empty() : Optional.of(position.toBuilder().build());
    }

    public synchronized List<ClosedTrade> getTrades() {
        return List.copyOf(trades);
    }

    // ==================== Metrics ====================

    public synchronized RiskMetrics getMetrics() {
        double unrealized = 0;
        double usedMargin = 0;
        for (RiskPosition position : positions.values()) {
            unrealized += position.getUnrealizedPnl();
            usedMargin += position.getSize() * position.getEntryPrice();
        }
        List<Double> returns = RiskCalculations.returns(equityCurve);

        return RiskMetrics.builder()
                .totalEquity(currentEquity + unrealized)
                .availableCapital(currentEquity - usedMargin)
                .usedMargin(usedMargin)
                .marginUsagePercent(currentEquity > 0 ? usedMargin / currentEquity : 0)
                .unrealizedPnl(unrealized)
                .realizedPnl(currentEquity - initialEquity)
                .dailyPnl(dailyPnl())
                .dailyPnlPercent(dailyPnlPercent())
                .openPositions(positions.size())
                .drawdown(RiskCalculations.drawdown(equityCurve))
                .var95(RiskCalculations.valueAtRisk(returns, RiskCalculations.DEFAULT_CONFIDENCE))
                .cvar95(RiskCalculations.conditionalValueAtRisk(returns, RiskCalculations.DEFAULT_CONFIDENCE))
                .sharpeRatio(RiskCalculations.sharpeRatio(returns))
                .sortinoRatio(RiskCalculations.sortinoRatio(returns))
                .tradeStats(RiskCalculations.tradeStats(pnls()))
                .build();
    }

    public synchronized List<Double> getEquityCurve() {
        return List.copyOf(equityCurve);
    }

    /** End-of-day snapshot: the return between the last two equity points, or 0 without trades. */
    public synchronized void recordDailyReturn() {
        int n = equityCurve.size();
        if (n < 2) {
            dailyReturns.add(0.0);
            return;
        }
        double prev = equityCurve.get(n - 2);
        double curr = equityCurve.get(n - 1);
        dailyReturns.add(prev > 0 ? (curr - prev) / prev : 0.0);
    }

    public synchronized List<Double> getDailyReturns() {
        return List.copyOf(dailyReturns);
    }

    /** Trades closed since local midnight in the engine clock's zone. */
    public synchronized int countTradesClosedToday() {
        return tradesClosedToday().size();
    }

    // ==================== Limits ====================

    public synchronized RiskLimits getLimits() {
        return limits;
    }

    public synchronized void updateLimits(RiskLimits limits) {
        this.limits = limits;
        log.info("Risk limits updated: {}", limits);
    }

    public double getInitialEquity() {
        return initialEquity;
    }

    public synchronized double getCurrentEquity() {
        return currentEquity;
    }

    // ---- internals ----

    private List<Double> pnls() {
        List<Double> result = new ArrayList<>(trades.size());
        for (ClosedTrade trade : trades) {
            result.add(trade.getPnl());
        }
        return result;
    }

    private List<ClosedTrade> tradesClosedToday() {
        Instant midnight = LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
        List<ClosedTrade> result = new ArrayList<>();
        for (ClosedTrade trade : trades) {
            if (!trade.getClosedAt().isBefore(midnight)) {
                result.add(trade);
            }
        }
        return result;
    }

    private double dailyPnl() {
        double sum = 0;
        for (ClosedTrade trade : tradesClosedToday()) {
            sum += trade.getPnl();
        }
        return sum;
    }

    private double dailyPnlPercent() {
        return initialEquity > 0 ? dailyPnl() / initialEquity : 0;
    }

    /** Fraction rendered as a percent without float noise: 0.1 becomes "10". */
    private static String percent(double fraction) {
        return BigDecimal.valueOf(fraction).movePointRight(2).stripTrailingZeros().toPlainString();
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
