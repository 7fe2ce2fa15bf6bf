package com.tradezzz.risk;

import com.tradezzz.config.RiskProperties;
import com.tradezzz.domain.enums.PositionSide;
import com.tradezzz.domain.enums.PositionSizingMethod;
import com.tradezzz.domain.enums.RiskPreset;
import com.tradezzz.domain.enums.WarningSeverity;
import com.tradezzz.risk.sizing.PositionSizeResult;
import com.tradezzz.risk.sizing.PositionSizerFactory;
import com.tradezzz.risk.sizing.PositionSizingContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Per-user front of the risk module. Owns one {@link RiskEngine} per user, created lazily with the
 * configured initial equity and default limits.
 *
 * <p>On top of the engine it keeps a bounded warning history (fed by every rejected or warned
 * trade check), applies limit presets and computes a 0-100 risk score.
 */
@Service
public class RiskService {

    private static final Logger log = LoggerFactory.getLogger(RiskService.class);

    // Score weights, summing to 100
    private static final int DAILY_LOSS_WEIGHT = 40;
    private static final int DRAWDOWN_WEIGHT = 30;
    private static final int POSITION_WEIGHT = 20;
    private static final int ACTIVITY_WEIGHT = 10;
    private static final int ACTIVITY_POINTS_PER_TRADE = 5;
    private static final double APPROACHING_LIMIT = 0.8;

    private final RiskProperties riskProperties;
    private final PositionSizerFactory sizerFactory;
    private final Clock clock;

    private final Map<String, RiskEngine> engines = new ConcurrentHashMap<>();
    private final Map<String, Deque<RiskWarning>> warningHistory = new ConcurrentHashMap<>();

    public RiskService(RiskProperties riskProperties, PositionSizerFactory sizerFactory, Clock clock) {
        this.riskProperties = riskProperties;
        this.sizerFactory = sizerFactory;
        this.clock = clock;
    }

    public RiskEngine engineFor(String userId) {
        return engines.computeIfAbsent(userId, id -> {
            log.debug("Creating risk engine for user {}", id);
            return new RiskEngine(
                    riskProperties.getInitialEquity(),
                    riskProperties.getLimits().toRiskLimits(),
                    sizerFactory,
                    clock);
        });
    }

    // ==================== Limits ====================

    public RiskLimits getLimits(String userId) {
        return engineFor(userId).getLimits();
    }

    public RiskLimits updateLimits(String userId, RiskLimits limits) {
        engineFor(userId).updateLimits(limits);
        return limits;
    }

    /**
     * Replaces the percentage and count limits with the preset's values. The correlation count and
     * the minimum risk/reward ratio are kept.
     */
    public RiskLimits applyPreset(String userId, RiskPreset preset) {
        RiskEngine engine = engineFor(userId);
        RiskLimits.RiskLimitsBuilder builder = engine.getLimits().toBuilder();
        switch (preset) {
            case CONSERVATIVE -> builder.maxPositionSize(0.02).maxDailyLoss(0.01).maxOpenPositions(5).maxDrawdown(0.05);
            case MODERATE -> builder.maxPositionSize(0.05).maxDailyLoss(0.03).maxOpenPositions(10).maxDrawdown(0.15);
            case AGGRESSIVE -> builder.maxPositionSize(0.10).maxDailyLoss(0.05).maxOpenPositions(20).maxDrawdown(0.25);
        }
        RiskLimits limits = builder.build();
        engine.updateLimits(limits);
        log.info("Applied {} risk preset for user {}", preset, userId);
        return limits;
    }

    // ==================== Checks and sizing ====================

    public TradeRiskCheck checkTradeRisk(String userId, String symbol, PositionSide direction, double size,
                                         double entryPrice, Double stopLoss, Double takeProfit) {
        TradeRiskCheck check = engineFor(userId).checkTradeRisk(symbol, direction, size, entryPrice, stopLoss, takeProfit);
        Instant now = clock.instant();
        if (!check.isAllowed()) {
            addWarning(userId, warning(RiskWarningType.TRADE_REJECTED, WarningSeverity.CRITICAL, check.getReason(), now));
        }
        for (String message : check.getWarnings()) {
            addWarning(userId, warning(RiskWarningType.TRADE_WARNING, WarningSeverity.WARNING, message, now));
        }
        return check;
    }

    public PositionSizeResult calculatePosition(String userId, PositionSizingMethod method, double riskPercentage,
                                                Double fixedAmount, Double volatility, Double avgVolatility) {
        PositionSizingContext.PositionSizingContextBuilder context =
                PositionSizingContext.builder().riskPercentage(riskPercentage);
        if (fixedAmount != null) {
            context.fixedAmount(fixedAmount);
        }
        if (volatility != null) {
            context.volatility(volatility);
        }
        if (avgVolatility != null) {
            context.avgVolatility(avgVolatility);
        }
        return engineFor(userId).calculatePosition(method, context);
    }

    public double calculateStopLoss(double entryPrice, PositionSide direction, double riskPercentage, Double atr) {
        return RiskCalculations.stopLoss(entryPrice, direction, riskPercentage, atr, RiskCalculations.DEFAULT_ATR_MULTIPLIER);
    }

    public double calculateTakeProfit(double entryPrice, double stopLoss, PositionSide direction, double riskRewardRatio) {
        return RiskCalculations.takeProfit(entryPrice, stopLoss, direction, riskRewardRatio);
    }

    // ==================== Positions ====================

    public RiskPosition openPosition(String userId, String symbol, PositionSide direction, double size,
                                     double entryPrice, Double stopLoss, Double takeProfit) {
        return engineFor(userId).openPosition(symbol, direction, size, entryPrice, stopLoss, takeProfit);
    }

    public Optional<RiskPosition> updatePosition(String userId, String positionId, double currentPrice) {
        return engineFor(userId).updatePosition(positionId, currentPrice);
    }

    public Optional<ClosedTrade> closePosition(String userId, String positionId, double exitPrice) {
        return engineFor(userId).closePosition(positionId, exitPrice);
    }

    public List<RiskPosition> getPositions(String userId) {
        return engineFor(userId).getPositions();
    }

    public List<ClosedTrade> getTrades(String userId) {
        return engineFor(userId).getTrades();
    }

    // ==================== Metrics ====================

    public RiskMetrics getMetrics(String userId) {
        return engineFor(userId).getMetrics();
    }

    public List<Double> getEquityCurve(String userId) {
        return engineFor(userId).getEquityCurve();
    }

    /**
     * Weighted blend of how close the user is to each limit, plus live warnings for daily loss or
     * drawdown past 80% of their limits.
     */
    public RiskScore getRiskScore(String userId) {
        RiskEngine engine = engineFor(userId);
        RiskMetrics metrics = engine.getMetrics();
        RiskLimits limits = engine.getLimits();
        int tradesToday = engine.countTradesClosedToday();
        Instant now = clock.instant();

        double dailyLoss = Math.abs(Math.min(0, metrics.getDailyPnlPercent()));
        double drawdown = metrics.getDrawdown().getCurrentDrawdownPercent();

        double dailyLossScore = capped(ratio(dailyLoss, limits.getMaxDailyLoss()));
        double drawdownScore = capped(ratio(drawdown, limits.getMaxDrawdown()));
        double positionScore = capped(ratio(metrics.getOpenPositions(), limits.getMaxOpenPositions()));
        double activityScore = Math.min(100, tradesToday * ACTIVITY_POINTS_PER_TRADE);

        int score = (int) Math.round((dailyLossScore * DAILY_LOSS_WEIGHT
                + drawdownScore * DRAWDOWN_WEIGHT
                + positionScore * POSITION_WEIGHT
                + activityScore * ACTIVITY_WEIGHT) / 100);

        List<RiskWarning> warnings = new ArrayList<>();
        if (dailyLoss > limits.getMaxDailyLoss() * APPROACHING_LIMIT) {
            warnings.add(warning(RiskWarningType.DAILY_LOSS,
                    dailyLoss > limits.getMaxDailyLoss() ? WarningSeverity.CRITICAL : WarningSeverity.WARNING,
                    String.format(Locale.ROOT, "Approaching daily loss limit (%.1f%%)", dailyLoss * 100), now));
        }
        if (drawdown > limits.getMaxDrawdown() * APPROACHING_LIMIT) {
            warnings.add(warning(RiskWarningType.DRAWDOWN,
                    drawdown > limits.getMaxDrawdown() ? WarningSeverity.CRITICAL : WarningSeverity.WARNING,
                    String.format(Locale.ROOT, "Drawdown at %.1f%%, limit is %.1f%%",
                            drawdown * 100, limits.getMaxDrawdown() * 100), now));
        }

        return RiskScore.builder()
                .score(score)
                .dailyLossScore(dailyLossScore)
                .drawdownScore(drawdownScore)
                .positionScore(positionScore)
                .activityScore(activityScore)
                .warnings(warnings)
                .build();
    }

    /** The most recent {@code limit} warnings, oldest first. */
    public List<RiskWarning> getWarnings(String userId, int limit) {
        Deque<RiskWarning> history = warningHistory.get(userId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            List<RiskWarning> all = new ArrayList<>(history);
            return new ArrayList<>(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    // ==================== End of day ====================

    @Scheduled(cron = "${tradezzz.risk.daily-return-cron:0 0 0 * * *}")
    public void recordDailyReturns() {
        engines.values().forEach(RiskEngine::recordDailyReturn);
        log.info("Recorded daily returns for {} risk engines", engines.size());
    }

    // ---- internals ----

    private void addWarning(String userId, RiskWarning warning) {
        Deque<RiskWarning> history = warningHistory.computeIfAbsent(userId, id -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(warning);
            while (history.size() > riskProperties.getWarningHistorySize()) {
                history.removeFirst();
            }
        }
    }

    private static RiskWarning warning(RiskWarningType type, WarningSeverity severity, String message, Instant at) {
        return RiskWarning.builder().type(type).severity(severity).message(message).timestamp(at).build();
    }

    private static double ratio(double value, double limit) {
        return limit > 0 ? value / limit * 100 : 0;
    }

    private static double capped(double score) {
        return Math.min(100, score);
    }
}
