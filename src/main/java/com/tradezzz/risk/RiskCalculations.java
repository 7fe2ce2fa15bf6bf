package com.tradezzz.risk;

import com.tradezzz.domain.enums.PositionSide;
import java.util.List;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.moment.Variance;

/**
 * Stateless risk formulas over plain double series.
 *
 * <p>Returns are simple period returns ({@code (curr - prev) / prev}). Annualized ratios assume
 * 252 periods per year and a 2% risk-free rate unless told otherwise.
 */
public final class RiskCalculations {

    public static final double DEFAULT_RISK_FREE_RATE = 0.02;
    public static final int PERIODS_PER_YEAR = 252;
    public static final double DEFAULT_CONFIDENCE = 0.95;
    public static final double DEFAULT_ATR_MULTIPLIER = 2.0;

    // Deviations below this are rounding noise from a constant series
    private static final double FLAT_TOLERANCE = 1e-15;

    private RiskCalculations() {}

    // ---- Sizing inputs ----

    /**
     * Full Kelly fraction {@code (b*p - q) / b} with {@code b = avgWin / avgLoss}, clamped to [0, 1].
     * Invalid inputs (non-positive average loss, win rate outside [0, 1]) yield 0.
     */
    public static double kellyFraction(double winRate, double avgWin, double avgLoss) {
        if (avgLoss <= 0 || winRate < 0 || winRate > 1) {
            return 0;
        }
        double b = avgWin / avgLoss;
        if (b <= 0) {
            return 0;
        }
        double kelly = (b * winRate - (1 - winRate)) / b;
        return Math.min(1, Math.max(0, kelly));
    }

    public static RiskRewardResult riskReward(double entryPrice, double stopLoss, double takeProfit) {
        double risk = Math.abs(entryPrice - stopLoss);
        double reward = Math.abs(takeProfit - entryPrice);
        double ratio = risk > 0 ? reward / risk : 0;
        return RiskRewardResult.builder()
                .riskAmount(risk)
                .rewardAmount(reward)
                .riskRewardRatio(ratio)
                .breakEvenWinRate(ratio > 0 ? 1 / (1 + ratio) : 1)
                .build();
    }

    // ---- Tail risk ----

    /** Historical VaR: the negated return at the {@code (1 - confidence)} percentile. */
    public static double valueAtRisk(List<Double> returns, double confidence) {
        if (returns.isEmpty()) {
            return 0;
        }
        double[] sorted = sorted(returns);
        int index = Math.max(0, (int) Math.floor((1 - confidence) * sorted.length));
        return -sorted[index];
    }

    /** Historical CVaR: the negated mean of the returns at or below the VaR cutoff. */
    public static double conditionalValueAtRisk(List<Double> returns, double confidence) {
        if (returns.isEmpty()) {
            return 0;
        }
        double[] sorted = sorted(returns);
        int cutoff = Math.max(1, (int) Math.floor((1 - confidence) * sorted.length));
        double sum = 0;
        for (int i = 0; i < cutoff; i++) {
            sum += sorted[i];
        }
        return -(sum / cutoff);
    }

    /**
     * Walks the curve tracking the running peak. The maximum drawdown is the deepest relative fall
     * from any peak; the current drawdown compares the last value against the curve's overall high.
     */
    public static DrawdownResult drawdown(List<Double> equityCurve) {
        if (equityCurve.isEmpty()) {
            return DrawdownResult.empty();
        }
        double first = equityCurve.get(0);
        double peak = first;
        double overallHigh = first;
        double maxDrawdown = 0;
        double maxDrawdownPercent = 0;
        double peakValue = first;
        double troughValue = first;

        for (double value : equityCurve) {
            if (value > peak) {
                peak = value;
            }
            overallHigh = Math.max(overallHigh, value);
            double drawdown = peak - value;
            double percent = peak > 0 ? drawdown / peak : 0;
            if (percent > maxDrawdownPercent) {
                maxDrawdown = drawdown;
                maxDrawdownPercent = percent;
                peakValue = peak;
                troughValue = value;
            }
        }

        double last = equityCurve.get(equityCurve.size() - 1);
        double currentDrawdown = overallHigh - last;
        return DrawdownResult.builder()
                .maxDrawdown(maxDrawdown)
                .maxDrawdownPercent(maxDrawdownPercent)
                .currentDrawdown(currentDrawdown)
                .currentDrawdownPercent(overallHigh > 0 ? currentDrawdown / overallHigh : 0)
                .peakValue(peakValue)
                .troughValue(troughValue)
                .build();
    }

    // ---- Risk-adjusted return ----

    public static double sharpeRatio(List<Double> returns) {
        return sharpeRatio(returns, DEFAULT_RISK_FREE_RATE, PERIODS_PER_YEAR);
    }

    /** Annualized excess return over annualized sample standard deviation. 0 with fewer than two returns. */
    public static double sharpeRatio(List<Double> returns, double riskFreeRate, int periodsPerYear) {
        if (returns.size() < 2) {
            return 0;
        }
        DescriptiveStatistics stats = statistics(returns);
        double stdDev = stats.getStandardDeviation();
        if (stdDev < FLAT_TOLERANCE) {
            return 0;
        }
        return (stats.getMean() * periodsPerYear - riskFreeRate) / (stdDev * Math.sqrt(periodsPerYear));
    }

    public static double sortinoRatio(List<Double> returns) {
        return sortinoRatio(returns, DEFAULT_RISK_FREE_RATE, PERIODS_PER_YEAR);
    }

    /**
     * Like {@link #sharpeRatio(List, double, int)} but divides by the downside deviation, the root
     * mean square of the negative returns. Infinite when no return is negative.
     */
    public static double sortinoRatio(List<Double> returns, double riskFreeRate, int periodsPerYear) {
        if (returns.size() < 2) {
            return 0;
        }
        double[] downside = returns.stream().mapToDouble(Double::doubleValue).filter(r -> r < 0).toArray();
        if (downside.length == 0) {
            return Double.POSITIVE_INFINITY;
        }
        double downsideDeviation = Math.sqrt(StatUtils.sumSq(downside) / downside.length);
        if (downsideDeviation == 0) {
            return 0;
        }
        return (statistics(returns).getMean() * periodsPerYear - riskFreeRate) / (downsideDeviation * Math.sqrt(periodsPerYear));
    }

    // ---- Trade statistics ----

    public static TradeStats tradeStats(List<Double> pnls) {
        if (pnls.isEmpty()) {
            return TradeStats.empty();
        }
        int wins = 0;
        int losses = 0;
        double totalWin = 0;
        double totalLoss = 0;
        for (double pnl : pnls) {
            if (pnl > 0) {
                wins++;
                totalWin += pnl;
            } else if (pnl < 0) {
                losses++;
                totalLoss += -pnl;
            }
        }
        double avgWin = wins > 0 ? totalWin / wins : 0;
        double avgLoss = losses > 0 ? totalLoss / losses : 0;
        double winRate = (double) wins / pnls.size();
        double profitFactor;
        if (totalLoss > 0) {
            profitFactor = totalWin / totalLoss;
        } else {
            profitFactor = totalWin > 0 ? Double.POSITIVE_INFINITY : 0;
        }
        return TradeStats.builder()
                .totalTrades(pnls.size())
                .winningTrades(wins)
                .losingTrades(losses)
                .winRate(winRate)
                .avgWin(avgWin)
                .avgLoss(avgLoss)
                .profitFactor(profitFactor)
                .expectancy(winRate * avgWin - (1 - winRate) * avgLoss)
                .build();
    }

    /** Period-over-period returns of a value series. A non-positive previous value yields 0. */
    public static List<Double> returns(List<Double> values) {
        if (values.size() < 2) {
            return List.of();
        }
        Double[] result = new Double[values.size() - 1];
        for (int i = 1; i < values.size(); i++) {
            double prev = values.get(i - 1);
            result[i - 1] = prev > 0 ? (values.get(i) - prev) / prev : 0.0;
        }
        return List.of(result);
    }

    // ---- Cross-series ----

    /** Pearson correlation over the common prefix. 0 when either side is flat or too short. */
    public static double correlation(List<Double> first, List<Double> second) {
        int n = Math.min(first.size(), second.size());
        if (n < 2) {
            return 0;
        }
        double[] x = toArray(first.subList(0, n));
        double[] y = toArray(second.subList(0, n));
        Variance variance = new Variance();
        if (variance.evaluate(x) < FLAT_TOLERANCE || variance.evaluate(y) < FLAT_TOLERANCE) {
            return 0;
        }
        return new PearsonsCorrelation().correlation(x, y);
    }

    /** Beta of an asset against the market. Defaults to 1 when it cannot be estimated. */
    public static double beta(List<Double> assetReturns, List<Double> marketReturns) {
        int n = Math.min(assetReturns.size(), marketReturns.size());
        if (n < 2) {
            return 1;
        }
        double[] asset = toArray(assetReturns.subList(0, n));
        double[] market = toArray(marketReturns.subList(0, n));
        double marketVariance = new Variance().evaluate(market);
        if (marketVariance < FLAT_TOLERANCE) {
            return 1;
        }
        return new Covariance().covariance(asset, market) / marketVariance;
    }

    // ---- Exit levels ----

    /**
     * Stop price for an entry. With a positive ATR the stop sits {@code atr * multiplier} away,
     * otherwise {@code riskPercentage} of the entry price away.
     */
    public static double stopLoss(double entryPrice, PositionSide direction, double riskPercentage,
                                  Double atr, double atrMultiplier) {
        if (atr != null && atr > 0) {
            double distance = atr * atrMultiplier;
            return direction == PositionSide.LONG ? entryPrice - distance : entryPrice + distance;
        }
        return direction == PositionSide.LONG
                ? entryPrice * (1 - riskPercentage)
                : entryPrice * (1 + riskPercentage);
    }

    /** Target price at {@code riskRewardRatio} times the entry-to-stop distance. */
    public static double takeProfit(double entryPrice, double stopLoss, PositionSide direction, double riskRewardRatio) {
        double reward = Math.abs(entryPrice - stopLoss) * riskRewardRatio;
        return direction == PositionSide.LONG ? entryPrice + reward : entryPrice - reward;
    }

    private static DescriptiveStatistics statistics(List<Double> values) {
        return new DescriptiveStatistics(toArray(values));
    }

    private static double[] sorted(List<Double> values) {
        return statistics(values).getSortedValues();
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
