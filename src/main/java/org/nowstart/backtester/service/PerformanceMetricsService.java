package org.nowstart.backtester.service;

import java.util.List;
import org.nowstart.backtester.data.dto.BacktestSettings;
import org.nowstart.backtester.data.dto.EquityPoint;
import org.nowstart.backtester.data.dto.PerformanceMetrics;
import org.nowstart.backtester.data.dto.TradeRecord;
import org.nowstart.backtester.data.type.PositionSide;
import org.nowstart.backtester.strategy.core.BarSeries;
import org.springframework.stereotype.Service;

/**
 * Derives run statistics from the trade log and the per-bar equity curve.
 *
 * <p>Returns are per bar, annualized with {@link BacktestSettings#annualizationPeriods()}. Ratios that are
 * undefined (no trades, zero deviation, zero drawdown) are reported as 0.
 */
@Service
public class PerformanceMetricsService {

    public PerformanceMetrics calculate(
            List<TradeRecord> trades,
            List<EquityPoint> equityCurve,
            BarSeries series,
            BacktestSettings settings,
            double commissionsPaid
    ) {
        if (trades == null || equityCurve == null || series == null || settings == null) {
            throw new IllegalArgumentException("trades, equityCurve, series, and settings are required");
        }

        double initialCash = settings.initialCash();
        int periods = settings.annualizationPeriods();
        double[] equity = equityCurve.stream().mapToDouble(EquityPoint::equity).toArray();
        double finalEquity = equity.length == 0 ? initialCash : equity[equity.length - 1];

        double[] returns = barReturns(equity);
        double mean = mean(returns);
        double stdev = sampleStdev(returns, mean);
        double downside = downsideDeviation(returns);
        double annualFactor = Math.sqrt(periods);

        double sharpe = returns.length < 2 || stdev == 0.0 ? 0.0 : mean / stdev * annualFactor;
        double sortino = downside == 0.0 ? 0.0 : mean / downside * annualFactor;
        double annualizedReturn = annualizedReturn(equity, periods);
        double annualizedVolatility = returns.length < 2 ? 0.0 : stdev * annualFactor;

        Drawdown drawdown = drawdown(equity);
        double calmar = drawdown.maxDrawdown() == 0.0 ? 0.0 : annualizedReturn / Math.abs(drawdown.maxDrawdown());

        int wins = 0;
        double best = 0.0;
        double worst = 0.0;
        double sumReturnPct = 0.0;
        double grossWins = 0.0;
        double grossLosses = 0.0;
        for (int i = 0; i < trades.size(); i++) {
            TradeRecord trade = trades.get(i);
            if (trade.isWin()) {
                wins++;
                grossWins += trade.netProfit();
            } else {
                grossLosses += trade.netProfit();
            }
            best = i == 0 ? trade.returnPct() : Math.max(best, trade.returnPct());
            worst = i == 0 ? trade.returnPct() : Math.min(worst, trade.returnPct());
            sumReturnPct += trade.returnPct();
        }
        int tradeCount = trades.size();
        double winRate = tradeCount == 0 ? 0.0 : wins * 100.0 / tradeCount;
        double avgTrade = tradeCount == 0 ? 0.0 : sumReturnPct / tradeCount;
        double profitFactor = grossLosses == 0.0 ? 0.0 : grossWins / Math.abs(grossLosses);

        return new PerformanceMetrics(
                finite(winRate),
                finite(sharpe),
                finite(sortino),
                finite(drawdown.maxDrawdown() * 100.0),
                finite(calmar),
                finite((finalEquity / initialCash - 1.0) * 100.0),
                finite(finalEquity),
                finite(drawdown.peak() == 0.0 ? initialCash : drawdown.peak()),
                finite(annualizedReturn * 100.0),
                finite(annualizedVolatility * 100.0),
                finite(buyAndHoldReturnPct(series)),
                finite(exposureTimePct(equityCurve)),
                tradeCount,
                finite(best),
                finite(worst),
                finite(avgTrade),
                finite(profitFactor),
                drawdown.durationBars(),
                finite(commissionsPaid)
        );
    }

    static double[] barReturns(double[] equity) {
        if (equity.length < 2) {
            return new double[0];
        }
        double[] returns = new double[equity.length - 1];
        for (int i = 1; i < equity.length; i++) {
            returns[i - 1] = equity[i - 1] == 0.0 ? 0.0 : equity[i] / equity[i - 1] - 1.0;
        }
        return returns;
    }

    /**
     * Compounded per-bar growth scaled to a year: {@code (final / first)^(periods / bars) - 1}.
     */
    static double annualizedReturn(double[] equity, int periods) {
        if (equity.length < 2 || equity[0] <= 0.0) {
            return 0.0;
        }
        double ratio = equity[equity.length - 1] / equity[0];
        if (ratio <= 0.0) {
            return -1.0;
        }
        return Math.pow(ratio, periods / (double) (equity.length - 1)) - 1.0;
    }

    static Drawdown drawdown(double[] equity) {
        double peak = 0.0;
        double maxDrawdown = 0.0;
        int duration = 0;
        int longest = 0;
        for (double value : equity) {
            if (value >= peak) {
                peak = value;
                duration = 0;
                continue;
            }
            duration++;
            longest = Math.max(longest, duration);
            if (peak > 0.0) {
                maxDrawdown = Math.min(maxDrawdown, value / peak - 1.0);
            }
        }
        return new Drawdown(maxDrawdown, peak, longest);
    }

    private double buyAndHoldReturnPct(BarSeries series) {
        if (series.isEmpty()) {
            return 0.0;
        }
        return (series.last().close() / series.get(0).close() - 1.0) * 100.0;
    }

    private double exposureTimePct(List<EquityPoint> equityCurve) {
        if (equityCurve.isEmpty()) {
            return 0.0;
        }
        long exposed = equityCurve.stream().filter(point -> point.side() != PositionSide.FLAT).count();
        return exposed * 100.0 / equityCurve.size();
    }

    private static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    private static double sampleStdev(double[] values, double mean) {
        if (values.length < 2) {
            return 0.0;
        }
        double sumSq = 0.0;
        for (double value : values) {
            double diff = value - mean;
            sumSq += diff * diff;
        }
        return Math.sqrt(sumSq / (values.length - 1));
    }

    private static double downsideDeviation(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sumSq = 0.0;
        for (double value : values) {
            double downside = Math.min(value, 0.0);
            sumSq += downside * downside;
        }
        return Math.sqrt(sumSq / values.length);
    }

    private static double finite(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    record Drawdown(double maxDrawdown, double peak, int durationBars) {
    }
}
