package org.nowstart.backtester.runner;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.dto.BacktestDiagnostic;
import org.nowstart.backtester.data.dto.BacktestResult;
import org.nowstart.backtester.data.dto.BacktestSettings;
import org.nowstart.backtester.data.dto.PerformanceMetrics;
import org.nowstart.backtester.data.dto.SweepReport;
import org.nowstart.backtester.data.dto.SweepResult;
import org.nowstart.backtester.data.dto.TradeRecord;
import org.nowstart.backtester.data.property.BacktestProperties;
import org.nowstart.backtester.service.BacktestReportService;
import org.nowstart.backtester.service.BacktestService;
import org.nowstart.backtester.service.CsvBarDataService;
import org.nowstart.backtester.service.ParameterSweepService;
import org.nowstart.backtester.strategy.StrategyParamResolver;
import org.nowstart.backtester.strategy.StrategyParamResolver.ActiveStrategy;
import org.nowstart.backtester.strategy.core.BarSeries;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class BacktestRunner implements ApplicationRunner {

    private static final int TAIL_TRADE_COUNT = 10;

    private final BacktestProperties properties;
    private final CsvBarDataService csvBarDataService;
    private final StrategyParamResolver strategyParamResolver;
    private final BacktestService backtestService;
    private final ParameterSweepService parameterSweepService;
    private final BacktestReportService backtestReportService;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.enabled()) {
            log.info("backtester.enabled=false; pass --backtester.enabled=true to run");
            return;
        }

        BacktestSettings settings = properties.toSettings();
        ActiveStrategy active = strategyParamResolver.resolveActive();

        logSection("BACKTEST START");
        log.info("[Overview] data={} strategy={} params={} initialCash={} commissionRate={} commissionPerTrade={} fill={}",
                properties.dataPath(),
                active.name(),
                active.params(),
                settings.initialCash(),
                settings.commissionRate(),
                settings.commissionPerTrade(),
                settings.fillPriceConvention());

        BarSeries series = csvBarDataService.loadBars(Path.of(properties.dataPath()));
        log.info("[Overview] loaded bars={}", series.size());

        BacktestResult result = backtestService.run(series, active.name(), active.params(), settings);

        logSection("SUMMARY");
        logSummary(result);

        logSection("DIAGNOSTICS");
        logDiagnostics(result.diagnostics());

        logSection("TRADE TAIL");
        logTailTrades(result.trades());

        if (!properties.reportPath().isBlank()) {
            logSection("REPORT");
            backtestReportService.write(result, Path.of(properties.reportPath()));
        }

        if (properties.sweep().enabled()) {
            logSection("PARAMETER SWEEP");
            logSweep(parameterSweepService.sweep(
                    series,
                    active.name(),
                    properties.strategyParameters(),
                    settings,
                    properties.sweep()
            ));
        }
        logSection("BACKTEST END");
    }

    private void logSummary(BacktestResult result) {
        PerformanceMetrics metrics = result.metrics();
        log.info("[Summary] range={} warmup={} final={} return={} bh={} trades={} ignoredSignals={}",
                result.range(),
                result.warmupBars(),
                metrics.finalEquity(),
                formatPercent(metrics.returnPct()),
                formatPercent(metrics.buyAndHoldReturnPct()),
                metrics.tradeCount(),
                result.ignoredSignals());
        log.info("[Summary] winRate={} sharpe={} sortino={} mdd={} calmar={} exposure={} commissions={}",
                formatPercent(metrics.winRatePct()),
                formatRatio(metrics.sharpeRatio()),
                formatRatio(metrics.sortinoRatio()),
                formatPercent(metrics.maxDrawdownPct()),
                formatRatio(metrics.calmarRatio()),
                formatPercent(metrics.exposureTimePct()),
                metrics.commissionsPaid());
        log.info("[Summary] finalPosition={}", result.finalPosition().side());
    }

    private void logDiagnostics(List<BacktestDiagnostic> diagnostics) {
        log.info("[Diagnostics] count={}", diagnostics.size());
        for (BacktestDiagnostic diagnostic : diagnostics) {
            log.info("[Diagnostics] index={} ts={} code={} message={}",
                    diagnostic.barIndex(),
                    diagnostic.timestamp(),
                    diagnostic.code(),
                    diagnostic.message());
        }
    }

    private void logTailTrades(List<TradeRecord> trades) {
        int start = Math.max(0, trades.size() - TAIL_TRADE_COUNT);
        for (int i = start; i < trades.size(); i++) {
            TradeRecord trade = trades.get(i);
            log.info("[Trade][TAIL] side={} entry={}@{} exit={}@{} net={} return={} reason={}",
                    trade.side(),
                    trade.entryTime(),
                    trade.entryPrice(),
                    trade.exitTime(),
                    trade.exitPrice(),
                    trade.netProfit(),
                    formatPercent(trade.returnPct()),
                    trade.exitReason());
        }
    }

    private void logSweep(SweepReport report) {
        log.info("[Overview] combinations={} evaluated={} skipped={} failed={} timedOut={}",
                report.combinations(),
                report.evaluated(),
                report.skipped(),
                report.failed(),
                report.timedOut());
        List<SweepResult> rows = report.top();
        for (int i = 0; i < rows.size(); i++) {
            SweepResult row = rows.get(i);
            log.info("[Candidate {}/{}] calmar={} return={} mdd={} sharpe={} final={} trades={} params={}",
                    i + 1,
                    rows.size(),
                    formatRatio(row.calmarRatio()),
                    formatPercent(row.returnPct()),
                    formatPercent(row.maxDrawdownPct()),
                    formatRatio(row.sharpeRatio()),
                    row.finalEquity(),
                    row.tradeCount(),
                    row.params());
        }
    }

    private void logSection(String title) {
        log.info("========== {} ==========", title);
    }

    private String formatPercent(double pct) {
        if (!Double.isFinite(pct)) {
            return "NaN";
        }
        return String.format(Locale.US, "%.2f%%", pct);
    }

    private String formatRatio(double value) {
        if (!Double.isFinite(value)) {
            return "NaN";
        }
        return String.format(Locale.US, "%.3f", value);
    }
}
