package org.nowstart.backtester.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.dto.BacktestSettings;
import org.nowstart.backtester.data.dto.SweepReport;
import org.nowstart.backtester.data.dto.SweepResult;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.property.BacktestProperties;
import org.nowstart.backtester.strategy.StrategyRegistry;
import org.nowstart.backtester.strategy.core.BarSeries;
import org.nowstart.backtester.strategy.core.StrategyParams;
import org.nowstart.backtester.strategy.core.TradingStrategyEngine;
import org.springframework.stereotype.Service;

/**
 * Runs one backtest per grid combination on a bounded pool and keeps the best K by Calmar ratio,
 * then return, then final equity.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParameterSweepService {

    private static final long PROGRESS_LOG_INTERVAL_SECONDS = 10L;
    private static final long TERMINATION_WAIT_SECONDS = 5L;

    private final BacktestService backtestService;
    private final StrategyRegistry strategyRegistry;

    public SweepReport sweep(
            BarSeries series,
            String strategyName,
            Map<String, Double> baseOverrides,
            BacktestSettings settings,
            BacktestProperties.Sweep sweep
    ) {
        if (series == null || settings == null || sweep == null) {
            throw new IllegalArgumentException("series, settings, and sweep are required");
        }
        TradingStrategyEngine<? extends StrategyParams> engine = strategyRegistry.getRequired(strategyName);
        ParameterGrid grid = ParameterGrid.parse(sweep.axes());
        long total = grid.size();

        List<Callable<SweepResult>> tasks = new ArrayList<>();
        int skipped = 0;
        long startedAtNanos = System.nanoTime();
        long logIntervalNanos = TimeUnit.SECONDS.toNanos(PROGRESS_LOG_INTERVAL_SECONDS);
        AtomicLong processed = new AtomicLong(0L);
        AtomicLong nextLogAtNanos = new AtomicLong(startedAtNanos + logIntervalNanos);

        for (long index = 0; index < total; index++) {
            Map<String, Double> overrides = merge(baseOverrides, grid.combination(index));
            StrategyParams params;
            try {
                params = engine.bindParams(overrides);
            } catch (IllegalArgumentException e) {
                skipped++;
                log.debug("[Sweep] skipped invalid combination overrides={} reason={}", overrides, e.getMessage());
                continue;
            }
            tasks.add(() -> {
                SweepResult row = SweepResult.of(overrides, backtestService.run(series, engine.name(), params, settings));
                logProgress(processed, nextLogAtNanos, logIntervalNanos, tasks.size(), startedAtNanos);
                return row;
            });
        }

        log.info(
                "[Sweep][Start] strategy={} combinations={} runnable={} skipped={} parallelism={} timeout={}",
                engine.name(),
                total,
                tasks.size(),
                skipped,
                sweep.resolvedParallelism(),
                sweep.timeout()
        );

        Comparator<SweepResult> better = rankingComparator();
        PriorityQueue<SweepResult> heap = new PriorityQueue<>(sweep.topK(), better.reversed());
        int evaluated = 0;
        int failed = 0;
        int timedOut = 0;

        ExecutorService pool = Executors.newFixedThreadPool(sweep.resolvedParallelism());
        try {
            List<Future<SweepResult>> futures = pool.invokeAll(tasks, sweep.timeout().toMillis(), TimeUnit.MILLISECONDS);
            for (Future<SweepResult> future : futures) {
                try {
                    offerTopK(heap, future.get(), sweep.topK(), better);
                    evaluated++;
                } catch (CancellationException e) {
                    timedOut++;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof BacktestException || cause instanceof IllegalArgumentException) {
                        failed++;
                        log.warn("[Sweep] run failed reason={}", cause.getMessage());
                        continue;
                    }
                    throw new IllegalStateException("Parameter sweep failed", cause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Parameter sweep interrupted", e);
        } finally {
            shutdown(pool);
        }

        if (timedOut > 0) {
            log.warn("[Sweep] timeout={} reached, cancelled runs={}", sweep.timeout(), timedOut);
        }
        logProgressFinal(processed.get(), tasks.size(), startedAtNanos);

        List<SweepResult> top = new ArrayList<>(heap);
        top.sort(better);
        return new SweepReport(engine.name(), total, evaluated, skipped, failed, timedOut, top);
    }

    static Comparator<SweepResult> rankingComparator() {
        return Comparator
                .comparingDouble((SweepResult row) -> rankValue(row.calmarRatio())).reversed()
                .thenComparing(Comparator.comparingDouble((SweepResult row) -> rankValue(row.returnPct())).reversed())
                .thenComparing(Comparator.comparingDouble((SweepResult row) -> rankValue(row.finalEquity())).reversed());
    }

    private void shutdown(ExecutorService pool) {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(TERMINATION_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[Sweep] workers still running {}s after shutdown", TERMINATION_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Sweep] interrupted while waiting for workers to stop");
        }
    }

    private Map<String, Double> merge(Map<String, Double> base, Map<String, Double> combination) {
        Map<String, Double> merged = new LinkedHashMap<>();
        if (base != null) {
            merged.putAll(base);
        }
        merged.putAll(combination);
        return merged;
    }

    private void offerTopK(
            PriorityQueue<SweepResult> heap,
            SweepResult row,
            int topK,
            Comparator<SweepResult> better
    ) {
        if (heap.size() < topK) {
            heap.offer(row);
            return;
        }
        SweepResult worst = heap.peek();
        if (worst != null && better.compare(row, worst) < 0) {
            heap.poll();
            heap.offer(row);
        }
    }

    private static double rankValue(double value) {
        return Double.isFinite(value) ? value : Double.NEGATIVE_INFINITY;
    }

    private void logProgress(
            AtomicLong processed,
            AtomicLong nextLogAtNanos,
            long logIntervalNanos,
            long total,
            long startedAtNanos
    ) {
        long done = processed.incrementAndGet();
        long now = System.nanoTime();
        long targetNanos = nextLogAtNanos.get();
        if (now < targetNanos) {
            return;
        }
        if (!nextLogAtNanos.compareAndSet(targetNanos, now + logIntervalNanos)) {
            return;
        }

        double elapsedSec = Math.max(1e-9, (now - startedAtNanos) / 1_000_000_000.0);
        log.info(
                "[Sweep][Progress] done={}/{} ({}%) rate={}/s",
                done,
                total,
                String.format(Locale.US, "%.2f", (done * 100.0) / Math.max(1L, total)),
                Math.round(done / elapsedSec)
        );
    }

    private void logProgressFinal(long done, long total, long startedAtNanos) {
        double elapsedSec = Math.max(1e-9, (System.nanoTime() - startedAtNanos) / 1_000_000_000.0);
        log.info(
                "[Sweep][Done] done={}/{} elapsedSec={} rate={}/s",
                done,
                total,
                String.format(Locale.US, "%.2f", elapsedSec),
                Math.round(done / elapsedSec)
        );
    }
}
