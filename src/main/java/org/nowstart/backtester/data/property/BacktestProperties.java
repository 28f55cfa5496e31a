package org.nowstart.backtester.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.nowstart.backtester.data.dto.BacktestSettings;
import org.nowstart.backtester.data.type.FillPriceConvention;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "backtester")
public record BacktestProperties(
        // runner gate; the application only runs a backtest when true
        @DefaultValue("false") boolean enabled,
        // CSV file with timestamp,open,high,low,close,volume columns
        @DefaultValue("data/bars.csv") String dataPath,
        // JSON report destination, skipped when blank
        @DefaultValue("") String reportPath,
        // active strategy name (macd, rsi, trend-rsi)
        @NotBlank @DefaultValue("rsi") String strategy,
        // strategy parameter overrides, for example rsiPeriod: 10
        Map<String, Double> strategyParameters,
        // starting cash
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("10000") BigDecimal initialCash,
        // commission as a fraction of traded notional per side (0.001 = 0.1%)
        @NotNull @DecimalMin("0") @DefaultValue("0") BigDecimal commissionRate,
        // flat commission per closed trade
        @NotNull @DecimalMin("0") @DefaultValue("0") BigDecimal commissionPerTrade,
        // fraction of equity committed to each entry
        @NotNull @DecimalMin(value = "0", inclusive = false) @DecimalMax("1.0") @DefaultValue("0.9999") BigDecimal positionSizeFraction,
        // bars per year for annualized ratios (252 daily, 52 weekly, 8760 hourly crypto)
        @Positive @DefaultValue("252") int annualizationPeriods,
        // order fill price convention
        @NotNull @DefaultValue("NEXT_OPEN") FillPriceConvention fillPrice,
        // close a position still open at the last bar instead of marking it to market
        @DefaultValue("false") boolean closeOpenPositionAtEnd,
        // parameter sweep
        @Valid @NotNull @DefaultValue Sweep sweep
) {

    public BacktestProperties {
        strategyParameters = strategyParameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(strategyParameters));
    }

    public BacktestSettings toSettings() {
        return new BacktestSettings(
                initialCash.doubleValue(),
                commissionRate.doubleValue(),
                commissionPerTrade.doubleValue(),
                positionSizeFraction.doubleValue(),
                annualizationPeriods,
                fillPrice,
                closeOpenPositionAtEnd
        );
    }

    public record Sweep(
            // run the sweep after the single backtest
            @DefaultValue("false") boolean enabled,
            // parameter name -> start:end:step
            Map<String, String> axes,
            // worker threads, 0 = available processors
            @PositiveOrZero @DefaultValue("0") int parallelism,
            // ranked candidates to keep
            @Positive @DefaultValue("10") int topK,
            // wall-clock budget for the whole sweep
            @NotNull @DefaultValue("10m") Duration timeout
    ) {

        public Sweep {
            axes = axes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(axes));
        }

        public int resolvedParallelism() {
            return parallelism > 0 ? parallelism : Math.max(1, Runtime.getRuntime().availableProcessors());
        }
    }
}
