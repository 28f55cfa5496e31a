package org.nowstart.backtester.data.dto;

import org.nowstart.backtester.data.type.FillPriceConvention;

/**
 * Immutable per-run configuration.
 *
 * @param initialCash            starting cash, must be positive
 * @param commissionRate         fraction of traded notional charged per side
 * @param commissionPerTrade     flat amount charged per closed trade
 * @param positionSizeFraction   fraction of equity committed to an entry, in (0, 1]
 * @param annualizationPeriods   bars per year used to annualize returns and ratios
 * @param fillPriceConvention    fill price of signal-driven orders
 * @param closeOpenPositionAtEnd close a position still open at the last bar instead of marking it
 */
public record BacktestSettings(
        double initialCash,
        double commissionRate,
        double commissionPerTrade,
        double positionSizeFraction,
        int annualizationPeriods,
        FillPriceConvention fillPriceConvention,
        boolean closeOpenPositionAtEnd
) {

    public static final double DEFAULT_INITIAL_CASH = 10_000.0;
    public static final double DEFAULT_POSITION_SIZE_FRACTION = 0.9999;
    public static final int DEFAULT_ANNUALIZATION_PERIODS = 252;

    public BacktestSettings {
        if (!Double.isFinite(initialCash) || initialCash <= 0.0) {
            throw new IllegalArgumentException("initialCash must be > 0");
        }
        if (!Double.isFinite(commissionRate) || commissionRate < 0.0) {
            throw new IllegalArgumentException("commissionRate must be >= 0");
        }
        if (!Double.isFinite(commissionPerTrade) || commissionPerTrade < 0.0) {
            throw new IllegalArgumentException("commissionPerTrade must be >= 0");
        }
        if (!Double.isFinite(positionSizeFraction) || positionSizeFraction <= 0.0 || positionSizeFraction > 1.0) {
            throw new IllegalArgumentException("positionSizeFraction must be in (0, 1]");
        }
        if (annualizationPeriods <= 0) {
            throw new IllegalArgumentException("annualizationPeriods must be > 0");
        }
        if (fillPriceConvention == null) {
            throw new IllegalArgumentException("fillPriceConvention is required");
        }
    }

    public static BacktestSettings defaults() {
        return new BacktestSettings(
                DEFAULT_INITIAL_CASH,
                0.0,
                0.0,
                DEFAULT_POSITION_SIZE_FRACTION,
                DEFAULT_ANNUALIZATION_PERIODS,
                FillPriceConvention.NEXT_OPEN,
                false
        );
    }

    public BacktestSettings withCommission(double rate, double perTrade) {
        return new BacktestSettings(
                initialCash,
                rate,
                perTrade,
                positionSizeFraction,
                annualizationPeriods,
                fillPriceConvention,
                closeOpenPositionAtEnd
        );
    }

    public BacktestSettings withFillPriceConvention(FillPriceConvention convention) {
        return new BacktestSettings(
                initialCash,
                commissionRate,
                commissionPerTrade,
                positionSizeFraction,
                annualizationPeriods,
                convention,
                closeOpenPositionAtEnd
        );
    }

    public BacktestSettings withCloseOpenPositionAtEnd(boolean close) {
        return new BacktestSettings(
                initialCash,
                commissionRate,
                commissionPerTrade,
                positionSizeFraction,
                annualizationPeriods,
                fillPriceConvention,
                close
        );
    }

    /**
     * Commission charged when a round trip closes.
     */
    public double commission(double entryNotional, double exitNotional) {
        return commissionPerTrade + commissionRate * (Math.abs(entryNotional) + Math.abs(exitNotional));
    }
}
