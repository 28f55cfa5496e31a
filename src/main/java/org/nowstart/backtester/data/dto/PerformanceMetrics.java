package org.nowstart.backtester.data.dto;

/**
 * Headline and supplementary statistics of one run.
 *
 * <p>Percentages are expressed as percent (12.5 means 12.5%). Undefined values are reported as 0.
 */
public record PerformanceMetrics(
        double winRatePct,
        double sharpeRatio,
        double sortinoRatio,
        double maxDrawdownPct,
        double calmarRatio,
        double returnPct,
        double finalEquity,
        double peakEquity,
        double annualizedReturnPct,
        double annualizedVolatilityPct,
        double buyAndHoldReturnPct,
        double exposureTimePct,
        int tradeCount,
        double bestTradePct,
        double worstTradePct,
        double avgTradePct,
        double profitFactor,
        int maxDrawdownDurationBars,
        double commissionsPaid
) {
}
