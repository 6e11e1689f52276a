package com.barlang.core.model;

import java.util.List;

/**
 * Result of a simulation run: trade ledger, metrics and the mark-to-market equity curve.
 * The equity curve starts with the initial capital and holds one more value than there are bars.
 */
public record BacktestResult(
    BacktestConfig config,
    List<Trade> trades,
    PerformanceMetrics metrics,
    List<Double> equityCurve
) {
    public BacktestResult {
        trades = List.copyOf(trades);
        equityCurve = List.copyOf(equityCurve);
    }

    public int barsProcessed() {
        return equityCurve.size() - 1;
    }

    /**
     * Get summary string
     */
    public String getSummary() {
        return String.format(
            "%d trades, %.1f%% win rate, %+.2f%% return, %.2f%% max drawdown, final capital %.2f",
            metrics.numTrades(),
            metrics.winRate() * 100,
            metrics.totalReturnPercent(),
            metrics.maxDrawdownPercent(),
            metrics.finalCapital()
        );
    }
}
