package com.barlang.core.model;

import java.util.List;

/**
 * Performance metrics calculated from a completed simulation.
 *
 * @param totalReturnPercent (finalCapital - initialCapital) / initialCapital * 100
 * @param winRate            fraction (0-1) of closed trades with positive pnl
 * @param numTrades          number of trades in the ledger
 * @param maxDrawdownPercent largest peak-to-trough decline of the equity curve, as a non-positive percentage
 * @param finalCapital       realized capital after the last trade
 */
public record PerformanceMetrics(
    double totalReturnPercent,
    double winRate,
    int numTrades,
    double maxDrawdownPercent,
    double finalCapital
) {
    /**
     * Create empty metrics (no trades)
     */
    public static PerformanceMetrics empty(double initialCapital) {
        return new PerformanceMetrics(0, 0, 0, 0, initialCapital);
    }

    /**
     * Calculate metrics from the trade ledger and the per-bar equity curve
     */
    public static PerformanceMetrics calculate(List<Trade> trades, List<Double> equityCurve,
                                               double initialCapital, double finalCapital) {
        if (trades == null || trades.isEmpty()) {
            return empty(initialCapital);
        }

        double totalReturn = (finalCapital - initialCapital) / initialCapital * 100;

        // Trades without realized pnl do not count towards the win rate
        int closed = 0;
        int winners = 0;
        for (Trade t : trades) {
            if (t.pnl() == null) continue;
            closed++;
            if (t.isWinner()) {
                winners++;
            }
        }
        double winRate = closed > 0 ? (double) winners / closed : 0;

        return new PerformanceMetrics(totalReturn, winRate, trades.size(),
            maxDrawdownPercent(equityCurve), finalCapital);
    }

    /**
     * Minimum of (equity - runningMax) / runningMax * 100 over the curve; 0 if equity never dips.
     */
    public static double maxDrawdownPercent(List<Double> equityCurve) {
        if (equityCurve == null || equityCurve.isEmpty()) {
            return 0;
        }
        double peak = equityCurve.get(0);
        double maxDD = 0;
        for (double equity : equityCurve) {
            peak = Math.max(peak, equity);
            double dd = (equity - peak) / peak * 100;
            maxDD = Math.min(maxDD, dd);
        }
        return maxDD;
    }
}
