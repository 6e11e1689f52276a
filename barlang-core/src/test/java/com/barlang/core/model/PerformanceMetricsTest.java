package com.barlang.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceMetricsTest {

    private static final LocalDate D = LocalDate.of(2024, 1, 2);

    @Test
    @DisplayName("No trades gives zeroed metrics")
    void noTrades() {
        PerformanceMetrics m = PerformanceMetrics.calculate(List.of(), List.of(1000.0, 1000.0), 1000, 1000);

        assertEquals(PerformanceMetrics.empty(1000), m);
        assertEquals(0, m.numTrades());
        assertEquals(0.0, m.winRate());
        assertEquals(1000.0, m.finalCapital());
    }

    @Test
    @DisplayName("Win rate is a fraction of closed trades")
    void winRate() {
        List<Trade> trades = List.of(
            Trade.open(D, 100).close(D.plusDays(1), 110),
            Trade.open(D, 100).close(D.plusDays(1), 90),
            Trade.open(D, 100).close(D.plusDays(1), 100),
            Trade.open(D, 100).close(D.plusDays(1), 105)
        );

        PerformanceMetrics m = PerformanceMetrics.calculate(trades, List.of(1000.0), 1000, 1200);

        assertEquals(0.5, m.winRate(), 1e-9);
        assertEquals(4, m.numTrades());
        assertEquals(20.0, m.totalReturnPercent(), 1e-9);
    }

    @Test
    @DisplayName("Trades without pnl are left out of the win rate")
    void excludesOpenTrades() {
        List<Trade> trades = List.of(
            Trade.open(D, 100).close(D.plusDays(1), 110),
            Trade.open(D, 100)
        );

        PerformanceMetrics m = PerformanceMetrics.calculate(trades, List.of(1000.0), 1000, 1100);

        assertEquals(1.0, m.winRate(), 1e-9);
        assertEquals(2, m.numTrades());
    }

    @Test
    @DisplayName("Drawdown is measured from the running peak")
    void drawdown() {
        double dd = PerformanceMetrics.maxDrawdownPercent(List.of(100.0, 120.0, 90.0, 130.0, 117.0));

        assertEquals(-25.0, dd, 1e-9);
    }

    @Test
    @DisplayName("Drawdown is zero for a curve that never dips")
    void noDrawdown() {
        assertEquals(0.0, PerformanceMetrics.maxDrawdownPercent(List.of(100.0, 100.0, 101.0)));
        assertEquals(0.0, PerformanceMetrics.maxDrawdownPercent(List.of()));
    }
}
