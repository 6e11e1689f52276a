package com.barlang.core.indicators;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SMATest {

    private static final double EPS = 1e-9;

    @Test
    @DisplayName("Window shrinks at the start of the series")
    void shrinkingWindow() {
        double[] sma = SMA.calculate(new double[]{1, 2, 3, 4, 5}, 3);

        assertArrayEquals(new double[]{1, 1.5, 2, 3, 4}, sma, EPS);
    }

    @Test
    @DisplayName("Period of one returns the input")
    void periodOne() {
        double[] values = {3, 1, 4, 1, 5};

        assertArrayEquals(values, SMA.calculate(values, 1), EPS);
    }

    @Test
    @DisplayName("Period longer than the series averages everything seen so far")
    void periodLongerThanSeries() {
        double[] sma = SMA.calculate(new double[]{2, 4, 6}, 50);

        assertArrayEquals(new double[]{2, 3, 4}, sma, EPS);
    }

    @Test
    @DisplayName("Missing values are skipped, not averaged as zero")
    void skipsNaN() {
        double[] sma = SMA.calculate(new double[]{Double.NaN, 2, 4, 6}, 2);

        assertTrue(Double.isNaN(sma[0]));
        assertEquals(2.0, sma[1], EPS);
        assertEquals(3.0, sma[2], EPS);
        assertEquals(5.0, sma[3], EPS);
    }

    @Test
    @DisplayName("Rejects a non-positive period")
    void rejectsBadPeriod() {
        assertThrows(IllegalArgumentException.class, () -> SMA.calculate(new double[]{1}, 0));
    }
}
