package com.barlang.core.indicators;

import java.util.Arrays;

/**
 * Index-preserving transforms over bar-aligned series.
 * Every function returns an array of the same length as its input.
 */
public final class SeriesFunctions {

    private SeriesFunctions() {}

    /**
     * Shift values forward by {@code bars}: position i takes the value from i - bars.
     * Positions before the start of the series are NaN.
     */
    public static double[] shift(double[] values, int bars) {
        if (bars < 0) {
            throw new IllegalArgumentException("Shift must not be negative, got " + bars);
        }
        int n = values.length;
        double[] result = new double[n];
        Arrays.fill(result, 0, Math.min(bars, n), Double.NaN);
        if (bars < n) {
            System.arraycopy(values, 0, result, bars, n - bars);
        }
        return result;
    }

    /**
     * Broadcast a scalar across {@code length} positions.
     */
    public static double[] constant(double value, int length) {
        double[] result = new double[length];
        Arrays.fill(result, value);
        return result;
    }
}
