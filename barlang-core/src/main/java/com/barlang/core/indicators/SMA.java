package com.barlang.core.indicators;

/**
 * Simple Moving Average indicator.
 *
 * <p>The window shrinks at the start of the series: bar i averages the available
 * observations in [max(0, i - period + 1), i]. Missing (NaN) inputs are skipped, and a
 * window holding no observations at all yields NaN.</p>
 */
public final class SMA {

    private SMA() {} // Utility class

    /**
     * Calculate SMA for all bars.
     * @return Array where index corresponds to bar index
     */
    public static double[] calculate(double[] values, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("SMA period must be positive, got " + period);
        }

        int n = values.length;
        double[] result = new double[n];

        double sum = 0;
        int count = 0;

        for (int i = 0; i < n; i++) {
            if (!Double.isNaN(values[i])) {
                sum += values[i];
                count++;
            }
            if (i >= period) {
                double dropped = values[i - period];
                if (!Double.isNaN(dropped)) {
                    sum -= dropped;
                    count--;
                }
            }
            result[i] = count > 0 ? sum / count : Double.NaN;
        }

        return result;
    }
}
