package com.barlang.core.indicators;

/**
 * Relative Strength Index indicator.
 *
 * <p>Average gain and loss are exponentially weighted with alpha = 1/period, seeded with
 * the first bar (whose change is taken as 0). A value is produced once {@code period}
 * observations are available, i.e. from bar {@code period - 1}; earlier bars get the
 * neutral value 50.</p>
 */
public final class RSI {

    public static final double NEUTRAL = 50.0;

    private static final double EPSILON = 1e-10;

    private RSI() {} // Utility class

    /**
     * Calculate RSI for all bars.
     * @return Array where index corresponds to bar index, values in 0-100
     */
    public static double[] calculate(double[] values, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("RSI period must be positive, got " + period);
        }

        int n = values.length;
        double[] result = new double[n];
        double alpha = 1.0 / period;

        double avgGain = 0;
        double avgLoss = 0;

        for (int i = 0; i < n; i++) {
            // Missing changes (first bar, NaN inputs) count as neither gain nor loss
            double change = i > 0 ? values[i] - values[i - 1] : Double.NaN;
            double gain = change > 0 ? change : 0;
            double loss = change < 0 ? -change : 0;

            if (i == 0) {
                avgGain = gain;
                avgLoss = loss;
            } else {
                avgGain = (1 - alpha) * avgGain + alpha * gain;
                avgLoss = (1 - alpha) * avgLoss + alpha * loss;
            }

            if (i + 1 < period) {
                result[i] = NEUTRAL;
            } else {
                double rs = avgGain / (avgLoss + EPSILON);
                result[i] = 100 - (100 / (1 + rs));
            }
        }

        return result;
    }
}
