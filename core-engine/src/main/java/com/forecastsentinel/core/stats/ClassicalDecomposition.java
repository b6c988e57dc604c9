package com.forecastsentinel.core.stats;

import org.apache.commons.math3.stat.StatUtils;

import java.util.Arrays;

/**
 * Moving-average decomposition of a series into trend, seasonal and remainder
 * components.
 *
 * <p>
 * The trend is a centered moving average of order {@code m} (a 2×m average
 * when {@code m} is even) and is defined on {@code [m/2, n - 1 - m/2]}. Seasonal
 * indices are the per-position averages of the detrended values, normalized to
 * sum to zero (additive) or average to one (multiplicative).
 * </p>
 *
 * <p>
 * Requires at least two full cycles.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClassicalDecomposition {

    private static final double EPSILON = 1e-10;

    private final int period;
    private final boolean multiplicative;
    private final double[] seasonal;
    private final double strength;

    private ClassicalDecomposition(double[] y, int period, boolean multiplicative) {
        if (period < 2) {
            throw new IllegalArgumentException("period must be >= 2, got: " + period);
        }
        if (y.length < 2 * period) {
            throw new IllegalArgumentException("decomposition needs at least " + 2 * period
                    + " values, got: " + y.length);
        }
        this.period = period;
        this.multiplicative = multiplicative;

        int half = period / 2;
        int first = half;
        int last = y.length - 1 - half;
        double[] trend = new double[y.length];
        for (int i = first; i <= last; i++) {
            trend[i] = centeredAverage(y, i, period);
        }

        double[] sums = new double[period];
        int[] counts = new int[period];
        for (int i = first; i <= last; i++) {
            sums[i % period] += multiplicative ? y[i] / trend[i] : y[i] - trend[i];
            counts[i % period]++;
        }
        double[] indices = new double[period];
        for (int j = 0; j < period; j++) {
            indices[j] = counts[j] > 0 ? sums[j] / counts[j] : (multiplicative ? 1 : 0);
        }
        double centre = StatUtils.mean(indices);
        for (int j = 0; j < period; j++) {
            indices[j] = multiplicative ? indices[j] / centre : indices[j] - centre;
        }
        this.seasonal = indices;

        // strength = 1 - Var(remainder) / Var(seasonal + remainder), on the additive scale
        double[] detrended = new double[last - first + 1];
        double[] remainder = new double[detrended.length];
        for (int i = first; i <= last; i++) {
            double additiveSeason = multiplicative ? (indices[i % period] - 1) * trend[i] : indices[i % period];
            detrended[i - first] = y[i] - trend[i];
            remainder[i - first] = detrended[i - first] - additiveSeason;
        }
        double detrendedVariance = StatUtils.variance(detrended);
        this.strength = detrendedVariance <= EPSILON
                ? 0
                : Math.max(0, 1 - StatUtils.variance(remainder) / detrendedVariance);
    }

    /**
     * @param y      series values
     * @param period season length, &gt;= 2
     * @return additive decomposition
     */
    public static ClassicalDecomposition additive(double[] y, int period) {
        return new ClassicalDecomposition(y, period, false);
    }

    /**
     * @param y      strictly positive series values
     * @param period season length, &gt;= 2
     * @return multiplicative decomposition
     */
    public static ClassicalDecomposition multiplicative(double[] y, int period) {
        return new ClassicalDecomposition(y, period, true);
    }

    private static double centeredAverage(double[] y, int index, int period) {
        int half = period / 2;
        if (period % 2 == 1) {
            return StatUtils.mean(y, index - half, period);
        }
        double sum = 0.5 * y[index - half] + 0.5 * y[index + half];
        for (int k = index - half + 1; k < index + half; k++) {
            sum += y[k];
        }
        return sum / period;
    }

    public int getPeriod() {
        return period;
    }

    public boolean isMultiplicative() {
        return multiplicative;
    }

    /**
     * @param index position in the series (any non-negative index, including
     *              future ones)
     * @return seasonal index for that position
     */
    public double seasonalIndex(int index) {
        return seasonal[index % period];
    }

    /** @return copy of the {@code period} seasonal indices */
    public double[] seasonalIndices() {
        return Arrays.copyOf(seasonal, period);
    }

    /**
     * Seasonal strength {@code max(0, 1 - Var(R) / Var(S + R))}, 0 for a flat
     * detrended series.
     *
     * @return strength in [0, 1]
     */
    public double seasonalStrength() {
        return strength;
    }

    /**
     * Remove the seasonal component.
     *
     * @param y series values, same series the decomposition was built from
     * @return seasonally adjusted copy
     */
    public double[] adjust(double[] y) {
        double[] out = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            out[i] = multiplicative ? y[i] / seasonalIndex(i) : y[i] - seasonalIndex(i);
        }
        return out;
    }

    /**
     * Re-apply the seasonal component to a value at a given position.
     *
     * @param value adjusted value
     * @param index series position
     * @return seasonal value
     */
    public double reseasonalize(double value, int index) {
        return multiplicative ? value * seasonalIndex(index) : value + seasonalIndex(index);
    }
}
