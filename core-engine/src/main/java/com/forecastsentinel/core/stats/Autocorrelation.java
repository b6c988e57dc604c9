package com.forecastsentinel.core.stats;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.StatUtils;

/**
 * Sample autocorrelation and the seasonal significance test built on it.
 *
 * @since 1.0.0
 */
public final class Autocorrelation {

    private Autocorrelation() {
        // utility class, not instantiable
    }

    /**
     * @param x      series values
     * @param maxLag largest lag, &lt; {@code x.length}
     * @return {@code r[0..maxLag]}; all zeros after lag 0 for a constant series
     */
    public static double[] acf(double[] x, int maxLag) {
        if (maxLag >= x.length) {
            throw new IllegalArgumentException(
                    "maxLag must be < series length " + x.length + ", got: " + maxLag);
        }
        double mean = StatUtils.mean(x);
        double denominator = 0;
        for (double v : x) {
            denominator += (v - mean) * (v - mean);
        }
        double[] r = new double[maxLag + 1];
        r[0] = 1;
        if (denominator == 0) {
            return r;
        }
        for (int lag = 1; lag <= maxLag; lag++) {
            double numerator = 0;
            for (int t = lag; t < x.length; t++) {
                numerator += (x[t] - mean) * (x[t - lag] - mean);
            }
            r[lag] = numerator / denominator;
        }
        return r;
    }

    /**
     * Test whether the autocorrelation at lag {@code period} is significant,
     * using Bartlett's standard error and a two-sided test at
     * {@code confidence} percent.
     *
     * @param x          series values
     * @param period     season length, &gt;= 2
     * @param confidence confidence level in percent, e.g. 90
     * @return {@code true} if the series is seasonal at {@code period}
     */
    public static boolean isSeasonal(double[] x, int period, double confidence) {
        if (period < 2 || x.length <= period) {
            return false;
        }
        double[] r = acf(x, period);
        double sumOfSquares = 0;
        for (int lag = 1; lag < period; lag++) {
            sumOfSquares += r[lag] * r[lag];
        }
        double standardError = Math.sqrt((1 + 2 * sumOfSquares) / x.length);
        double critical = new NormalDistribution()
                .inverseCumulativeProbability(1 - (1 - confidence / 100) / 2);
        return Math.abs(r[period]) > critical * standardError;
    }
}
