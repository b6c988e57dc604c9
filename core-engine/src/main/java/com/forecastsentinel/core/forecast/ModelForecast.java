package com.forecastsentinel.core.forecast;

import org.apache.commons.math3.distribution.NormalDistribution;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Point forecasts and Gaussian standard errors for each horizon step.
 *
 * <p>
 * Prediction intervals are {@code mean ± z · se} with {@code z} the two-sided
 * standard normal critical value. Only levels strictly between 0 and 100 can be
 * produced.
 * </p>
 *
 * @since 1.0.0
 */
public final class ModelForecast {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final double[] mean;
    private final double[] standardError;

    /**
     * @param mean          point forecasts
     * @param standardError standard errors, same length as {@code mean}
     */
    public ModelForecast(double[] mean, double[] standardError) {
        if (mean.length != standardError.length) {
            throw new IllegalArgumentException("mean and standard error lengths differ: "
                    + mean.length + " vs " + standardError.length);
        }
        this.mean = Arrays.copyOf(mean, mean.length);
        this.standardError = Arrays.copyOf(standardError, standardError.length);
    }

    public int horizon() {
        return mean.length;
    }

    public double mean(int step) {
        return mean[step];
    }

    public double standardError(int step) {
        return standardError[step];
    }

    /**
     * @param level confidence level in percent
     * @return {@code true} if bounds can be produced for {@code level}
     */
    public static boolean supportsLevel(int level) {
        return level > 0 && level < 100;
    }

    /**
     * @param level confidence level in percent
     * @return two-sided critical value
     */
    public static double criticalValue(double level) {
        return STANDARD_NORMAL.inverseCumulativeProbability(0.5 + level / 200);
    }

    /**
     * @param level confidence level in percent
     * @return lower and upper bound sequences, or empty if the level is not
     *         supported
     */
    public Optional<Bounds> bounds(int level) {
        if (!supportsLevel(level)) {
            return Optional.empty();
        }
        double z = criticalValue(level);
        List<Double> lower = new ArrayList<>(mean.length);
        List<Double> upper = new ArrayList<>(mean.length);
        for (int i = 0; i < mean.length; i++) {
            lower.add(mean[i] - z * standardError[i]);
            upper.add(mean[i] + z * standardError[i]);
        }
        return Optional.of(new Bounds(lower, upper));
    }

    /**
     * @return {@code true} if every mean and standard error is finite
     */
    public boolean isFinite() {
        for (int i = 0; i < mean.length; i++) {
            if (!Double.isFinite(mean[i]) || !Double.isFinite(standardError[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * Lower/upper bound pair for one level.
     */
    public static final class Bounds {
        private final List<Double> lower;
        private final List<Double> upper;

        Bounds(List<Double> lower, List<Double> upper) {
            this.lower = List.copyOf(lower);
            this.upper = List.copyOf(upper);
        }

        public List<Double> getLower() {
            return lower;
        }

        public List<Double> getUpper() {
            return upper;
        }
    }
}
