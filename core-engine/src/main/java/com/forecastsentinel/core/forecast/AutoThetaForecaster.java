package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.error.ComputationException;
import com.forecastsentinel.core.stats.Autocorrelation;
import com.forecastsentinel.core.stats.ClassicalDecomposition;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Automatic Theta method.
 *
 * <p>
 * The series is tested for seasonality at lag {@code m} (ACF, 90%) and, if
 * seasonal, adjusted by a classical decomposition (multiplicative for
 * positive series, additive otherwise). The adjusted series is forecast by
 * simple exponential smoothing plus a drift of {@code (1 - 1/theta) b0}, where
 * {@code b0} is the least-squares slope. Two candidates are fitted:
 * the standard method ({@code theta = 2}) and the optimized method
 * ({@code 1 < theta < 10}); the lower in-sample MSE wins.
 * </p>
 *
 * @since 1.0.0
 */
public class AutoThetaForecaster implements Forecaster {

    private static final Logger LOG = LoggerFactory.getLogger(AutoThetaForecaster.class);

    public static final String MODEL_NAME = "AutoTheta";

    static final double SEASONALITY_CONFIDENCE = 90;
    static final double STANDARD_THETA = 2;

    private static final double ALPHA_LOWER = 1e-3;
    private static final double ALPHA_UPPER = 0.999;
    private static final double THETA_LOWER = 1;
    private static final double THETA_UPPER = 10;

    private final int seasonLength;
    private final int maxEvaluations;

    public AutoThetaForecaster(int seasonLength, int maxEvaluations) {
        if (seasonLength < 1) {
            throw new IllegalArgumentException("seasonLength must be >= 1, got: " + seasonLength);
        }
        this.seasonLength = seasonLength;
        this.maxEvaluations = maxEvaluations;
    }

    @Override
    public FittedModel fit(double[] y) {
        if (y.length < 3) {
            throw new ComputationException("Theta needs at least 3 observations, got: " + y.length);
        }

        ClassicalDecomposition decomposition = null;
        double[] adjusted = y;
        if (seasonLength >= 2 && y.length >= 2 * seasonLength
                && Autocorrelation.isSeasonal(y, seasonLength, SEASONALITY_CONFIDENCE)) {
            decomposition = isPositive(y)
                    ? ClassicalDecomposition.multiplicative(y, seasonLength)
                    : ClassicalDecomposition.additive(y, seasonLength);
            adjusted = decomposition.adjust(y);
        }

        SimpleRegression regression = new SimpleRegression();
        for (int t = 0; t < adjusted.length; t++) {
            regression.addData(t + 1, adjusted[t]);
        }
        double slope = regression.getSlope();

        ThetaFit best = null;
        for (boolean optimized : new boolean[] {false, true}) {
            try {
                ThetaFit candidate = fitCandidate(adjusted, slope, optimized, decomposition);
                LOG.trace("{} mse={}", candidate.describe(), candidate.mse);
                if (best == null || candidate.mse < best.mse) {
                    best = candidate;
                }
            } catch (TooManyEvaluationsException e) {
                LOG.warn("{} Theta did not converge within {} evaluations, skipping",
                        optimized ? "Optimized" : "Standard", maxEvaluations);
            }
        }
        if (best == null) {
            throw new ComputationException("No Theta model could be fitted to " + y.length + " observations");
        }
        LOG.debug("Selected {} (mse={})", best.describe(), best.mse);
        return best;
    }

    @Override
    public String getModelName() {
        return MODEL_NAME;
    }

    private ThetaFit fitCandidate(double[] x, double slope, boolean optimized,
            ClassicalDecomposition decomposition) {
        double[] start = optimized
                ? new double[] {ParameterSearch.unbounded(0.5, ALPHA_LOWER, ALPHA_UPPER),
                        ParameterSearch.unbounded(STANDARD_THETA, THETA_LOWER, THETA_UPPER)}
                : new double[] {ParameterSearch.unbounded(0.5, ALPHA_LOWER, ALPHA_UPPER)};

        PointValuePair optimum = ParameterSearch.minimize(
                point -> smooth(x, slope, alpha(point), theta(point, optimized)).sse,
                start, maxEvaluations);

        double alpha = alpha(optimum.getPoint());
        double theta = theta(optimum.getPoint(), optimized);
        Pass pass = smooth(x, slope, alpha, theta);
        double mse = pass.sse / (x.length - 1);
        return new ThetaFit(optimized, alpha, theta, slope, pass.level, x.length, mse, decomposition);
    }

    private static double alpha(double[] point) {
        return ParameterSearch.bounded(point[0], ALPHA_LOWER, ALPHA_UPPER);
    }

    private static double theta(double[] point, boolean optimized) {
        return optimized ? ParameterSearch.bounded(point[1], THETA_LOWER, THETA_UPPER) : STANDARD_THETA;
    }

    /**
     * One-step errors of SES with drift; the level starts at the first value
     * and {@code t} observations have been absorbed before predicting
     * observation {@code t + 1}.
     */
    private static Pass smooth(double[] x, double slope, double alpha, double theta) {
        double weight = 1 - 1 / theta;
        double level = x[0];
        double sse = 0;
        for (int t = 1; t < x.length; t++) {
            double drift = weight * slope * (1 - Math.pow(1 - alpha, t)) / alpha;
            double error = x[t] - (level + drift);
            sse += error * error;
            level = alpha * x[t] + (1 - alpha) * level;
        }
        return new Pass(sse, level);
    }

    private static boolean isPositive(double[] y) {
        for (double v : y) {
            if (v <= 0) {
                return false;
            }
        }
        return true;
    }

    private static final class Pass {
        final double sse;
        final double level;

        Pass(double sse, double level) {
            this.sse = sse;
            this.level = level;
        }
    }

    static final class ThetaFit implements FittedModel {
        private final boolean optimized;
        private final double alpha;
        private final double theta;
        private final double slope;
        private final double level;
        private final int n;
        private final double mse;
        private final ClassicalDecomposition decomposition;

        ThetaFit(boolean optimized, double alpha, double theta, double slope, double level, int n,
                double mse, ClassicalDecomposition decomposition) {
            this.optimized = optimized;
            this.alpha = alpha;
            this.theta = theta;
            this.slope = slope;
            this.level = level;
            this.n = n;
            this.mse = mse;
            this.decomposition = decomposition;
        }

        @Override
        public ModelForecast forecast(int horizon) {
            double weight = 1 - 1 / theta;
            double absorbed = (1 - Math.pow(1 - alpha, n)) / alpha;
            double[] mean = new double[horizon];
            double[] se = new double[horizon];
            for (int h = 1; h <= horizon; h++) {
                double point = level + weight * slope * (absorbed + h - 1);
                double error = Math.sqrt(mse * (1 + (h - 1) * alpha * alpha));
                if (decomposition != null) {
                    int index = n + h - 1;
                    point = decomposition.reseasonalize(point, index);
                    if (decomposition.isMultiplicative()) {
                        error *= Math.abs(decomposition.seasonalIndex(index));
                    }
                }
                mean[h - 1] = point;
                se[h - 1] = error;
            }
            return new ModelForecast(mean, se);
        }

        @Override
        public String describe() {
            return (optimized ? "OTM" : "STM") + "(theta=" + theta + ", alpha=" + alpha
                    + (decomposition != null ? ", seasonal" : "") + ")";
        }

        boolean isSeasonal() {
            return decomposition != null;
        }
    }
}
