package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.error.ComputationException;
import com.forecastsentinel.core.stats.ClassicalDecomposition;
import com.forecastsentinel.core.stats.KpssTest;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Automatic ARIMA order selection.
 *
 * <ol>
 * <li>Seasonal difference once ({@code D = 1}) when the season length is at
 * least 2, the series covers two cycles and the classical seasonal strength
 * exceeds {@value #SEASONAL_STRENGTH_THRESHOLD}.</li>
 * <li>Difference again ({@code d <= 2}) while the KPSS test rejects level
 * stationarity at 5%.</li>
 * <li>Fit ARMA(p, q), {@code p, q <= 2}, by conditional sum of squares, with a
 * mean (or drift) term when {@code d + D <= 1}, and keep the lowest AICc.</li>
 * </ol>
 *
 * <p>
 * AR and MA coefficients are searched through partial autocorrelations in
 * {@code (-1, 1)}, which keeps every candidate stationary and invertible.
 * Forecast variance uses the psi-weights of the full polynomial, differencing
 * included.
 * </p>
 *
 * @since 1.0.0
 */
public class AutoArimaForecaster implements Forecaster {

    private static final Logger LOG = LoggerFactory.getLogger(AutoArimaForecaster.class);

    public static final String MODEL_NAME = "AutoARIMA";

    static final double SEASONAL_STRENGTH_THRESHOLD = 0.64;
    static final int MAX_ORDER = 2;
    static final int MAX_DIFFERENCES = 2;

    private final int seasonLength;
    private final int maxEvaluations;

    public AutoArimaForecaster(int seasonLength, int maxEvaluations) {
        if (seasonLength < 1) {
            throw new IllegalArgumentException("seasonLength must be >= 1, got: " + seasonLength);
        }
        this.seasonLength = seasonLength;
        this.maxEvaluations = maxEvaluations;
    }

    @Override
    public FittedModel fit(double[] y) {
        List<double[]> stages = new ArrayList<>();
        List<Integer> lags = new ArrayList<>();
        stages.add(y);

        int seasonalDifferences = 0;
        if (seasonLength >= 2 && y.length >= 2 * seasonLength
                && ClassicalDecomposition.additive(y, seasonLength).seasonalStrength()
                        > SEASONAL_STRENGTH_THRESHOLD) {
            stages.add(difference(y, seasonLength));
            lags.add(seasonLength);
            seasonalDifferences = 1;
        }

        int differences = 0;
        double[] w = stages.get(stages.size() - 1);
        while (differences < MAX_DIFFERENCES && w.length > 3 && !KpssTest.isStationary(w)) {
            w = difference(w, 1);
            stages.add(w);
            lags.add(1);
            differences++;
        }

        if (w.length <= MAX_ORDER + 1) {
            throw new ComputationException("ARIMA needs more than " + (MAX_ORDER + 1)
                    + " values after differencing, got: " + w.length);
        }

        boolean withMean = differences + seasonalDifferences <= 1;
        double floor = ParameterSearch.errorFloor(w);

        ArmaFit best = null;
        for (int p = 0; p <= MAX_ORDER; p++) {
            for (int q = 0; q <= MAX_ORDER; q++) {
                try {
                    ArmaFit candidate = fitArma(w, p, q, withMean, floor);
                    LOG.trace("ARMA({},{}) aicc={}", p, q, candidate.aicc);
                    if (best == null || candidate.aicc < best.aicc) {
                        best = candidate;
                    }
                } catch (TooManyEvaluationsException e) {
                    LOG.warn("ARMA({},{}) did not converge within {} evaluations, skipping",
                            p, q, maxEvaluations);
                }
            }
        }
        if (best == null) {
            throw new ComputationException("No ARIMA model could be fitted to " + y.length + " observations");
        }

        ArimaFit fit = new ArimaFit(best, stages, lags, differences, seasonalDifferences, seasonLength);
        LOG.debug("Selected {} (aicc={})", fit.describe(), best.aicc);
        return fit;
    }

    @Override
    public String getModelName() {
        return MODEL_NAME;
    }

    // ---------------------------------------------------------------
    // ARMA by conditional sum of squares
    // ---------------------------------------------------------------

    private ArmaFit fitArma(double[] w, int p, int q, boolean withMean, double floor) {
        int effective = w.length - MAX_ORDER;
        int k = p + q + (withMean ? 1 : 0) + 1;

        double[] ar;
        double[] ma;
        double mean;
        if (p == 0 && q == 0) {
            ar = new double[0];
            ma = new double[0];
            mean = withMean ? StatUtils.mean(w, MAX_ORDER, effective) : 0;
        } else {
            double[] start = new double[p + q + (withMean ? 1 : 0)];
            if (withMean) {
                start[p + q] = StatUtils.mean(w);
            }
            PointValuePair optimum = ParameterSearch.minimize(
                    point -> residuals(w, decodeAr(point, p), decodeMa(point, p, q),
                            withMean ? point[p + q] : 0).sse,
                    start, maxEvaluations);
            double[] point = optimum.getPoint();
            ar = decodeAr(point, p);
            ma = decodeMa(point, p, q);
            mean = withMean ? point[p + q] : 0;
        }

        Residuals residuals = residuals(w, ar, ma, mean);
        double aicc = ParameterSearch.aicc(residuals.sse, effective, k, floor);
        int dof = effective - k > 0 ? effective - k : effective;
        return new ArmaFit(ar, ma, mean, residuals.values, residuals.sse / dof, aicc);
    }

    private static Residuals residuals(double[] w, double[] ar, double[] ma, double mean) {
        double[] e = new double[w.length];
        double sse = 0;
        for (int t = MAX_ORDER; t < w.length; t++) {
            double predicted = mean;
            for (int i = 0; i < ar.length; i++) {
                predicted += ar[i] * (w[t - 1 - i] - mean);
            }
            for (int j = 0; j < ma.length; j++) {
                predicted += ma[j] * e[t - 1 - j];
            }
            e[t] = w[t] - predicted;
            sse += e[t] * e[t];
        }
        return new Residuals(e, sse);
    }

    private static double[] decodeAr(double[] point, int p) {
        return fromPartials(Arrays.copyOfRange(point, 0, p));
    }

    private static double[] decodeMa(double[] point, int p, int q) {
        double[] coefficients = fromPartials(Arrays.copyOfRange(point, p, p + q));
        for (int i = 0; i < coefficients.length; i++) {
            coefficients[i] = -coefficients[i];
        }
        return coefficients;
    }

    /**
     * Durbin–Levinson map from unconstrained values to the coefficients of a
     * stationary AR polynomial, via partial autocorrelations {@code tanh(u)}.
     */
    static double[] fromPartials(double[] u) {
        int order = u.length;
        double[] phi = new double[order];
        for (int k = 0; k < order; k++) {
            double partial = Math.tanh(u[k]);
            double[] previous = Arrays.copyOf(phi, k);
            for (int j = 0; j < k; j++) {
                phi[j] = previous[j] - partial * previous[k - 1 - j];
            }
            phi[k] = partial;
        }
        return phi;
    }

    static double[] difference(double[] x, int lag) {
        double[] out = new double[x.length - lag];
        for (int i = lag; i < x.length; i++) {
            out[i - lag] = x[i] - x[i - lag];
        }
        return out;
    }

    // ---------------------------------------------------------------
    // Value types
    // ---------------------------------------------------------------

    private static final class Residuals {
        final double[] values;
        final double sse;

        Residuals(double[] values, double sse) {
            this.values = values;
            this.sse = sse;
        }
    }

    private static final class ArmaFit {
        final double[] ar;
        final double[] ma;
        final double mean;
        final double[] residuals;
        final double sigma2;
        final double aicc;

        ArmaFit(double[] ar, double[] ma, double mean, double[] residuals, double sigma2, double aicc) {
            this.ar = ar;
            this.ma = ma;
            this.mean = mean;
            this.residuals = residuals;
            this.sigma2 = sigma2;
            this.aicc = aicc;
        }
    }

    static final class ArimaFit implements FittedModel {
        private final ArmaFit arma;
        private final List<double[]> stages;
        private final List<Integer> lags;
        private final int differences;
        private final int seasonalDifferences;
        private final int seasonLength;

        ArimaFit(ArmaFit arma, List<double[]> stages, List<Integer> lags, int differences,
                int seasonalDifferences, int seasonLength) {
            this.arma = arma;
            this.stages = stages;
            this.lags = lags;
            this.differences = differences;
            this.seasonalDifferences = seasonalDifferences;
            this.seasonLength = seasonLength;
        }

        @Override
        public ModelForecast forecast(int horizon) {
            double[] w = stages.get(stages.size() - 1);
            int n = w.length;

            // ARMA recursion on the differenced scale, future shocks zero
            double[] extended = Arrays.copyOf(w, n + horizon);
            double[] shocks = Arrays.copyOf(arma.residuals, n + horizon);
            for (int t = n; t < n + horizon; t++) {
                double value = arma.mean;
                for (int i = 0; i < arma.ar.length; i++) {
                    value += arma.ar[i] * (extended[t - 1 - i] - arma.mean);
                }
                for (int j = 0; j < arma.ma.length; j++) {
                    value += arma.ma[j] * shocks[t - 1 - j];
                }
                extended[t] = value;
            }
            double[] future = Arrays.copyOfRange(extended, n, n + horizon);

            // undo differencing, innermost stage first
            for (int stage = stages.size() - 2; stage >= 0; stage--) {
                future = integrate(stages.get(stage), future, lags.get(stage));
            }

            double[] psi = psiWeights(horizon);
            double[] se = new double[horizon];
            double cumulative = 0;
            for (int h = 0; h < horizon; h++) {
                cumulative += psi[h] * psi[h];
                se[h] = Math.sqrt(arma.sigma2 * cumulative);
            }
            return new ModelForecast(future, se);
        }

        private static double[] integrate(double[] history, double[] differenced, int lag) {
            int n = history.length;
            double[] extended = Arrays.copyOf(history, n + differenced.length);
            for (int h = 0; h < differenced.length; h++) {
                extended[n + h] = extended[n + h - lag] + differenced[h];
            }
            return Arrays.copyOfRange(extended, n, extended.length);
        }

        /**
         * @return {@code psi[0..horizon-1]} of the full model, {@code psi[0] = 1}
         */
        double[] psiWeights(int horizon) {
            // (1 - phi_1 B - ...)(1 - B)^d (1 - B^m)^D as coefficients of B^i
            double[] polynomial = new double[arma.ar.length + 1];
            polynomial[0] = 1;
            for (int i = 0; i < arma.ar.length; i++) {
                polynomial[i + 1] = -arma.ar[i];
            }
            for (int stage = 0; stage < lags.size(); stage++) {
                double[] factor = new double[lags.get(stage) + 1];
                factor[0] = 1;
                factor[factor.length - 1] = -1;
                polynomial = multiply(polynomial, factor);
            }

            double[] psi = new double[horizon];
            psi[0] = 1;
            for (int j = 1; j < horizon; j++) {
                double value = j <= arma.ma.length ? arma.ma[j - 1] : 0;
                for (int i = 1; i <= Math.min(j, polynomial.length - 1); i++) {
                    value -= polynomial[i] * psi[j - i];
                }
                psi[j] = value;
            }
            return psi;
        }

        private static double[] multiply(double[] a, double[] b) {
            double[] out = new double[a.length + b.length - 1];
            for (int i = 0; i < a.length; i++) {
                for (int j = 0; j < b.length; j++) {
                    out[i + j] += a[i] * b[j];
                }
            }
            return out;
        }

        @Override
        public String describe() {
            StringBuilder sb = new StringBuilder()
                    .append("ARIMA(").append(arma.ar.length).append(',')
                    .append(differences).append(',').append(arma.ma.length).append(')');
            if (seasonalDifferences > 0) {
                sb.append("(0,").append(seasonalDifferences).append(",0)[").append(seasonLength).append(']');
            }
            if (differences + seasonalDifferences <= 1) {
                sb.append(differences + seasonalDifferences == 0 ? " with non-zero mean" : " with drift");
            }
            return sb.toString();
        }

        int getDifferences() {
            return differences;
        }

        int getSeasonalDifferences() {
            return seasonalDifferences;
        }
    }
}
