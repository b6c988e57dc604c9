package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.error.ComputationException;
import com.forecastsentinel.core.stats.ClassicalDecomposition;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Automatic exponential smoothing.
 *
 * <p>
 * Fits every additive-error state space model ETS(A, T, S) with trend
 * {@code T} in {none, additive, damped} and season {@code S} in {none,
 * additive}, and keeps the one with the lowest AICc. Seasonal candidates are
 * only tried when the season length is at least 2 and the series covers two
 * full cycles.
 * </p>
 *
 * <h3>Recursions</h3>
 *
 * <pre>
 * yhat(t) = l(t-1) + phi b(t-1) + s(t-m)
 * e(t)    = y(t) - yhat(t)
 * l(t)    = l(t-1) + phi b(t-1) + alpha e(t)
 * b(t)    = phi b(t-1) + beta e(t)
 * s(t)    = s(t-m) + gamma e(t)
 * </pre>
 *
 * <h3>Estimation</h3>
 * <p>
 * Initial states come from a classical decomposition (seasonal indices) and a
 * least-squares line through the first {@code min(max(10, 2m), n)}
 * seasonally adjusted values. Smoothing parameters minimize the in-sample sum
 * of squared errors subject to {@code 0 < beta < alpha < 1},
 * {@code 0 < gamma < 1 - alpha} and {@code 0.8 <= phi <= 0.98}.
 * </p>
 *
 * <h3>Intervals</h3>
 * <p>
 * {@code Var(h) = sigma^2 (1 + sum_{j=1}^{h-1} c_j^2)} with
 * {@code c_j = alpha + beta (phi + ... + phi^j) + gamma [j mod m == 0]}.
 * </p>
 *
 * @since 1.0.0
 */
public class AutoEtsForecaster implements Forecaster {

    private static final Logger LOG = LoggerFactory.getLogger(AutoEtsForecaster.class);

    public static final String MODEL_NAME = "AutoETS";

    private static final double ALPHA_LOWER = 1e-4;
    private static final double ALPHA_UPPER = 0.9999;
    private static final double PHI_LOWER = 0.8;
    private static final double PHI_UPPER = 0.98;

    enum Trend {
        NONE("N"), ADDITIVE("A"), DAMPED("Ad");

        private final String code;

        Trend(String code) {
            this.code = code;
        }
    }

    private final int seasonLength;
    private final int maxEvaluations;

    /**
     * @param seasonLength   periods per cycle; values below 2 disable seasonal
     *                       candidates
     * @param maxEvaluations Nelder–Mead budget per candidate
     */
    public AutoEtsForecaster(int seasonLength, int maxEvaluations) {
        if (seasonLength < 1) {
            throw new IllegalArgumentException("seasonLength must be >= 1, got: " + seasonLength);
        }
        this.seasonLength = seasonLength;
        this.maxEvaluations = maxEvaluations;
    }

    @Override
    public FittedModel fit(double[] y) {
        if (y.length < 2) {
            throw new ComputationException("ETS needs at least 2 observations, got: " + y.length);
        }
        boolean seasonalAllowed = seasonLength >= 2 && y.length >= 2 * seasonLength;
        double floor = ParameterSearch.errorFloor(y);

        EtsFit best = null;
        for (Trend trend : Trend.values()) {
            for (boolean seasonal : seasonalAllowed ? List.of(false, true) : List.of(false)) {
                try {
                    EtsFit candidate = fitCandidate(y, trend, seasonal, floor);
                    LOG.trace("{} aicc={}", candidate.describe(), candidate.aicc);
                    if (Double.isFinite(candidate.aicc) && (best == null || candidate.aicc < best.aicc)) {
                        best = candidate;
                    }
                } catch (TooManyEvaluationsException e) {
                    LOG.warn("ETS(A,{},{}) did not converge within {} evaluations, skipping",
                            trend.code, seasonal ? "A" : "N", maxEvaluations);
                }
            }
        }

        if (best == null) {
            throw new ComputationException("No ETS model could be fitted to " + y.length + " observations");
        }
        LOG.debug("Selected {} (aicc={})", best.describe(), best.aicc);
        return best;
    }

    @Override
    public String getModelName() {
        return MODEL_NAME;
    }

    // ---------------------------------------------------------------
    // Candidate fitting
    // ---------------------------------------------------------------

    private EtsFit fitCandidate(double[] y, Trend trend, boolean seasonal, double floor) {
        int m = seasonal ? seasonLength : 1;
        State initial = initialState(y, trend, seasonal, m);

        List<Double> start = new ArrayList<>();
        start.add(ParameterSearch.unbounded(0.3, ALPHA_LOWER, ALPHA_UPPER));
        if (trend != Trend.NONE) {
            start.add(ParameterSearch.logit(0.1));
        }
        if (seasonal) {
            start.add(ParameterSearch.logit(0.1));
        }
        if (trend == Trend.DAMPED) {
            start.add(ParameterSearch.unbounded(0.9, PHI_LOWER, PHI_UPPER));
        }
        double[] guess = start.stream().mapToDouble(Double::doubleValue).toArray();

        PointValuePair optimum = ParameterSearch.minimize(
                point -> run(y, trend, seasonal, m, Parameters.decode(point, trend, seasonal), initial).sse,
                guess, maxEvaluations);

        Parameters parameters = Parameters.decode(optimum.getPoint(), trend, seasonal);
        Pass pass = run(y, trend, seasonal, m, parameters, initial);

        int stateCount = 1 + (trend != Trend.NONE ? 1 : 0) + (seasonal ? m - 1 : 0);
        int k = guess.length + stateCount + 1;
        double aicc = ParameterSearch.aicc(pass.sse, y.length, k, floor);
        int dof = y.length - k > 0 ? y.length - k : y.length;
        double sigma2 = pass.sse / dof;

        return new EtsFit(trend, seasonal, m, parameters, pass, y.length, sigma2, aicc);
    }

    private static State initialState(double[] y, Trend trend, boolean seasonal, int m) {
        double[] season = new double[m];
        double[] adjusted = y;
        if (seasonal) {
            ClassicalDecomposition decomposition = ClassicalDecomposition.additive(y, m);
            season = decomposition.seasonalIndices();
            adjusted = decomposition.adjust(y);
        }

        int window = Math.min(Math.max(10, 2 * m), y.length);
        if (trend == Trend.NONE) {
            return new State(StatUtils.mean(adjusted, 0, window), 0, season);
        }
        SimpleRegression regression = new SimpleRegression();
        for (int t = 1; t <= window; t++) {
            regression.addData(t, adjusted[t - 1]);
        }
        return new State(regression.getIntercept(), regression.getSlope(), season);
    }

    private static Pass run(double[] y, Trend trend, boolean seasonal, int m, Parameters p, State initial) {
        double level = initial.level;
        double slope = initial.trend;
        double[] season = Arrays.copyOf(initial.season, initial.season.length);
        double phi = trend == Trend.DAMPED ? p.phi : 1;
        double sse = 0;

        for (int i = 0; i < y.length; i++) {
            double seasonTerm = seasonal ? season[i % m] : 0;
            double damped = trend == Trend.NONE ? 0 : phi * slope;
            double error = y[i] - (level + damped + seasonTerm);
            sse += error * error;

            level = level + damped + p.alpha * error;
            if (trend != Trend.NONE) {
                slope = damped + p.beta * error;
            }
            if (seasonal) {
                season[i % m] = seasonTerm + p.gamma * error;
            }
        }
        return new Pass(sse, level, slope, season);
    }

    // ---------------------------------------------------------------
    // Value types
    // ---------------------------------------------------------------

    private static final class Parameters {
        final double alpha;
        final double beta;
        final double gamma;
        final double phi;

        private Parameters(double alpha, double beta, double gamma, double phi) {
            this.alpha = alpha;
            this.beta = beta;
            this.gamma = gamma;
            this.phi = phi;
        }

        static Parameters decode(double[] point, Trend trend, boolean seasonal) {
            int i = 0;
            double alpha = ParameterSearch.bounded(point[i++], ALPHA_LOWER, ALPHA_UPPER);
            double beta = trend != Trend.NONE ? alpha * ParameterSearch.logistic(point[i++]) : 0;
            double gamma = seasonal ? (1 - alpha) * ParameterSearch.logistic(point[i++]) : 0;
            double phi = trend == Trend.DAMPED ? ParameterSearch.bounded(point[i], PHI_LOWER, PHI_UPPER) : 1;
            return new Parameters(alpha, beta, gamma, phi);
        }
    }

    private static final class State {
        final double level;
        final double trend;
        final double[] season;

        State(double level, double trend, double[] season) {
            this.level = level;
            this.trend = trend;
            this.season = season;
        }
    }

    private static final class Pass {
        final double sse;
        final double level;
        final double trend;
        final double[] season;

        Pass(double sse, double level, double trend, double[] season) {
            this.sse = sse;
            this.level = level;
            this.trend = trend;
            this.season = season;
        }
    }

    static final class EtsFit implements FittedModel {
        private final Trend trend;
        private final boolean seasonal;
        private final int m;
        private final Parameters parameters;
        private final Pass finalState;
        private final int n;
        private final double sigma2;
        private final double aicc;

        EtsFit(Trend trend, boolean seasonal, int m, Parameters parameters, Pass finalState, int n,
                double sigma2, double aicc) {
            this.trend = trend;
            this.seasonal = seasonal;
            this.m = m;
            this.parameters = parameters;
            this.finalState = finalState;
            this.n = n;
            this.sigma2 = sigma2;
            this.aicc = aicc;
        }

        @Override
        public ModelForecast forecast(int horizon) {
            double phi = trend == Trend.DAMPED ? parameters.phi : 1;
            double slope = trend == Trend.NONE ? 0 : finalState.trend;

            double[] mean = new double[horizon];
            double[] se = new double[horizon];
            double phiSum = 0;
            double phiPower = 1;
            double varianceFactor = 1;
            for (int h = 1; h <= horizon; h++) {
                phiPower *= phi;
                phiSum += phiPower;
                double season = seasonal ? finalState.season[(n + h - 1) % m] : 0;
                mean[h - 1] = finalState.level + phiSum * slope + season;
                se[h - 1] = Math.sqrt(sigma2 * varianceFactor);

                // c_h enters the variance of step h + 1
                double c = parameters.alpha + parameters.beta * phiSum
                        + (seasonal && h % m == 0 ? parameters.gamma : 0);
                varianceFactor += c * c;
            }
            return new ModelForecast(mean, se);
        }

        @Override
        public String describe() {
            return "ETS(A," + trend.code + "," + (seasonal ? "A" : "N") + ")";
        }

        double aicc() {
            return aicc;
        }
    }
}
