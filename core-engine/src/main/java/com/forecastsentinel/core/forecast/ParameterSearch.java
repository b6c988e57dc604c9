package com.forecastsentinel.core.forecast;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;

/**
 * Shared numerics for model fitting: Nelder–Mead minimization over an
 * unconstrained space, the logistic maps that bound parameters, and the
 * corrected Akaike criterion used for model selection.
 *
 * @since 1.0.0
 */
final class ParameterSearch {

    private static final double RELATIVE_TOLERANCE = 1e-10;
    private static final double ABSOLUTE_TOLERANCE = 1e-14;

    private ParameterSearch() {
        // utility class, not instantiable
    }

    /**
     * Minimize {@code objective} from {@code start}. Non-finite objective values
     * are treated as {@link Double#MAX_VALUE}.
     *
     * @throws org.apache.commons.math3.exception.TooManyEvaluationsException if
     *         the budget is exhausted
     */
    static PointValuePair minimize(MultivariateFunction objective, double[] start, int maxEvaluations) {
        MultivariateFunction guarded = point -> {
            double value = objective.value(point);
            return Double.isFinite(value) ? value : Double.MAX_VALUE;
        };
        SimplexOptimizer optimizer = new SimplexOptimizer(RELATIVE_TOLERANCE, ABSOLUTE_TOLERANCE);
        return optimizer.optimize(
                new MaxEval(maxEvaluations),
                new ObjectiveFunction(guarded),
                GoalType.MINIMIZE,
                new InitialGuess(start),
                new NelderMeadSimplex(start.length));
    }

    static double logistic(double u) {
        return 1 / (1 + Math.exp(-u));
    }

    static double logit(double p) {
        return Math.log(p / (1 - p));
    }

    /** Map {@code u} into the open interval {@code (lower, upper)}. */
    static double bounded(double u, double lower, double upper) {
        return lower + (upper - lower) * logistic(u);
    }

    /** Inverse of {@link #bounded}. */
    static double unbounded(double value, double lower, double upper) {
        return logit((value - lower) / (upper - lower));
    }

    /**
     * Smallest mean squared error used in likelihoods. Keeps exact fits finite
     * and lets the parameter penalty decide between them.
     */
    static double errorFloor(double[] y) {
        double meanSquare = 0;
        for (double v : y) {
            meanSquare += v * v;
        }
        meanSquare /= Math.max(1, y.length);
        return Math.max(1e-20 * meanSquare, Double.MIN_NORMAL);
    }

    /**
     * Corrected Akaike information criterion for a Gaussian likelihood.
     *
     * @param sse   sum of squared one-step errors
     * @param n     number of errors in {@code sse}
     * @param k     number of estimated parameters, including the variance
     * @param floor smallest admissible mean squared error
     * @return AICc, or {@link Double#POSITIVE_INFINITY} when {@code n <= k + 1}
     */
    static double aicc(double sse, int n, int k, double floor) {
        if (n - k - 1 <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        double mse = Math.max(sse / n, floor);
        double logLikelihood = -0.5 * n * (Math.log(2 * Math.PI * mse) + 1);
        double aic = -2 * logLikelihood + 2 * k;
        return aic + 2.0 * k * (k + 1) / (n - k - 1);
    }
}
