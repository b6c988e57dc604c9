package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.error.ComputationException;

/**
 * Contract for all forecasting models.
 *
 * <p>
 * A forecaster is configured once (season length, optimizer budget) and is
 * stateless afterwards: {@link #fit(double[])} returns a new
 * {@link FittedModel} and never mutates the forecaster, so one instance may be
 * shared between threads.
 * </p>
 *
 * @since 1.0.0
 */
public interface Forecaster {

    /**
     * Fit the model to the full series. There is no train/validation split.
     *
     * @param y observations in time order
     * @return the fitted model
     * @throws ComputationException if no candidate specification can be fitted
     */
    FittedModel fit(double[] y);

    /**
     * @return name reported as {@code modelUsed}, e.g. {@code AutoETS}
     */
    String getModelName();
}
