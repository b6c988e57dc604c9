/**
 * Forecasting models and the engine that runs them.
 *
 * <p>
 * {@link com.forecastsentinel.core.forecast.Forecaster} is the model seam;
 * {@link com.forecastsentinel.core.forecast.ForecasterFactory} maps each
 * {@link com.forecastsentinel.core.model.ForecastModel} to an implementation,
 * and {@link com.forecastsentinel.core.forecast.ForecastEngine} turns the fitted
 * model's output into a {@link com.forecastsentinel.core.model.ForecastResult}.
 * </p>
 */
package com.forecastsentinel.core.forecast;
