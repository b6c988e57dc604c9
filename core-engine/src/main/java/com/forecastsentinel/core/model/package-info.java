/**
 * Domain model of the analysis core.
 *
 * <p>
 * Inputs ({@link com.forecastsentinel.core.model.DataPoint},
 * {@link com.forecastsentinel.core.model.ForecastRequest},
 * {@link com.forecastsentinel.core.model.AnomalyRequest}), the canonical
 * series ({@link com.forecastsentinel.core.model.TimeSeries}) and the result
 * types handed back to the transport layer
 * ({@link com.forecastsentinel.core.model.ForecastResult},
 * {@link com.forecastsentinel.core.model.AnomalyResult}). Result types carry
 * Jackson annotations that fix their wire names.
 * </p>
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.model;
