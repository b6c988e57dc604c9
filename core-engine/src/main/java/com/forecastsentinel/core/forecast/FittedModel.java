package com.forecastsentinel.core.forecast;

/**
 * A model fitted to one series, able to extrapolate it.
 *
 * @since 1.0.0
 */
public interface FittedModel {

    /**
     * @param horizon number of future periods, &gt;= 1
     * @return point forecasts and their standard errors
     */
    ModelForecast forecast(int horizon);

    /**
     * @return the selected specification, e.g. {@code ETS(A,A,N)}
     */
    String describe();
}
