/**
 * Input validation and series preparation shared by the forecasting and
 * anomaly-detection paths.
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.prepare;
