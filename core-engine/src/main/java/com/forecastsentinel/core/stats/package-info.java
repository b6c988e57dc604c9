/**
 * Statistical building blocks: rolling aggregates, classical decomposition,
 * autocorrelation and the KPSS stationarity test.
 *
 * <p>
 * Everything here is stateless and operates on plain {@code double[]}
 * sequences.
 * </p>
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.stats;
