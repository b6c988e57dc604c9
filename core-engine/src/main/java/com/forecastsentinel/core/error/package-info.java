/**
 * Error taxonomy of the analysis core.
 *
 * <ul>
 * <li>{@link com.forecastsentinel.core.error.DataValidationException}: bad
 * input, caller-fixable</li>
 * <li>{@link com.forecastsentinel.core.error.ComputationException}: fitting or
 * statistics failed on valid input</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.error;
