/**
 * Configuration loading and validation for the analysis engine.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.forecastsentinel.core.config.EngineConfigLoader} into an
 * {@link com.forecastsentinel.core.config.EngineConfig}. Validation runs right
 * after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.config;
