/**
 * Request-level facade over validation, preparation, forecasting and anomaly
 * detection.
 */
package com.forecastsentinel.core.service;
