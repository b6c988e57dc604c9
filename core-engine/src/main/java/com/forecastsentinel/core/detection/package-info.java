/**
 * Anomaly detection over a prepared series. The rolling z-score detector is
 * the only implementation.
 */
package com.forecastsentinel.core.detection;
