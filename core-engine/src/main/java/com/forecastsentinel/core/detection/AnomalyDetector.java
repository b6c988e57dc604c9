package com.forecastsentinel.core.detection;

import com.forecastsentinel.core.model.AnomalyResult;
import com.forecastsentinel.core.model.Sensitivity;
import com.forecastsentinel.core.model.TimeSeries;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: each call to
 * {@link #detect} looks at the whole series at once and no observation is
 * carried over to the next call. Calling twice with the same arguments gives
 * the same result apart from the measured computation time.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Flag the observations of {@code series} that fall outside their expected
     * range.
     *
     * @param series              prepared series
     * @param sensitivity         tuning tier
     * @param seasonLength        periods per seasonal cycle, &gt;= 1
     * @param showConfidenceBands {@code true} to include the per-point bands
     * @return the detection result
     */
    AnomalyResult detect(TimeSeries series, Sensitivity sensitivity, int seasonLength,
            boolean showConfidenceBands);

    /**
     * Return the name reported as {@code modelUsed}.
     *
     * @return model name
     */
    String getModelName();
}
