package com.forecastsentinel.core.detection;

import com.forecastsentinel.core.model.Sensitivity;
import com.forecastsentinel.core.model.Severity;

import java.util.Objects;

/**
 * Maps a normalized deviation to a {@link Severity} using the thresholds of a
 * {@link Sensitivity} tier. Both comparisons are strict.
 *
 * @since 1.0.0
 */
public final class SeverityClassifier {

    private SeverityClassifier() {
        // utility class, not instantiable
    }

    /**
     * @param deviation   distance from the band midpoint in half-widths
     * @param sensitivity tier supplying the thresholds
     * @return the severity
     */
    public static Severity classify(double deviation, Sensitivity sensitivity) {
        Objects.requireNonNull(sensitivity, "sensitivity must not be null");
        if (deviation > sensitivity.getHighThreshold()) {
            return Severity.HIGH;
        }
        if (deviation > sensitivity.getMediumThreshold()) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
