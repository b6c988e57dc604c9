package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.forecastsentinel.core.error.DataValidationException;

import java.util.Locale;

/**
 * Anomaly-detector tuning parameter.
 *
 * <p>
 * Each tier fixes the two-sided confidence level of the acceptance band and
 * the deviation thresholds for {@link Severity#HIGH} and
 * {@link Severity#MEDIUM}. Lower tiers use a narrower band but demand a larger
 * deviation before escalating severity.
 * </p>
 *
 * <table>
 * <caption>Tiers</caption>
 * <tr><th>tier</th><th>confidence</th><th>high if &gt;</th><th>medium if &gt;</th></tr>
 * <tr><td>low</td><td>90</td><td>3.0</td><td>2.0</td></tr>
 * <tr><td>medium</td><td>95</td><td>2.0</td><td>1.5</td></tr>
 * <tr><td>high</td><td>99</td><td>1.5</td><td>1.0</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public enum Sensitivity {
    LOW(90, 3.0, 2.0),
    MEDIUM(95, 2.0, 1.5),
    HIGH(99, 1.5, 1.0);

    private final int confidenceLevel;
    private final double highThreshold;
    private final double mediumThreshold;

    Sensitivity(int confidenceLevel, double highThreshold, double mediumThreshold) {
        this.confidenceLevel = confidenceLevel;
        this.highThreshold = highThreshold;
        this.mediumThreshold = mediumThreshold;
    }

    /**
     * Resolve a wire identifier ({@code low}, {@code medium}, {@code high}).
     *
     * @param id identifier, case-insensitive
     * @return the tier
     * @throws DataValidationException if {@code id} is {@code null} or unknown
     */
    public static Sensitivity fromId(String id) {
        if (id != null) {
            for (Sensitivity sensitivity : values()) {
                if (sensitivity.id().equals(id.trim().toLowerCase(Locale.ROOT))) {
                    return sensitivity;
                }
            }
        }
        throw new DataValidationException(
                "Unknown sensitivity: '" + id + "'. Supported: low, medium, high");
    }

    /** Two-sided confidence level in percent. */
    public int getConfidenceLevel() {
        return confidenceLevel;
    }

    public double getHighThreshold() {
        return highThreshold;
    }

    public double getMediumThreshold() {
        return mediumThreshold;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
