package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordinal severity of an anomalous point. Declaration order is the ordering.
 *
 * @since 1.0.0
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * @return lowercase identifier used on the wire
     */
    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
