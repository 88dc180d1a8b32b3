package com.meshsentinel.core.model;

/**
 * Coarse bucket for an anomaly's unitless severity ratio.
 *
 * @since 1.0.0
 */
public enum SeverityLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * @param severity severity ratio (&ge; 0)
     * @return CRITICAL from 3.0, HIGH from 2.0, MEDIUM from 1.5, LOW below
     */
    public static SeverityLevel of(double severity) {
        if (severity >= 3.0) {
            return CRITICAL;
        } else if (severity >= 2.0) {
            return HIGH;
        } else if (severity >= 1.5) {
            return MEDIUM;
        }
        return LOW;
    }
}
