package com.meshsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of anomaly kinds the detector can emit.
 *
 * <p>
 * The {@link #getId() id} is the stable wire name used in rendered output.
 * </p>
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    TRAFFIC_SPIKE("traffic_spike"),
    ERROR_RATE_HIGH("error_rate_high"),
    LATENCY_ANOMALY("latency_anomaly"),
    CIRCUIT_BREAKER("circuit_breaker"),
    RETRY_STORM("retry_storm"),
    TIMEOUT_ANOMALY("timeout_anomaly"),
    BEHAVIORAL_ANOMALY("behavioral_anomaly");

    private final String id;

    AnomalyType(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Resolve a type from its id, case-insensitively.
     *
     * @param id the snake_case id
     * @return the matching type
     * @throws IllegalArgumentException if no type has this id
     */
    public static AnomalyType fromId(String id) {
        if (id != null) {
            String normalized = id.toLowerCase(Locale.ROOT);
            for (AnomalyType type : values()) {
                if (type.id.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown anomaly type: '" + id + "'");
    }

    @Override
    public String toString() {
        return id;
    }
}
