package com.meshsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Anomaly record emitted by the detector.
 *
 * <p>
 * Instances are immutable once built. Rendered to text, table or JSON by the
 * monitor's output layer.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code type}, {@code entity} and {@code timestamp}
 * are required; omitting any of them throws {@link NullPointerException} at
 * build time. A negative severity is rejected with
 * {@link IllegalArgumentException}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "type", "entity", "severity", "description", "timestamp", "metrics", "labels" })
public final class Anomaly {

    private final AnomalyType type;
    private final String entity;
    private final double severity;
    private final String description;
    private final Instant timestamp;
    private final Map<String, Double> metrics;
    private final Map<String, String> labels;

    private Anomaly(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.entity = Objects.requireNonNull(builder.entity, "entity must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        if (builder.severity < 0 || Double.isNaN(builder.severity)) {
            throw new IllegalArgumentException("severity must be >= 0, got: " + builder.severity);
        }
        this.severity = builder.severity;
        this.description = builder.description != null ? builder.description : "";
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metrics));
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(builder.labels));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Anomaly} instances.
     */
    public static class Builder {
        private AnomalyType type;
        private String entity;
        private double severity;
        private String description;
        private Instant timestamp;
        private final Map<String, Double> metrics = new LinkedHashMap<>();
        private final Map<String, String> labels = new LinkedHashMap<>();

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public Builder entity(String entity) {
            this.entity = entity;
            return this;
        }

        public Builder severity(double severity) {
            this.severity = severity;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder metric(String name, double value) {
            this.metrics.put(Objects.requireNonNull(name, "metric name must not be null"), value);
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            if (labels != null) {
                this.labels.putAll(labels);
            }
            return this;
        }

        /**
         * Build the anomaly.
         *
         * @return a new {@link Anomaly}
         * @throws NullPointerException     if type, entity or timestamp is missing
         * @throws IllegalArgumentException if severity is negative or NaN
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public AnomalyType getType() {
        return type;
    }

    public String getEntity() {
        return entity;
    }

    public double getSeverity() {
        return severity;
    }

    @JsonIgnore
    public SeverityLevel getSeverityLevel() {
        return SeverityLevel.of(severity);
    }

    public String getDescription() {
        return description;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return unmodifiable map of the metric values that triggered the anomaly
     */
    public Map<String, Double> getMetrics() {
        return metrics;
    }

    /**
     * @return unmodifiable labels of the sample that triggered the anomaly
     */
    public Map<String, String> getLabels() {
        return labels;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return type == that.type
                && Double.compare(severity, that.severity) == 0
                && entity.equals(that.entity)
                && description.equals(that.description)
                && timestamp.equals(that.timestamp)
                && metrics.equals(that.metrics)
                && labels.equals(that.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, entity, severity, description, timestamp, metrics, labels);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "type=" + type +
                ", entity='" + entity + '\'' +
                ", severity=" + severity +
                ", timestamp=" + timestamp +
                ", description='" + description + '\'' +
                '}';
    }
}
