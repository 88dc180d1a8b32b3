package com.meshsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One timestamped scalar observation of a metric.
 *
 * <p>
 * Instances are immutable: the label map is copied on construction and
 * exposed read-only.
 * </p>
 *
 * @since 1.0.0
 */
public final class Sample {

    private final Instant timestamp;
    private final double value;
    private final Map<String, String> labels;

    /**
     * @param timestamp observation time; must not be {@code null}
     * @param value     observed value
     * @param labels    sample labels; {@code null} is treated as empty
     * @throws NullPointerException if {@code timestamp} is {@code null}
     */
    public Sample(Instant timestamp, double value, Map<String, String> labels) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
        this.labels = labels == null || labels.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    public static Sample of(Instant timestamp, double value) {
        return new Sample(timestamp, value, null);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return unmodifiable label map, never {@code null}
     */
    public Map<String, String> getLabels() {
        return labels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Sample that))
            return false;
        return Double.compare(value, that.value) == 0
                && timestamp.equals(that.timestamp)
                && labels.equals(that.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value, labels);
    }

    @Override
    public String toString() {
        return "Sample{" +
                "timestamp=" + timestamp +
                ", value=" + value +
                ", labels=" + labels +
                '}';
    }
}
