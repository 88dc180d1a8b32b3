package com.meshsentinel.core.store;

import java.util.Objects;

/**
 * Composite identity of a series: the entity it belongs to and the metric it
 * records.
 *
 * <p>
 * Rendered as {@code entity:metric}. Equality compares both parts, so an
 * entity name containing the separator cannot collide with another key.
 * </p>
 */
public final class SeriesKey {

    static final char SEPARATOR = ':';

    private final String entity;
    private final String metric;

    private SeriesKey(String entity, String metric) {
        this.entity = entity;
        this.metric = metric;
    }

    /**
     * @throws NullPointerException if either part is {@code null}
     */
    public static SeriesKey of(String entity, String metric) {
        return new SeriesKey(
                Objects.requireNonNull(entity, "entity must not be null"),
                Objects.requireNonNull(metric, "metric must not be null"));
    }

    public String getEntity() {
        return entity;
    }

    public String getMetric() {
        return metric;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesKey that))
            return false;
        return entity.equals(that.entity) && metric.equals(that.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, metric);
    }

    @Override
    public String toString() {
        return entity + SEPARATOR + metric;
    }
}
