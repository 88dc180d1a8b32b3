package com.meshsentinel.monitor.source;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Where the monitor gets its samples from.
 *
 * <p>
 * Implementations wrap whatever telemetry backend is available. Metric names
 * should follow {@link com.meshsentinel.core.model.MetricNames} so the
 * detector's rules find them.
 * </p>
 *
 * @since 1.0.0
 */
public interface MetricSource {

    /**
     * @return names of the entities currently known to the source
     */
    List<String> discoverEntities();

    /**
     * Take one reading of every metric the source has for {@code entity}.
     *
     * @param entity entity name
     * @return metric name to current value
     * @throws MetricCollectionException if the entity cannot be read right now
     */
    Map<String, Double> collect(String entity) throws MetricCollectionException;

    /**
     * @return labels attached to every sample recorded for {@code entity}
     */
    default Map<String, String> labelsOf(String entity) {
        return Collections.emptyMap();
    }
}
