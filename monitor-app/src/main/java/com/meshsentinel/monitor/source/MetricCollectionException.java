package com.meshsentinel.monitor.source;

/**
 * Thrown when a {@link MetricSource} cannot produce metrics for an entity.
 *
 * <p>
 * Scoped to one entity: the scanner logs it and carries on with the others.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricCollectionException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String entity;

    public MetricCollectionException(String entity, String message) {
        super("Failed to collect metrics for '" + entity + "': " + message);
        this.entity = entity;
    }

    public MetricCollectionException(String entity, String message, Throwable cause) {
        super("Failed to collect metrics for '" + entity + "': " + message, cause);
        this.entity = entity;
    }

    public String getEntity() {
        return entity;
    }
}
