package com.meshsentinel.core.detection;

/**
 * Thrown when an entity does not have enough history to learn a baseline.
 *
 * <p>
 * Recoverable: callers skip the entity for this cycle and retry once more
 * samples have arrived.
 * </p>
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String entity;
    private final int required;
    private final int actual;

    public InsufficientDataException(String entity, int required, int actual, String what) {
        super("Insufficient " + what + " for entity '" + entity + "': " + actual + " < " + required);
        this.entity = entity;
        this.required = required;
        this.actual = actual;
    }

    public String getEntity() {
        return entity;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
