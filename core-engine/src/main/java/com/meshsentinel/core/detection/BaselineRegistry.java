package com.meshsentinel.core.detection;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entity to {@link Baseline} mapping.
 *
 * <p>
 * Baselines are immutable, so a replacement is a single atomic swap in a
 * {@link ConcurrentHashMap}: a concurrent detection call sees either the old
 * or the new baseline in full, never a mix.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineRegistry {

    private final Map<String, Baseline> baselines = new ConcurrentHashMap<>();

    /**
     * Install {@code baseline} for its entity, replacing any previous one.
     *
     * @return the replaced baseline, if there was one
     */
    public Optional<Baseline> put(Baseline baseline) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        return Optional.ofNullable(baselines.put(baseline.getEntity(), baseline));
    }

    public Optional<Baseline> find(String entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        return Optional.ofNullable(baselines.get(entity));
    }

    public boolean contains(String entity) {
        return find(entity).isPresent();
    }

    public Optional<Baseline> remove(String entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        return Optional.ofNullable(baselines.remove(entity));
    }

    /**
     * @return sorted snapshot of entities that have a baseline
     */
    public Set<String> entities() {
        return Collections.unmodifiableSet(new TreeSet<>(baselines.keySet()));
    }

    public int size() {
        return baselines.size();
    }
}
