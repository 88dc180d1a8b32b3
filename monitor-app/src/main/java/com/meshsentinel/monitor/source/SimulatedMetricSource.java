package com.meshsentinel.monitor.source;

import com.meshsentinel.core.model.MetricNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Seeded, in-process stand-in for a service mesh telemetry backend.
 *
 * <p>
 * Every entity gets a steady traffic level drawn at construction; each reading
 * adds Gaussian noise around it. With probability {@code faultProbability} a
 * reading instead carries one injected fault: a traffic burst, an error burst,
 * a latency burst or open circuit breakers. The same seed always yields the
 * same sequence of readings.
 * </p>
 *
 * @since 1.0.0
 */
public class SimulatedMetricSource implements MetricSource {

    private static final Logger LOG = LoggerFactory.getLogger(SimulatedMetricSource.class);

    /** Entities simulated when none are configured. */
    public static final List<String> DEFAULT_ENTITIES =
            List.of("frontend", "checkout", "payments", "inventory", "auth");

    static final String NAMESPACE = "mesh-demo";

    enum Fault {
        TRAFFIC_BURST,
        ERROR_BURST,
        LATENCY_BURST,
        CIRCUIT_OPEN
    }

    private final Random random;
    private final double faultProbability;
    private final Map<String, Profile> profiles = new LinkedHashMap<>();

    /**
     * @param entities         entities to simulate; empty for
     *                         {@link #DEFAULT_ENTITIES}
     * @param seed             random seed
     * @param faultProbability chance in [0, 1] that a reading carries a fault
     */
    public SimulatedMetricSource(List<String> entities, long seed, double faultProbability) {
        Objects.requireNonNull(entities, "entities must not be null");
        if (faultProbability < 0 || faultProbability > 1) {
            throw new IllegalArgumentException("faultProbability must be in [0, 1], got: " + faultProbability);
        }
        this.random = new Random(seed);
        this.faultProbability = faultProbability;
        for (String entity : entities.isEmpty() ? DEFAULT_ENTITIES : entities) {
            double rps = 50 + random.nextDouble() * 450;
            double latencyMs = 80 + random.nextDouble() * 220;
            profiles.put(entity, new Profile(rps, latencyMs));
        }
    }

    @Override
    public List<String> discoverEntities() {
        return Collections.unmodifiableList(new ArrayList<>(profiles.keySet()));
    }

    @Override
    public synchronized Map<String, Double> collect(String entity) throws MetricCollectionException {
        Profile profile = profiles.get(entity);
        if (profile == null) {
            throw new MetricCollectionException(entity, "entity is not part of the simulated mesh");
        }

        double rps = noisy(profile.rps, 0.05);
        double errorRate = Math.max(0, 0.01 + random.nextGaussian() * 0.003);
        double latencyMs = noisy(profile.latencyMs, 0.10);
        double retries = Math.round(rps * 0.02 + Math.abs(random.nextGaussian()));
        double timeouts = Math.round(Math.abs(random.nextGaussian()));
        double circuitsOpen = 0;

        if (random.nextDouble() < faultProbability) {
            Fault fault = Fault.values()[random.nextInt(Fault.values().length)];
            LOG.debug("Injecting {} into [{}]", fault, entity);
            switch (fault) {
                case TRAFFIC_BURST -> rps *= 3 + random.nextDouble() * 2;
                case ERROR_BURST -> {
                    errorRate = 0.15 + random.nextDouble() * 0.15;
                    retries *= 10;
                }
                case LATENCY_BURST -> {
                    latencyMs *= 4;
                    timeouts += 20;
                }
                case CIRCUIT_OPEN -> circuitsOpen = 1 + random.nextInt(3);
            }
        }

        Map<String, Double> metrics = new HashMap<>();
        metrics.put(MetricNames.TRAFFIC_RPS, rps);
        metrics.put(MetricNames.REQUEST_COUNT, (double) Math.round(rps * 60));
        metrics.put(MetricNames.ERROR_RATE, errorRate);
        metrics.put(MetricNames.LATENCY_P99, latencyMs);
        metrics.put(MetricNames.RESPONSE_TIME, latencyMs * 0.4);
        metrics.put(MetricNames.SATURATION_CPU, Math.min(1.0, rps / 1000 + Math.abs(random.nextGaussian()) * 0.05));
        metrics.put(MetricNames.RETRY_COUNT, retries);
        metrics.put(MetricNames.TIMEOUT_COUNT, timeouts);
        metrics.put(MetricNames.CIRCUIT_BREAKERS_OPEN, circuitsOpen);
        return metrics;
    }

    @Override
    public Map<String, String> labelsOf(String entity) {
        return Map.of("app", entity, "namespace", NAMESPACE);
    }

    private double noisy(double mean, double relativeStdDev) {
        return Math.max(0, mean + random.nextGaussian() * mean * relativeStdDev);
    }

    private static final class Profile {
        private final double rps;
        private final double latencyMs;

        private Profile(double rps, double latencyMs) {
            this.rps = rps;
            this.latencyMs = latencyMs;
        }
    }
}
