package com.meshsentinel.monitor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable process settings for the monitor application.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the monitor is configurable through Kubernetes Deployment env vars, Docker
 * {@code -e} flags or a shell environment. Detection tuning lives in the YAML
 * configuration instead; this class only says where to find it.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitorConfig {

    private final RunMode mode;
    private final String configPath;
    private final int healthPort;
    private final boolean healthEnabled;
    private final List<String> entities;
    private final long simulationSeed;
    private final double faultProbability;

    private MonitorConfig(Builder b) {
        this.mode = b.mode;
        this.configPath = b.configPath;
        this.healthPort = b.healthPort;
        this.healthEnabled = b.healthEnabled;
        this.entities = Collections.unmodifiableList(new ArrayList<>(b.entities));
        this.simulationSeed = b.simulationSeed;
        this.faultProbability = b.faultProbability;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link MonitorConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static MonitorConfig fromEnvironment() {
        try {
            return new Builder()
                    .mode(RunMode.fromName(env("SENTINEL_MODE", "monitor")))
                    .configPath(env("SENTINEL_CONFIG_PATH", ""))
                    .healthPort(Integer.parseInt(env("HEALTH_PORT", "8080")))
                    .healthEnabled(Boolean.parseBoolean(env("HEALTH_ENABLED", "true")))
                    .entities(parseList(env("SENTINEL_ENTITIES", "")))
                    .simulationSeed(Long.parseLong(env("SIMULATION_SEED", "42")))
                    .faultProbability(Double.parseDouble(env("SIMULATION_FAULT_PROBABILITY", "0.05")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public RunMode getMode() {
        return mode;
    }

    /**
     * @return YAML configuration path, or an empty string to use
     *         {@code ConfigLoader}'s own resolution
     */
    public String getConfigPath() {
        return configPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    public boolean isHealthEnabled() {
        return healthEnabled;
    }

    /**
     * @return entities to watch; empty means "whatever the source discovers"
     */
    public List<String> getEntities() {
        return entities;
    }

    public long getSimulationSeed() {
        return simulationSeed;
    }

    public double getFaultProbability() {
        return faultProbability;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link MonitorConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (port in [1, 65535], fault probability in [0, 1], no blank
     * entity names).
     * </p>
     */
    public static class Builder {
        private RunMode mode = RunMode.MONITOR;
        private String configPath = "";
        private int healthPort = 8080;
        private boolean healthEnabled = true;
        private List<String> entities = List.of();
        private long simulationSeed = 42;
        private double faultProbability = 0.05;

        public Builder mode(RunMode v) {
            this.mode = v;
            return this;
        }

        public Builder configPath(String v) {
            this.configPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder healthEnabled(boolean v) {
            this.healthEnabled = v;
            return this;
        }

        public Builder entities(List<String> v) {
            this.entities = v;
            return this;
        }

        public Builder simulationSeed(long v) {
            this.simulationSeed = v;
            return this;
        }

        public Builder faultProbability(double v) {
            this.faultProbability = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link MonitorConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public MonitorConfig build() {
            Objects.requireNonNull(mode, "mode required");
            Objects.requireNonNull(configPath, "configPath required");
            Objects.requireNonNull(entities, "entities required");

            for (String entity : entities) {
                if (entity == null || entity.isBlank()) {
                    throw new IllegalArgumentException("entity names must not be null or blank");
                }
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (faultProbability < 0 || faultProbability > 1 || Double.isNaN(faultProbability)) {
                throw new IllegalArgumentException(
                        "faultProbability must be in [0, 1], got: " + faultProbability);
            }

            return new MonitorConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    /**
     * Split a comma-separated list, dropping blanks.
     */
    static List<String> parseList(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "mode=" + mode +
                ", configPath='" + configPath + '\'' +
                ", healthPort=" + healthPort +
                ", healthEnabled=" + healthEnabled +
                ", entities=" + entities +
                ", simulationSeed=" + simulationSeed +
                ", faultProbability=" + faultProbability +
                '}';
    }
}
