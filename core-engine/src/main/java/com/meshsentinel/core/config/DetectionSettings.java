package com.meshsentinel.core.config;

import com.meshsentinel.core.model.MetricNames;

import java.util.ArrayList;
import java.util.List;

/**
 * Thresholds and window parameters for the hybrid detector.
 *
 * <p>
 * Static thresholds are compared against the latest value of their metric
 * (or, for traffic spikes, against a recent-to-prior mean ratio); severity is
 * the ratio of the observed value to its threshold.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionSettings {

    /** Recent/prior mean ratio above which traffic counts as a spike. */
    private double trafficSpikeThreshold = 2.0;

    /** Error ratio (0..1) above which the error rate is high. */
    private double errorRateThreshold = 0.05;

    /** p99 latency in milliseconds. */
    private double latencyThresholdMs = 1000;

    private double retryThreshold = 100;

    private double timeoutThreshold = 10;

    /** Open circuit breakers tolerated; any count above it fires. */
    private double circuitBreakerThreshold = 0;

    /** Samples per feature window; also the minimum for baseline learning. */
    private int windowSize = 10;

    /** Multiplier on the pooled baseline standard deviation. */
    private double sensitivityLevel = 2.0;

    /** Metric whose history feeds baseline learning and the behavioural check. */
    private String primaryMetric = MetricNames.REQUEST_COUNT;

    /**
     * Validate this section on its own.
     *
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        collectErrors(errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid DetectionSettings: " + String.join("; ", errors));
        }
    }

    void collectErrors(List<String> errors) {
        if (trafficSpikeThreshold <= 0) {
            errors.add("detection.trafficSpikeThreshold must be > 0, got: " + trafficSpikeThreshold);
        }
        if (errorRateThreshold <= 0) {
            errors.add("detection.errorRateThreshold must be > 0, got: " + errorRateThreshold);
        }
        if (latencyThresholdMs <= 0) {
            errors.add("detection.latencyThresholdMs must be > 0, got: " + latencyThresholdMs);
        }
        if (retryThreshold < 0) {
            errors.add("detection.retryThreshold must be >= 0, got: " + retryThreshold);
        }
        if (timeoutThreshold < 0) {
            errors.add("detection.timeoutThreshold must be >= 0, got: " + timeoutThreshold);
        }
        if (circuitBreakerThreshold < 0) {
            errors.add("detection.circuitBreakerThreshold must be >= 0, got: " + circuitBreakerThreshold);
        }
        if (windowSize < 1) {
            errors.add("detection.windowSize must be >= 1, got: " + windowSize);
        }
        if (sensitivityLevel <= 0) {
            errors.add("detection.sensitivityLevel must be > 0, got: " + sensitivityLevel);
        }
        if (primaryMetric == null || primaryMetric.isBlank()) {
            errors.add("detection.primaryMetric is required");
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getTrafficSpikeThreshold() {
        return trafficSpikeThreshold;
    }

    public void setTrafficSpikeThreshold(double trafficSpikeThreshold) {
        this.trafficSpikeThreshold = trafficSpikeThreshold;
    }

    public double getErrorRateThreshold() {
        return errorRateThreshold;
    }

    public void setErrorRateThreshold(double errorRateThreshold) {
        this.errorRateThreshold = errorRateThreshold;
    }

    public double getLatencyThresholdMs() {
        return latencyThresholdMs;
    }

    public void setLatencyThresholdMs(double latencyThresholdMs) {
        this.latencyThresholdMs = latencyThresholdMs;
    }

    public double getRetryThreshold() {
        return retryThreshold;
    }

    public void setRetryThreshold(double retryThreshold) {
        this.retryThreshold = retryThreshold;
    }

    public double getTimeoutThreshold() {
        return timeoutThreshold;
    }

    public void setTimeoutThreshold(double timeoutThreshold) {
        this.timeoutThreshold = timeoutThreshold;
    }

    public double getCircuitBreakerThreshold() {
        return circuitBreakerThreshold;
    }

    public void setCircuitBreakerThreshold(double circuitBreakerThreshold) {
        this.circuitBreakerThreshold = circuitBreakerThreshold;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public double getSensitivityLevel() {
        return sensitivityLevel;
    }

    public void setSensitivityLevel(double sensitivityLevel) {
        this.sensitivityLevel = sensitivityLevel;
    }

    public String getPrimaryMetric() {
        return primaryMetric;
    }

    public void setPrimaryMetric(String primaryMetric) {
        this.primaryMetric = primaryMetric;
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "trafficSpikeThreshold=" + trafficSpikeThreshold +
                ", errorRateThreshold=" + errorRateThreshold +
                ", latencyThresholdMs=" + latencyThresholdMs +
                ", retryThreshold=" + retryThreshold +
                ", timeoutThreshold=" + timeoutThreshold +
                ", circuitBreakerThreshold=" + circuitBreakerThreshold +
                ", windowSize=" + windowSize +
                ", sensitivityLevel=" + sensitivityLevel +
                ", primaryMetric='" + primaryMetric + '\'' +
                '}';
    }
}
