package com.meshsentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the Mesh Sentinel YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional and falls back to the
 * default shown):
 * </p>
 *
 * <pre>
 * detection:
 *   trafficSpikeThreshold: 2.0
 *   errorRateThreshold: 0.05
 *   latencyThresholdMs: 1000
 *   retryThreshold: 100
 *   timeoutThreshold: 10
 *   circuitBreakerThreshold: 0
 *   windowSize: 10
 *   sensitivityLevel: 2.0
 *   primaryMetric: request_count
 * clustering:
 *   k: 3
 *   maxIterations: 100
 *   tolerance: 0.01
 * output:
 *   format: text
 *   verbose: false
 * monitor:
 *   intervalSeconds: 30
 *   historySize: 50
 *   learningTicks: 20
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading; {@link ConfigLoader} does so
 * automatically.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelConfig {

    private DetectionSettings detection = new DetectionSettings();
    private ClusteringSettings clustering = new ClusteringSettings();
    private OutputSettings output = new OutputSettings();
    private MonitorSettings monitor = new MonitorSettings();

    /**
     * @return a configuration holding every default
     */
    public static SentinelConfig defaults() {
        return new SentinelConfig();
    }

    /**
     * Validate every section.
     *
     * <p>
     * Collects all errors and throws a single exception listing them.
     * </p>
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        detection.collectErrors(errors);
        clustering.collectErrors(errors);
        output.collectErrors(errors);
        monitor.collectErrors(errors);

        if (monitor.getHistorySize() <= detection.getWindowSize()) {
            errors.add("monitor.historySize (" + monitor.getHistorySize()
                    + ") must exceed detection.windowSize (" + detection.getWindowSize()
                    + ") for behavioural detection to run");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public DetectionSettings getDetection() {
        return detection;
    }

    public void setDetection(DetectionSettings detection) {
        this.detection = detection != null ? detection : new DetectionSettings();
    }

    public ClusteringSettings getClustering() {
        return clustering;
    }

    public void setClustering(ClusteringSettings clustering) {
        this.clustering = clustering != null ? clustering : new ClusteringSettings();
    }

    public OutputSettings getOutput() {
        return output;
    }

    public void setOutput(OutputSettings output) {
        this.output = output != null ? output : new OutputSettings();
    }

    public MonitorSettings getMonitor() {
        return monitor;
    }

    public void setMonitor(MonitorSettings monitor) {
        this.monitor = monitor != null ? monitor : new MonitorSettings();
    }

    @Override
    public String toString() {
        return "SentinelConfig{" +
                "detection=" + detection +
                ", clustering=" + clustering +
                ", output=" + output +
                ", monitor=" + monitor +
                '}';
    }
}
