package com.meshsentinel.core.config;

import com.meshsentinel.core.store.RetentionPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader} and configuration validation.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        SentinelConfig config = ConfigLoader.fromClasspath("test-sentinel.yml");

        assertThat(config.getDetection().getTrafficSpikeThreshold()).isEqualTo(3.0);
        assertThat(config.getDetection().getErrorRateThreshold()).isEqualTo(0.1);
        assertThat(config.getDetection().getWindowSize()).isEqualTo(5);
        assertThat(config.getDetection().getSensitivityLevel()).isEqualTo(1.5);
        assertThat(config.getClustering().getK()).isEqualTo(2);
        assertThat(config.getClustering().toKMeansConfig().getTolerance()).isEqualTo(0.001);
        assertThat(config.getOutput().getFormat()).isEqualTo("json");
        assertThat(config.getOutput().isVerbose()).isTrue();
        assertThat(config.getMonitor().getHistorySize()).isEqualTo(30);
        assertThat(config.getMonitor().toRetentionPolicy().getMaxPoints()).contains(500);
    }

    @Test
    @DisplayName("Should keep defaults for values the file leaves out")
    void shouldKeepDefaultsForMissingValues() {
        SentinelConfig config = ConfigLoader.fromClasspath("test-sentinel.yml");

        assertThat(config.getDetection().getLatencyThresholdMs()).isEqualTo(1000);
        assertThat(config.getDetection().getCircuitBreakerThreshold()).isZero();
        assertThat(config.getDetection().getPrimaryMetric()).isEqualTo("request_count");
        assertThat(config.getMonitor().getRetentionMaxAgeSeconds()).isZero();
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyFile() {
        SentinelConfig config = ConfigLoader.fromClasspath("empty-sentinel.yml");

        assertThat(config.getDetection().getWindowSize()).isEqualTo(10);
        assertThat(config.getClustering().getK()).isEqualTo(3);
        assertThat(config.getOutput().getFormat()).isEqualTo("text");
        assertThat(config.getMonitor().toRetentionPolicy().isUnbounded()).isTrue();
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the config file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String missing = dir.resolve("missing.yml").toString();

        assertThatThrownBy(() -> ConfigLoader.fromFile(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load configuration from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sentinel.yml");
        Files.writeString(file, "monitor:\n  retentionMaxAgeSeconds: 3600\n");

        SentinelConfig config = ConfigLoader.fromFile(file.toString());

        assertThat(config.getMonitor().toRetentionPolicy().getMaxAge()).contains(Duration.ofHours(1));
    }

    @Test
    @DisplayName("Should report every invalid value at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("invalid-sentinel.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("detection.windowSize")
                .hasMessageContaining("detection.sensitivityLevel")
                .hasMessageContaining("output.format");
    }

    @Test
    @DisplayName("Should reject unknown keys")
    void shouldRejectUnknownKeys() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("unknown-key-sentinel.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should require more history than one feature window")
    void shouldRequireHistoryBeyondWindow() {
        SentinelConfig config = SentinelConfig.defaults();
        config.getMonitor().setHistorySize(10);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("monitor.historySize");
    }

    @Test
    @DisplayName("Should accept the defaults")
    void shouldAcceptDefaults() {
        SentinelConfig config = SentinelConfig.defaults();

        config.validate();

        assertThat(config.getMonitor().toRetentionPolicy()).isSameAs(RetentionPolicy.unbounded());
    }
}
