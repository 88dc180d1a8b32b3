package com.meshsentinel.monitor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MonitorConfig} and {@link RunMode}.
 */
class MonitorConfigTest {

    @Test
    @DisplayName("Should build with defaults")
    void shouldBuildDefaults() {
        MonitorConfig config = new MonitorConfig.Builder().build();

        assertThat(config.getMode()).isEqualTo(RunMode.MONITOR);
        assertThat(config.getConfigPath()).isEmpty();
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.isHealthEnabled()).isTrue();
        assertThat(config.getEntities()).isEmpty();
        assertThat(config.getSimulationSeed()).isEqualTo(42);
    }

    @Test
    @DisplayName("Should reject a health port outside [1, 65535]")
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> new MonitorConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
    }

    @Test
    @DisplayName("Should reject a fault probability outside [0, 1]")
    void shouldRejectInvalidProbability() {
        assertThatThrownBy(() -> new MonitorConfig.Builder().faultProbability(1.5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("faultProbability");
    }

    @Test
    @DisplayName("Should reject blank entity names")
    void shouldRejectBlankEntities() {
        assertThatThrownBy(() -> new MonitorConfig.Builder().entities(Arrays.asList("checkout", " ")).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should copy the entity list")
    void shouldCopyEntities() {
        MonitorConfig config = new MonitorConfig.Builder().entities(List.of("checkout", "auth")).build();

        assertThat(config.getEntities()).containsExactly("checkout", "auth");
        assertThatThrownBy(() -> config.getEntities().add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should split comma-separated entity lists")
    void shouldParseEntityList() {
        assertThat(MonitorConfig.parseList(" checkout, payments ,,auth ")).containsExactly("checkout", "payments", "auth");
        assertThat(MonitorConfig.parseList("")).isEmpty();
    }

    @Test
    @DisplayName("Should resolve run modes by name")
    void shouldResolveRunMode() {
        assertThat(RunMode.fromName("scan")).isEqualTo(RunMode.SCAN);
        assertThat(RunMode.fromName(" Monitor ")).isEqualTo(RunMode.MONITOR);
        assertThatThrownBy(() -> RunMode.fromName("learn"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("learn");
    }
}
