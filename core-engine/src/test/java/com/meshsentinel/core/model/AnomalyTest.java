package com.meshsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Anomaly}, {@link AnomalyType} and {@link SeverityLevel}.
 */
class AnomalyTest {

    private static final Instant TS = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("Should copy labels so later changes do not leak in")
    void shouldCopyLabels() {
        Map<String, String> labels = new HashMap<>();
        labels.put("pod", "a");

        Anomaly anomaly = base().labels(labels).build();
        labels.put("pod", "b");

        assertThat(anomaly.getLabels()).containsEntry("pod", "a");
        assertThatThrownBy(() -> anomaly.getLabels().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should reject negative or NaN severity")
    void shouldRejectInvalidSeverity() {
        assertThatThrownBy(() -> base().severity(-0.1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base().severity(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should require type, entity and timestamp")
    void shouldRequireMandatoryFields() {
        assertThatThrownBy(() -> Anomaly.builder().entity("e").timestamp(TS).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("type");
    }

    @Test
    @DisplayName("Should compare every field for equality")
    void shouldCompareAllFields() {
        Anomaly anomaly = base().description("spike").metric("recent_mean", 250).labels(Map.of("pod", "a")).build();
        Anomaly same = base().description("spike").metric("recent_mean", 250).labels(Map.of("pod", "a")).build();

        assertThat(anomaly).isEqualTo(same).hasSameHashCodeAs(same);
        assertThat(anomaly).isNotEqualTo(base().description("other").metric("recent_mean", 250)
                .labels(Map.of("pod", "a")).build());
        assertThat(anomaly).isNotEqualTo(base().description("spike").metric("recent_mean", 300)
                .labels(Map.of("pod", "a")).build());
        assertThat(anomaly).isNotEqualTo(base().description("spike").metric("recent_mean", 250)
                .labels(Map.of("pod", "b")).build());
    }

    @Test
    @DisplayName("Should bucket severity into levels")
    void shouldMapSeverityLevels() {
        assertThat(SeverityLevel.of(1.0)).isEqualTo(SeverityLevel.LOW);
        assertThat(SeverityLevel.of(1.5)).isEqualTo(SeverityLevel.MEDIUM);
        assertThat(SeverityLevel.of(2.0)).isEqualTo(SeverityLevel.HIGH);
        assertThat(SeverityLevel.of(3.0)).isEqualTo(SeverityLevel.CRITICAL);
        assertThat(base().severity(2.5).build().getSeverityLevel()).isEqualTo(SeverityLevel.HIGH);
    }

    @Test
    @DisplayName("Should resolve anomaly types by id")
    void shouldResolveTypeById() {
        assertThat(AnomalyType.fromId("retry_storm")).isEqualTo(AnomalyType.RETRY_STORM);
        assertThat(AnomalyType.fromId("BEHAVIORAL_ANOMALY")).isEqualTo(AnomalyType.BEHAVIORAL_ANOMALY);
        assertThatThrownBy(() -> AnomalyType.fromId("unknown"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Anomaly.Builder base() {
        return Anomaly.builder()
                .type(AnomalyType.TRAFFIC_SPIKE)
                .entity("checkout")
                .severity(1.0)
                .timestamp(TS);
    }
}
