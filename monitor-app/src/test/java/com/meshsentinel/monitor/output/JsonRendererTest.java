package com.meshsentinel.monitor.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonRenderer}.
 */
class JsonRendererTest {

    private final JsonRenderer renderer = new JsonRenderer();
    private final ObjectMapper reader = new ObjectMapper();

    @Test
    @DisplayName("Should write anomalies as a JSON array with ISO timestamps")
    void shouldRenderArray() throws Exception {
        JsonNode root = reader.readTree(renderer.render(List.of(RendererFixtures.errorRateAnomaly())));

        assertThat(root.isArray()).isTrue();
        assertThat(root).hasSize(1);
        JsonNode anomaly = root.get(0);
        assertThat(anomaly.get("type").asText()).isEqualTo("error_rate_high");
        assertThat(anomaly.get("entity").asText()).isEqualTo("checkout");
        assertThat(anomaly.get("severity").asDouble()).isEqualTo(2.4);
        assertThat(anomaly.get("timestamp").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(anomaly.get("metrics").get("error_rate").asDouble()).isEqualTo(0.12);
        assertThat(anomaly.get("labels").get("app").asText()).isEqualTo("checkout");
        assertThat(anomaly.has("severityLevel")).isFalse();
    }

    @Test
    @DisplayName("Should write an empty array when there is nothing to report")
    void shouldRenderEmptyArray() throws Exception {
        JsonNode root = reader.readTree(renderer.render(List.of()));

        assertThat(root.isArray()).isTrue();
        assertThat(root).isEmpty();
    }
}
