package com.meshsentinel.monitor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshsentinel.core.detection.BaselineRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.ServerSocket;
import java.net.URL;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HealthServer}.
 */
class HealthServerTest {

    private final ScanMetrics metrics = new ScanMetrics();
    private final AtomicReference<ScanPhase> phase = new AtomicReference<>(ScanPhase.LEARN);
    private final HealthServer server = new HealthServer(metrics, new BaselineRegistry(), phase::get);

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Should report phase, baselines and counters")
    void shouldDescribeState() throws Exception {
        metrics.incrementTicks();
        metrics.addAnomaliesDetected(3);

        JsonNode body = new ObjectMapper().readTree(server.healthBody());

        assertThat(body.get("status").asText()).isEqualTo("UP");
        assertThat(body.get("phase").asText()).isEqualTo("learn");
        assertThat(body.get("baselines").asInt()).isZero();
        assertThat(body.get("counters").get("ticks_total").asLong()).isEqualTo(1);
        assertThat(body.get("counters").get("anomalies_detected_total").asLong()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should be ready only once detection has started")
    void shouldGateReadinessOnPhase() throws Exception {
        int port = freePort();
        server.start(port);
        assertThat(server.isRunning()).isTrue();

        assertThat(get(port, "/health")).isEqualTo(200);
        assertThat(get(port, "/readiness")).isEqualTo(503);

        phase.set(ScanPhase.DETECT);
        assertThat(get(port, "/readiness")).isEqualTo(200);
    }

    @Test
    @DisplayName("Should reject a port outside the valid range")
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> server.start(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("port");
        assertThat(server.isRunning()).isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private static int get(int port, String path) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) new URL("http://localhost:" + port + path).openConnection();
        try {
            return connection.getResponseCode();
        } finally {
            connection.disconnect();
        }
    }
}
