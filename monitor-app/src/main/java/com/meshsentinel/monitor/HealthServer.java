package com.meshsentinel.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshsentinel.core.detection.BaselineRegistry;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server that exposes health and readiness endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: always {@code 200 OK} while the process runs, with
 * the current phase, baseline count and scan counters as JSON</li>
 * <li>{@code GET /readiness}: {@code 200 OK} once the monitor is detecting,
 * {@code 503} while it is still learning</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no servlet container is needed.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final ScanMetrics metrics;
    private final BaselineRegistry registry;
    private final Supplier<ScanPhase> phase;
    private final ObjectMapper mapper = new ObjectMapper();

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthServer(ScanMetrics metrics, BaselineRegistry registry, Supplier<ScanPhase> phase) {
        this.metrics = Objects.requireNonNull(metrics, "ScanMetrics must not be null");
        this.registry = Objects.requireNonNull(registry, "BaselineRegistry must not be null");
        this.phase = Objects.requireNonNull(phase, "phase supplier must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; must be in range [1, 65535]
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [1, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", this::handleHealth);
            server.createContext("/readiness", this::handleReadiness);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", port);
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the health server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the JSON document served by {@code /health}
     */
    String healthBody() throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("phase", phase.get().name().toLowerCase(Locale.ROOT));
        body.put("baselines", registry.size());
        body.put("counters", metrics.snapshot());
        return mapper.writeValueAsString(body);
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleHealth(HttpExchange exchange) throws IOException {
        respond(exchange, 200, healthBody());
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        boolean ready = phase.get() == ScanPhase.DETECT;
        respond(exchange, ready ? 200 : 503, ready ? "{\"status\":\"UP\"}" : "{\"status\":\"LEARNING\"}");
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
