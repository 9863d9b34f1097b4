package com.gsesentinel.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gsesentinel.core.GseMonitor;
import com.gsesentinel.core.model.OperationalStatus;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that exposes health and readiness endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200 OK} with the process status, the
 * number of devices in FAULT or SHUTDOWN and the number of active alarms</li>
 * <li>{@code GET /readiness}: {@code 200 OK} once the process has been marked
 * ready, {@code 503} before</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final GseMonitor monitor;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean ready = new AtomicBoolean(false);
    private HttpServer server;

    public HealthServer(GseMonitor monitor) {
        this.monitor = Objects.requireNonNull(monitor, "GseMonitor must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; must be in range [1, 65535]
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
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
            throw new IllegalStateException("Failed to start health server on port " + port, e);
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
     * @param value whether {@code /readiness} should report ready
     */
    public void setReady(boolean value) {
        ready.set(value);
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleHealth(HttpExchange exchange) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("devices", monitor.deviceStates().size());
        body.put("devices_degraded", monitor.deviceStates().stream()
                .filter(s -> s.getStatus() == OperationalStatus.FAULT || s.getStatus() == OperationalStatus.SHUTDOWN)
                .count());
        body.put("active_alarms", monitor.activeAlarms().size());
        respond(exchange, 200, body);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        boolean isReady = ready.get();
        respond(exchange, isReady ? 200 : 503, Map.of("status", isReady ? "READY" : "STARTING"));
    }

    private void respond(HttpExchange exchange, int code, Map<String, Object> body) throws IOException {
        byte[] response;
        try {
            response = mapper.writeValueAsString(body).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to render health response: {}", e.getMessage(), e);
            response = "{\"status\":\"UNKNOWN\"}".getBytes(StandardCharsets.UTF_8);
            code = 500;
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(code, response.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }
}
