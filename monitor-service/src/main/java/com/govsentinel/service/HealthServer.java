package com.govsentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that exposes health and readiness endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200} with overall status and one entry per
 * source; {@code 503} once every source has failed</li>
 * <li>{@code GET /readiness}: same; Kubernetes readiness probe target</li>
 * </ul>
 *
 * <pre>
 * {"status":"UP","sources":[{"name":"snapshot","state":"SLEEPING","passes":12,
 *   "lastPassAt":"2024-06-01T12:00:00Z","notificationsSent":0,"scopesFailed":0,"failed":false}]}
 * </pre>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final MonitorSupervisor supervisor;
    private final ObjectMapper mapper;

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthServer(MonitorSupervisor supervisor, ObjectMapper mapper) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", this::handleHealthCheck);
            server.createContext("/readiness", this::handleHealthCheck);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
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

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return bound port, or {@code -1} if not started
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handler (shared between /health and /readiness)
    // ---------------------------------------------------------------

    private void handleHealthCheck(HttpExchange exchange) throws IOException {
        boolean healthy = supervisor.isHealthy();
        byte[] body = render(healthy, supervisor.statuses());
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(healthy ? 200 : 503, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    byte[] render(boolean healthy, List<SourceStatus> statuses) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("status", healthy ? "UP" : "DOWN");
        document.put("sources", statuses);
        try {
            return mapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to render health document: {}", e.getMessage(), e);
            return ("{\"status\":\"" + (healthy ? "UP" : "DOWN") + "\"}").getBytes(StandardCharsets.UTF_8);
        }
    }
}
