package com.driftsentinel.flink;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that exposes health and readiness endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: always {@code 200 OK} with body
 * {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness}: {@code 503} with {@code {"status":"CALIBRATING"}}
 * until {@link #markReady()} is called, then {@code 200} with
 * {@code {"status":"READY"}}</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no external dependencies
 * (Jetty, Netty, etc.) are required.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] READY_RESPONSE = "{\"status\":\"READY\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] CALIBRATING_RESPONSE =
            "{\"status\":\"CALIBRATING\"}".getBytes(StandardCharsets.UTF_8);

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean ready = new AtomicBoolean(false);

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
            server.createContext("/health", HealthServer::handleHealth);
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
     * Flip {@code /readiness} to {@code 200}. Called once the baseline has
     * been calibrated.
     */
    public void markReady() {
        if (ready.compareAndSet(false, true)) {
            LOG.info("Readiness probe switched to READY");
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

    public boolean isReady() {
        return ready.get();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealth(HttpExchange exchange) throws IOException {
        respond(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (ready.get()) {
            respond(exchange, 200, READY_RESPONSE);
        } else {
            respond(exchange, 503, CALIBRATING_RESPONSE);
        }
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
