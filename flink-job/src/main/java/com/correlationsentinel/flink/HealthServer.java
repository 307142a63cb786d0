package com.correlationsentinel.flink;

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
 * Minimal HTTP server for Kubernetes probes.
 *
 * <ul>
 * <li>{@code GET /health} – {@code 200 {"status":"UP"}} while the process is alive</li>
 * <li>{@code GET /readiness} – {@code 200 {"status":"READY","rules":N}} once
 * rules are loaded and the pipeline is submitted, {@code 503} before</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] UP = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NOT_READY = "{\"status\":\"NOT_READY\"}".getBytes(StandardCharsets.UTF_8);

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile int readyRules = -1;

    /**
     * Start the server.
     *
     * @param port TCP port; {@code 0} binds an ephemeral port
     * @throws IllegalArgumentException if the port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind health server on port " + port, e);
        }
        server.createContext("/health", exchange -> respond(exchange, 200, UP));
        server.createContext("/readiness", this::handleReadiness);
        server.setExecutor(Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "health-server");
            t.setDaemon(true);
            return t;
        }));
        server.start();
        running.set(true);
        LOG.info("Health server started on port {}", getPort());
    }

    /**
     * Report ready.
     *
     * @param ruleCount number of loaded rules, echoed by {@code /readiness}
     */
    public void markReady(int ruleCount) {
        this.readyRules = ruleCount;
    }

    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Bound port, useful when started on port 0. */
    public int getPort() {
        return server.getAddress().getPort();
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        int rules = readyRules;
        if (rules < 0) {
            respond(exchange, 503, NOT_READY);
            return;
        }
        byte[] body = ("{\"status\":\"READY\",\"rules\":" + rules + "}").getBytes(StandardCharsets.UTF_8);
        respond(exchange, 200, body);
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
