package fr.lapetina.webhook.relay.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.webhook.relay.domain.model.HandlerResponse;
import fr.lapetina.webhook.relay.domain.model.IncomingRequest;
import fr.lapetina.webhook.relay.handler.WebhookHandler;
import fr.lapetina.webhook.relay.infrastructure.metrics.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST {path} - Webhook entry point (configurable, defaults to /)
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint (when metrics are enabled)
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final WebhookHandler webhookHandler;
    private final RelayMetrics metricsRegistry;

    public HttpServer(
            String host,
            int port,
            int backlog,
            int workerThreads,
            String webhookPath,
            WebhookHandler webhookHandler,
            RelayMetrics metricsRegistry
    ) throws IOException {
        this.webhookHandler = webhookHandler;
        this.metricsRegistry = metricsRegistry;

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(host, port), backlog
        );

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "webhook-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        // Register handlers
        server.createContext(webhookPath, new WebhookExchangeHandler());
        server.createContext("/health", new HealthHandler());
        if (metricsRegistry != null) {
            server.createContext("/metrics", new MetricsHandler());
        }

        log.info("HTTP server configured on {}:{}, webhook path {}", host, getPort(), webhookPath);
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Returns the bound port, which differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== WEBHOOK HANDLER ====================

    private class WebhookExchangeHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = exchange.getRequestHeaders().getFirst(REQUEST_ID_HEADER);
            if (requestId == null || requestId.isBlank()) {
                requestId = UUID.randomUUID().toString();
            }
            MDC.put("requestId", requestId);

            try {
                IncomingRequest request = toIncomingRequest(exchange);
                HandlerResponse response = webhookHandler.handle(request);
                exchange.getResponseHeaders().set(REQUEST_ID_HEADER, requestId);
                send(exchange, response);
            } catch (IOException e) {
                log.error("I/O error handling webhook request", e);
                throw e;
            } finally {
                exchange.close();
                MDC.clear();
            }
        }

        private IncomingRequest toIncomingRequest(HttpExchange exchange) throws IOException {
            IncomingRequest.Builder builder = IncomingRequest.builder()
                    .method(exchange.getRequestMethod())
                    .path(exchange.getRequestURI().getPath())
                    .headers(exchange.getRequestHeaders())
                    .peerAddress(peerAddress(exchange));

            parseQuery(exchange.getRequestURI().getRawQuery())
                    .forEach((name, value) -> builder.queryParameter(name, value));

            try (InputStream is = exchange.getRequestBody()) {
                builder.body(is.readAllBytes());
            }
            return builder.build();
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            Map<String, Object> health = new LinkedHashMap<>();
            boolean degraded = webhookHandler.isDegraded();
            health.put("status", degraded ? "DEGRADED" : "UP");
            health.put("timestamp", System.currentTimeMillis());

            sendJson(exchange, degraded ? 503 : 200, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private static String peerAddress(HttpExchange exchange) {
        InetSocketAddress remote = exchange.getRemoteAddress();
        if (remote == null) {
            return null;
        }
        InetAddress address = remote.getAddress();
        return address != null ? address.getHostAddress() : null;
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> parameters = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return parameters;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = URLDecoder.decode(eq >= 0 ? pair.substring(0, eq) : pair, StandardCharsets.UTF_8);
            String value = eq >= 0 ? URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8) : "";
            parameters.putIfAbsent(name, value);
        }
        return parameters;
    }

    private void send(HttpExchange exchange, HandlerResponse response) throws IOException {
        response.headers().forEach((name, value) -> exchange.getResponseHeaders().set(name, value));
        exchange.getResponseHeaders().set("Content-Type", response.contentType());
        byte[] bytes = response.body();
        exchange.sendResponseHeaders(response.statusCode(), bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message);
        sendJson(exchange, statusCode, error);
    }
}
