package fr.lapetina.avatar.delivery.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.avatar.delivery.AvatarClient;
import fr.lapetina.avatar.delivery.api.dto.SpeakRequestDto;
import fr.lapetina.avatar.delivery.api.dto.SpeakResponseDto;
import fr.lapetina.avatar.delivery.domain.exception.DeliveryException;
import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import fr.lapetina.avatar.delivery.domain.model.DeliveryResult;
import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.HealthSnapshot;
import fr.lapetina.avatar.delivery.domain.model.HealthState;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.infrastructure.config.AvatarClientConfig;
import fr.lapetina.avatar.delivery.infrastructure.config.ConfigLoader;
import fr.lapetina.avatar.delivery.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/speak - Deliver an utterance
 * - GET /health - Per-provider health snapshots
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /admin/providers - List all providers
 * - POST /admin/providers/{name}/probe - On-demand liveness check
 * - POST /admin/cache/clear - Drop all cached results
 * - POST /admin/reload - Reload configuration
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final AvatarClient client;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;
    private final Clock clock;

    public HttpServer(
            AvatarClientConfig.ServerConfig serverConfig,
            AvatarClient client,
            MetricsRegistry metricsRegistry,
            ConfigLoader configLoader
    ) throws IOException {
        this.client = client;
        this.metricsRegistry = metricsRegistry;
        this.configLoader = configLoader;
        this.clock = Clock.systemUTC();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(serverConfig.getHost(), serverConfig.getPort()), serverConfig.getBacklog()
        );

        // speak blocks its thread for the whole delivery
        AtomicInteger workerCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(serverConfig.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "http-worker-" + workerCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/v1/speak", new SpeakHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured on {}:{}", serverConfig.getHost(), serverConfig.getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Actual bound port, useful when configured with port 0.
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

    // ==================== SPEAK HANDLER ====================

    private class SpeakHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = Optional.ofNullable(exchange.getRequestHeaders().getFirst("X-Request-ID"))
                    .orElseGet(() -> UUID.randomUUID().toString());
            MDC.put("requestId", requestId);

            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                SpeakRequestDto dto;
                try (InputStream is = exchange.getRequestBody()) {
                    dto = objectMapper.readValue(is, SpeakRequestDto.class);
                } catch (JsonProcessingException e) {
                    sendError(exchange, 400, "Malformed JSON body: " + e.getOriginalMessage());
                    return;
                }
                if (dto.getRequestId() == null) {
                    dto.setRequestId(requestId);
                }

                DeliveryRequest request = dto.toDeliveryRequest(clock);
                try {
                    DeliveryResult result = client.speak(request);
                    sendJson(exchange, 200, SpeakResponseDto.fromResult(result));
                } catch (DeliveryException e) {
                    log.warn("Speak failed: requestId={}, errorType={}, message={}",
                            request.requestId(), e.getErrorType(), e.getMessage());
                    sendJson(exchange, statusFor(e.getErrorType()), SpeakResponseDto.fromError(request.requestId(), e));
                }
            } catch (Exception e) {
                log.error("Error handling speak request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }
    }

    static int statusFor(ErrorType errorType) {
        return switch (errorType) {
            case INVALID_REQUEST -> 400;
            case RATE_LIMITED, ALL_PROVIDERS_EXHAUSTED, NO_AVAILABLE_PROVIDER -> 503;
            case DEADLINE_EXCEEDED, TIMEOUT -> 504;
            default -> 500;
        };
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            Map<String, HealthSnapshot> snapshots = client.snapshot();
            AvatarClient.ClientStats stats = client.stats();

            Map<String, Object> health = new LinkedHashMap<>();
            String status = overallStatus(snapshots);
            health.put("status", status);
            health.put("timestamp", System.currentTimeMillis());
            health.put("providers", snapshots);

            Map<String, Object> cacheStats = new LinkedHashMap<>();
            cacheStats.put("size", stats.cache().size());
            cacheStats.put("hits", stats.cache().hitCount());
            cacheStats.put("misses", stats.cache().missCount());
            health.put("cache", cacheStats);
            health.put("availableTokens", stats.availableTokens());

            sendJson(exchange, "DOWN".equals(status) ? 503 : 200, health);
        }

        private String overallStatus(Map<String, HealthSnapshot> snapshots) {
            long healthy = snapshots.values().stream().filter(s -> s.state() == HealthState.HEALTHY).count();
            long usable = snapshots.values().stream().filter(s -> s.state() != HealthState.UNHEALTHY).count();
            if (usable == 0) {
                return "DOWN";
            }
            return healthy == snapshots.size() ? "UP" : "DEGRADED";
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

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/admin/providers") && "GET".equals(method)) {
                    handleListProviders(exchange);
                } else if (path.matches("/admin/providers/[^/]+/probe") && "POST".equals(method)) {
                    handleProbe(exchange, path.split("/")[3]);
                } else if (path.equals("/admin/cache/clear") && "POST".equals(method)) {
                    handleClearCache(exchange);
                } else if (path.equals("/admin/reload") && "POST".equals(method)) {
                    handleReloadConfig(exchange);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error in admin handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }

        private void handleListProviders(HttpExchange exchange) throws IOException {
            Map<String, HealthSnapshot> snapshots = client.snapshot();
            List<Map<String, Object>> providers = new ArrayList<>();
            for (ProviderDescriptor provider : client.providers()) {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("name", provider.getName());
                info.put("type", provider.getType().name());
                info.put("url", provider.getBaseUrl() != null ? provider.getBaseUrl().toString() : null);
                info.put("languages", provider.getSupportedLanguages());
                info.put("emotions", provider.getSupportedEmotions());
                info.put("priority", provider.getPriority());
                info.put("enabled", provider.isEnabled());
                info.put("maxConcurrent", provider.getMaxConcurrent());
                info.put("inFlight", client.getRateLimiter().inFlight(provider.getName()));
                info.put("availableTokens", client.getRateLimiter().availableTokens(provider.getName()));
                HealthSnapshot snapshot = snapshots.get(provider.getName());
                info.put("health", snapshot != null ? snapshot.state().name() : HealthState.HEALTHY.name());
                info.put("consecutiveFailures", snapshot != null ? snapshot.consecutiveFailures() : 0);
                providers.add(info);
            }
            sendJson(exchange, 200, providers);
        }

        private void handleProbe(HttpExchange exchange, String name) throws IOException {
            Optional<HealthSnapshot> snapshot = client.probe(name);
            if (snapshot.isEmpty()) {
                sendError(exchange, 404, "Provider not found: " + name);
                return;
            }
            sendJson(exchange, 200, snapshot.get());
        }

        private void handleClearCache(HttpExchange exchange) throws IOException {
            long cleared = client.stats().cache().size();
            client.clearCache();
            sendJson(exchange, 200, Map.of(
                    "message", "Cache cleared",
                    "entries", cleared
            ));
        }

        private void handleReloadConfig(HttpExchange exchange) throws IOException {
            AvatarClientConfig newConfig = configLoader.reload();
            sendJson(exchange, 200, Map.of(
                    "message", "Configuration reloaded",
                    "providers", newConfig.getProviders().size()
            ));
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "unknown");
        sendJson(exchange, statusCode, error);
    }
}
