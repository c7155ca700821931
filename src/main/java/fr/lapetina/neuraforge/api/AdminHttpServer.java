package fr.lapetina.neuraforge.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.neuraforge.disruptor.BatchScheduler;
import fr.lapetina.neuraforge.domain.model.ModelHandle;
import fr.lapetina.neuraforge.infrastructure.buffer.BufferPool;
import fr.lapetina.neuraforge.infrastructure.config.ConfigLoader;
import fr.lapetina.neuraforge.infrastructure.config.SchedulerConfig;
import fr.lapetina.neuraforge.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.neuraforge.infrastructure.registry.ModelLoadException;
import fr.lapetina.neuraforge.infrastructure.registry.ModelRegistry;
import fr.lapetina.neuraforge.infrastructure.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Operational HTTP endpoints using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /health - Scheduler health and queue statistics
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /admin/models - List served and draining model versions
 * - POST /admin/models/{name}/unload - Retire a model
 * - POST /admin/flush - Seal every open batch now
 * - POST /admin/reload - Reload configuration
 */
public final class AdminHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdminHttpServer.class);

    private final HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final BatchScheduler scheduler;
    private final ModelRegistry modelRegistry;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;
    private final boolean metricsEnabled;

    public AdminHttpServer(
            SchedulerConfig.ServerConfig serverConfig,
            boolean metricsEnabled,
            BatchScheduler scheduler,
            MetricsRegistry metricsRegistry,
            ConfigLoader configLoader
    ) throws IOException {
        this.scheduler = scheduler;
        this.modelRegistry = scheduler.getRegistry();
        this.metricsRegistry = metricsRegistry;
        this.configLoader = configLoader;
        this.metricsEnabled = metricsEnabled;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = HttpServer.create(
                new InetSocketAddress(serverConfig.getHost(), serverConfig.getPort()), serverConfig.getBacklog()
        );

        this.executor = Executors.newFixedThreadPool(serverConfig.getThreads(), new AdminThreadFactory());
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("Admin HTTP server configured on {}:{}", serverConfig.getHost(), getPort());
    }

    public void start() {
        server.start();
        log.info("Admin HTTP server started on port {}", getPort());
    }

    /**
     * The bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("Admin HTTP server stopped");
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
            String status = scheduler.isRunning() ? "UP" : "DOWN";
            health.put("status", status);
            health.put("timestamp", System.currentTimeMillis());

            Map<String, Object> schedulerStats = new LinkedHashMap<>();
            schedulerStats.put("pendingRequests", scheduler.getPendingCount());
            schedulerStats.put("ringBufferRemaining", scheduler.getRemainingCapacity());
            schedulerStats.put("readyQueueDepth", scheduler.getReadyQueueDepth());
            schedulerStats.put("maxBatchSize", scheduler.getBatchingPolicy().maxBatchSize());
            schedulerStats.put("batchTimeoutMs", scheduler.getBatchingPolicy().batchTimeout().toMillis());
            health.put("scheduler", schedulerStats);

            WorkerPool workers = scheduler.getWorkerPool();
            Map<String, Object> workerStats = new LinkedHashMap<>();
            workerStats.put("size", workers.getSize());
            workerStats.put("live", workers.getLiveWorkers());
            workerStats.put("busy", workers.getBusyWorkers());
            workerStats.put("respawns", workers.getRespawnCount());
            health.put("workers", workerStats);

            BufferPool pool = scheduler.getBufferPool();
            Map<String, Object> poolStats = new LinkedHashMap<>();
            poolStats.put("slots", pool.size());
            poolStats.put("free", pool.available());
            poolStats.put("waiting", pool.waiting());
            poolStats.put("slotCapacity", pool.slotCapacity());
            health.put("bufferPool", poolStats);

            health.put("models", modelRegistry.size());

            sendJson(exchange, "UP".equals(status) ? 200 : 503, health);
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
            if (!metricsEnabled) {
                sendError(exchange, 404, "Metrics disabled");
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
                if (path.equals("/admin/models") && "GET".equals(method)) {
                    handleListModels(exchange);
                } else if (path.matches("/admin/models/[^/]+/unload") && "POST".equals(method)) {
                    handleUnload(exchange, path);
                } else if (path.equals("/admin/flush") && "POST".equals(method)) {
                    handleFlush(exchange);
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

        private void handleListModels(HttpExchange exchange) throws IOException {
            List<Map<String, Object>> models = new ArrayList<>();
            for (ModelHandle handle : modelRegistry.getServedModels()) {
                models.add(describe(handle));
            }
            for (ModelHandle handle : modelRegistry.getRetiringModels()) {
                models.add(describe(handle));
            }
            sendJson(exchange, 200, models);
        }

        private Map<String, Object> describe(ModelHandle handle) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("name", handle.getName());
            info.put("version", handle.getVersion());
            info.put("state", handle.getState().name());
            info.put("backend", handle.getExecutor().getBackendName());
            info.put("inFlightRequests", handle.getInFlightRequests());
            info.put("inFlightBatches", handle.getInFlightBatches());
            info.put("admittedTotal", handle.getAdmittedTotal());
            info.put("admissionLimit", scheduler.admissionLimitFor(handle.getName()));
            info.put("readyAt", handle.getReadyAt());
            return info;
        }

        private void handleUnload(HttpExchange exchange, String path) throws IOException {
            // Extract model name from path
            String[] parts = path.split("/");
            String name = parts[3];

            ModelHandle retired;
            try {
                retired = modelRegistry.unload(name);
            } catch (ModelLoadException e) {
                sendError(exchange, 404, e.getMessage());
                return;
            }

            sendJson(exchange, 200, Map.of(
                    "model", retired.getId(),
                    "state", retired.getState().name()
            ));
        }

        private void handleFlush(HttpExchange exchange) throws IOException {
            scheduler.flush().join();
            sendJson(exchange, 200, Map.of("message", "Open batches sealed"));
        }

        private void handleReloadConfig(HttpExchange exchange) throws IOException {
            SchedulerConfig newConfig;
            try {
                newConfig = configLoader.tryReload();
            } catch (ConfigLoader.ConfigurationException e) {
                sendError(exchange, 422, e.getMessage());
                return;
            }
            sendJson(exchange, 200, Map.of(
                    "message", "Configuration reloaded",
                    "maxBatchSize", newConfig.getBatching().getMaxBatchSize(),
                    "batchTimeoutMs", newConfig.getBatching().getBatchTimeoutMs()
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

    private static class AdminThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "admin-http-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
