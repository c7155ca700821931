package fr.lapetina.neuraforge;

import fr.lapetina.neuraforge.api.AdminHttpServer;
import fr.lapetina.neuraforge.disruptor.BatchScheduler;
import fr.lapetina.neuraforge.domain.batch.BatchingPolicy;
import fr.lapetina.neuraforge.infrastructure.config.ConfigChangeListener;
import fr.lapetina.neuraforge.infrastructure.config.ConfigLoader;
import fr.lapetina.neuraforge.infrastructure.config.SchedulerConfig;
import fr.lapetina.neuraforge.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.neuraforge.infrastructure.registry.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Factory for creating a fully-wired scheduler from configuration.
 * This is the primary entry point for obtaining a configured BatchScheduler.
 *
 * <p>Usage:
 * <pre>{@code
 * try (SchedulerFactory factory = SchedulerFactory.create("config.yaml").start()) {
 *     factory.getModelRegistry().load("resnet50", "v1", executor);
 *     InferenceResult result = factory.getScheduler().submit(request).join();
 * }
 * }</pre>
 */
public class SchedulerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerFactory.class);

    private final ConfigLoader configLoader;
    private final SchedulerConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ModelRegistry modelRegistry;
    private final BatchScheduler scheduler;
    private final AdminHttpServer adminServer;

    protected SchedulerFactory(String configPath) {
        log.info("Initializing SchedulerFactory from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(
                config.getMetrics().getPrefix(),
                config.getMetrics().isEnabled()
        );

        this.modelRegistry = new ModelRegistry(Duration.ofMillis(config.getWorkers().getShutdownTimeoutMs()));

        // Build scheduler
        this.scheduler = BatchScheduler.builder()
                .fromConfig(config)
                .registry(modelRegistry)
                .metricsRegistry(metricsRegistry)
                .build();

        configLoader.addListener(new ConfigApplier());

        this.adminServer = config.getServer().isEnabled() ? createAdminServer() : null;

        log.info("SchedulerFactory initialized: adminServer={}", adminServer != null ? "enabled" : "disabled");
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static SchedulerFactory create(String configPath) {
        return new SchedulerFactory(configPath);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static SchedulerFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the scheduler, the admin server and configuration watching.
     */
    public SchedulerFactory start() {
        scheduler.start();
        if (adminServer != null) {
            adminServer.start();
        }
        configLoader.startWatching();
        log.info("Scheduler started");
        return this;
    }

    public BatchScheduler getScheduler() {
        return scheduler;
    }

    public ModelRegistry getModelRegistry() {
        return modelRegistry;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    /**
     * The admin server, or null when disabled in configuration.
     */
    public AdminHttpServer getAdminServer() {
        return adminServer;
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private AdminHttpServer createAdminServer() {
        try {
            return new AdminHttpServer(
                    config.getServer(),
                    config.getMetrics().isEnabled(),
                    scheduler,
                    metricsRegistry,
                    configLoader
            );
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind admin server on port " + config.getServer().getPort(), e);
        }
    }

    /**
     * Applies reloaded batching and admission settings to the running scheduler.
     */
    private final class ConfigApplier implements ConfigChangeListener {

        @Override
        public void onConfigChanged(SchedulerConfig oldConfig, SchedulerConfig newConfig) {
            log.info("Configuration changed, applying updates...");

            BatchingPolicy policy = BatchingPolicy.of(
                    newConfig.getBatching().getMaxBatchSize(),
                    newConfig.getBatching().getBatchTimeoutMs()
            );
            if (!policy.equals(scheduler.getBatchingPolicy())) {
                scheduler.updateBatchingPolicy(policy);
            }

            Map<String, Integer> limits = newConfig.getAdmission().getLimits() != null
                    ? newConfig.getAdmission().getLimits()
                    : Map.of();
            scheduler.updateAdmissionLimits(newConfig.getAdmission().getDefaultLimit(), limits);

            if (oldConfig != null && requiresRestart(oldConfig, newConfig)) {
                log.warn("Worker, buffer pool and ring buffer settings changed; they take effect on restart");
            }

            log.info("Configuration updates applied");
        }

        @Override
        public void onReloadRejected(String source, ConfigLoader.ConfigurationException error) {
            metricsRegistry.incrementRejectedReloads();
            log.warn("Scheduler keeps running on its current configuration: source={}", source);
        }
    }

    private static boolean requiresRestart(SchedulerConfig oldConfig, SchedulerConfig newConfig) {
        return oldConfig.getWorkers().getCount() != newConfig.getWorkers().getCount()
                || !Objects.equals(oldConfig.getWorkers().getQueuePolicy(), newConfig.getWorkers().getQueuePolicy())
                || oldConfig.getBufferPool().getSize() != newConfig.getBufferPool().getSize()
                || oldConfig.getBufferPool().getSlotCapacity() != newConfig.getBufferPool().getSlotCapacity()
                || oldConfig.getDisruptor().getRingBufferSize() != newConfig.getDisruptor().getRingBufferSize();
    }

    @Override
    public void close() {
        log.info("Shutting down SchedulerFactory...");

        if (adminServer != null) {
            try {
                adminServer.close();
            } catch (Exception e) {
                log.warn("Error closing admin server", e);
            }
        }

        try {
            scheduler.close();
        } catch (Exception e) {
            log.warn("Error closing scheduler", e);
        }

        try {
            modelRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing model registry", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("SchedulerFactory shut down");
    }
}
