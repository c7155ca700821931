package fr.lapetina.neuraforge.infrastructure.metrics;

import fr.lapetina.neuraforge.domain.batch.SealReason;
import fr.lapetina.neuraforge.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request outcome counters per model
 * - Batch size distribution and seal reasons per model
 * - Backend execution and queue wait timers
 * - Worker respawn and rejected configuration reload counters
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    static final String OUTCOME_SUCCESS = "SUCCESS";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> sealCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DistributionSummary> batchSizes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> executionTimers = new ConcurrentHashMap<>();

    private final Timer queueWait;
    private final Counter workerRespawns;
    private final Counter rejectedReloads;

    public MetricsRegistry(String prefix, boolean bindJvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (bindJvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        this.queueWait = Timer.builder(prefix + "_batch_queue_wait")
                .description("Time a sealed batch waits for a worker")
                .publishPercentileHistogram()
                .register(registry);

        this.workerRespawns = Counter.builder(prefix + "_worker_respawns_total")
                .description("Worker threads replaced after an internal fault")
                .register(registry);

        this.rejectedReloads = Counter.builder(prefix + "_config_reloads_rejected_total")
                .description("Configuration reloads refused because the new content was unusable")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, true);
    }

    public MetricsRegistry() {
        this("neuraforge");
    }

    /**
     * Counts a terminal request outcome; a null error type is a success.
     */
    public void recordOutcome(String model, ErrorType errorType) {
        String outcome = errorType == null ? OUTCOME_SUCCESS : errorType.name();
        String key = model + ":" + outcome;
        outcomeCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of requests by outcome")
                        .tag("model", model)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records a sealed batch.
     */
    public void recordBatchSealed(String model, int size, SealReason reason) {
        batchSizes.computeIfAbsent(model, k ->
                DistributionSummary.builder(prefix + "_batch_size")
                        .description("Requests per sealed batch")
                        .tag("model", model)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(size);

        String key = model + ":" + reason.name();
        sealCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_batches_sealed_total")
                        .description("Total number of sealed batches by reason")
                        .tag("model", model)
                        .tag("reason", reason.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records the duration of one backend call.
     */
    public void recordExecution(String model, Duration duration, boolean success) {
        String status = success ? "ok" : "failed";
        String key = model + ":" + status;
        executionTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_batch_execution")
                        .description("Backend execution latency per batch")
                        .tag("model", model)
                        .tag("status", status)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(duration);
    }

    public void recordQueueWait(Duration wait) {
        queueWait.record(wait);
    }

    public void incrementWorkerRespawns() {
        workerRespawns.increment();
    }

    public void incrementRejectedReloads() {
        rejectedReloads.increment();
    }

    /**
     * Registers a gauge sampled from the supplier on each scrape.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
