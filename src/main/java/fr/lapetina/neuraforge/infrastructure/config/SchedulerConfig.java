package fr.lapetina.neuraforge.infrastructure.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Root configuration object for the batching scheduler.
 * Designed to be populated from YAML.
 */
public class SchedulerConfig {

    private BatchingConfig batching = new BatchingConfig();
    private WorkersConfig workers = new WorkersConfig();
    private BufferPoolConfig bufferPool = new BufferPoolConfig();
    private AdmissionConfig admission = new AdmissionConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private ServerConfig server = new ServerConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public BatchingConfig getBatching() { return batching; }
    public void setBatching(BatchingConfig batching) { this.batching = batching; }

    public WorkersConfig getWorkers() { return workers; }
    public void setWorkers(WorkersConfig workers) { this.workers = workers; }

    public BufferPoolConfig getBufferPool() { return bufferPool; }
    public void setBufferPool(BufferPoolConfig bufferPool) { this.bufferPool = bufferPool; }

    public AdmissionConfig getAdmission() { return admission; }
    public void setAdmission(AdmissionConfig admission) { this.admission = admission; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Batch sealing thresholds. Hot-reloadable.
     */
    public static class BatchingConfig {
        private int maxBatchSize = 8;
        private long batchTimeoutMs = 5;

        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }

        public long getBatchTimeoutMs() { return batchTimeoutMs; }
        public void setBatchTimeoutMs(long batchTimeoutMs) { this.batchTimeoutMs = batchTimeoutMs; }
    }

    /**
     * Worker pool configuration. Fixed at startup.
     */
    public static class WorkersConfig {
        private int count = 4;
        private String queuePolicy = "fifo";
        private long shutdownTimeoutMs = 30_000;

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }

        public String getQueuePolicy() { return queuePolicy; }
        public void setQueuePolicy(String queuePolicy) { this.queuePolicy = queuePolicy; }

        public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
        public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }
    }

    /**
     * Staging buffer pool configuration. Fixed at startup.
     */
    public static class BufferPoolConfig {
        private int size = 16;
        private int slotCapacity = 1024 * 1024;
        private boolean direct = false;

        public int getSize() { return size; }
        public void setSize(int size) { this.size = size; }

        public int getSlotCapacity() { return slotCapacity; }
        public void setSlotCapacity(int slotCapacity) { this.slotCapacity = slotCapacity; }

        public boolean isDirect() { return direct; }
        public void setDirect(boolean direct) { this.direct = direct; }
    }

    /**
     * Per-model in-flight request limits. Hot-reloadable.
     */
    public static class AdmissionConfig {
        private int defaultLimit = 256;
        private Map<String, Integer> limits = new HashMap<>();

        public int getDefaultLimit() { return defaultLimit; }
        public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }

        public Map<String, Integer> getLimits() { return limits; }
        public void setLimits(Map<String, Integer> limits) { this.limits = limits; }
    }

    /**
     * Admission ring buffer configuration.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Admin HTTP server configuration.
     */
    public static class ServerConfig {
        private boolean enabled = false;
        private String host = "0.0.0.0";
        private int port = 8081;
        private int backlog = 50;
        private int threads = 4;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "neuraforge";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
