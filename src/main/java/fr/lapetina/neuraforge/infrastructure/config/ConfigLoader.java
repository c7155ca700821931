package fr.lapetina.neuraforge.infrastructure.config;

import fr.lapetina.neuraforge.domain.queue.BatchQueueFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads the scheduler configuration and keeps it current.
 *
 * The file is read from the file system when it exists there, from the classpath otherwise.
 * A configuration only becomes current once it has passed {@link #validate}. Later
 * reloads, forced or triggered by the file watcher, either replace it and notify
 * {@link ConfigChangeListener#onConfigChanged} or leave it untouched and notify
 * {@link ConfigChangeListener#onReloadRejected}.
 *
 * The watcher reloads only when the file content differs from the last one applied.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Set<String> WAIT_STRATEGIES = Set.of("blocking", "yielding", "busy-spin", "sleeping");

    private final AtomicReference<SchedulerConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger rejectedReloads = new AtomicInteger(0);
    private final Path configPath;
    private final Yaml yaml;

    // Content of the file behind the current configuration; null when it came from elsewhere
    private volatile byte[] appliedContent;
    private volatile WatchService watchService;
    private volatile Thread watcher;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(SchedulerConfig.class, new LoaderOptions()));
    }

    /**
     * Loads configuration from file or classpath and makes it current.
     *
     * @throws ConfigurationException if the file is missing, malformed or invalid
     */
    public SchedulerConfig load() {
        Source source = readSource();
        return apply(parse(source.content(), source.name()), source.fromFile() ? source.content() : null);
    }

    /**
     * Loads configuration from an input stream and makes it current.
     *
     * @throws ConfigurationException if the content is malformed or invalid
     */
    public SchedulerConfig loadFromStream(InputStream inputStream) {
        byte[] content;
        try {
            content = inputStream.readAllBytes();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration stream", e);
        }
        return apply(parse(content, "stream"), null);
    }

    /**
     * Reloads the configuration, reporting a rejection to listeners before rethrowing it.
     *
     * @throws ConfigurationException if the new configuration cannot be used; the current one stays
     */
    public SchedulerConfig tryReload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            reject(e);
            throw e;
        }
    }

    /**
     * Reloads the configuration. An unusable file leaves the current configuration in place.
     *
     * @return the configuration current after the attempt
     */
    public SchedulerConfig reload() {
        try {
            return tryReload();
        } catch (ConfigurationException e) {
            return currentConfig.get();
        }
    }

    /**
     * Reloads when the file content differs from the content last applied.
     *
     * @return true if a reload was attempted
     */
    boolean reloadIfChanged() {
        byte[] content;
        try {
            content = Files.readAllBytes(configPath);
        } catch (IOException e) {
            // Editors may replace the file in several steps; the next event retries
            log.debug("Configuration file not readable yet: {}", configPath);
            return false;
        }
        if (Arrays.equals(content, appliedContent)) {
            log.debug("Configuration file touched without content change: {}", configPath);
            return false;
        }
        log.info("Configuration file changed, reloading: {}", configPath);
        reload();
        return true;
    }

    private SchedulerConfig apply(SchedulerConfig candidate, byte[] fileContent) {
        SchedulerConfig config = validate(candidate);
        SchedulerConfig previous = currentConfig.getAndSet(config);
        appliedContent = fileContent;
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(previous, config);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
        return config;
    }

    private void reject(ConfigurationException error) {
        int count = rejectedReloads.incrementAndGet();
        log.error("Configuration reload rejected, keeping current: source={}, rejectedReloads={}, error={}",
                configPath, count, error.getMessage());
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onReloadRejected(configPath.toString(), error);
            } catch (Exception e) {
                log.error("Error notifying config rejection listener", e);
            }
        }
    }

    private Source readSource() {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try {
                return new Source(configPath.toString(), Files.readAllBytes(configPath), true);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String resource = configPath.toString().replace('\\', '/');
        if (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", resource);
                return new Source(resource, is.readAllBytes(), false);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + resource, e);
        }
        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private SchedulerConfig parse(byte[] content, String source) {
        try {
            SchedulerConfig config = yaml.load(new ByteArrayInputStream(content));
            if (config == null) {
                throw new ConfigurationException("Configuration is empty: " + source);
            }
            return config;
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns the current configuration.
     */
    public SchedulerConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Number of reloads refused since this loader was created.
     */
    public int getRejectedReloads() {
        return rejectedReloads.get();
    }

    /**
     * Starts watching the configuration file for changes.
     * Only a file on the file system can be watched.
     */
    public synchronized void startWatching() {
        if (watcher != null) {
            return;
        }
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        Path parent = configPath.toAbsolutePath().getParent();
        try {
            watchService = FileSystems.getDefault().newWatchService();
            // Editors that save by rename produce CREATE rather than MODIFY
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);
        } catch (IOException e) {
            log.error("Failed to start config watcher, hot reload disabled: {}", configPath, e);
            return;
        }

        watcher = new Thread(this::watchLoop, "config-watcher");
        watcher.setDaemon(true);
        watcher.start();
        log.info("Configuration hot-reload enabled for: {}", configPath);
    }

    private void watchLoop() {
        Path fileName = configPath.getFileName();
        try {
            while (!Thread.currentThread().isInterrupted()) {
                WatchKey key = watchService.take();
                boolean touched = false;
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW || fileName.equals(event.context())) {
                        touched = true;
                    }
                }
                if (touched) {
                    reloadIfChanged();
                }
                if (!key.reset()) {
                    log.warn("Config directory no longer watchable, hot reload stopped: {}", configPath);
                    return;
                }
            }
        } catch (ClosedWatchServiceException e) {
            log.debug("Config watcher closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Adds a listener for configuration changes and rejected reloads.
     */
    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a configuration change listener.
     */
    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public synchronized void close() {
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
        if (watcher != null) {
            watcher.interrupt();
            try {
                watcher.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            watcher = null;
        }
    }

    private record Source(String name, byte[] content, boolean fromFile) {
    }

    /**
     * Creates a default configuration.
     */
    public static SchedulerConfig createDefault() {
        return new SchedulerConfig();
    }

    /**
     * Checks a configuration for values the scheduler cannot run with.
     *
     * @return the same configuration
     * @throws ConfigurationException naming the first offending setting
     */
    public static SchedulerConfig validate(SchedulerConfig config) {
        SchedulerConfig.BatchingConfig batching = config.getBatching();
        require(batching != null, "batching section is missing");
        require(batching.getMaxBatchSize() > 0, "batching.maxBatchSize must be positive");
        require(batching.getBatchTimeoutMs() >= 0, "batching.batchTimeoutMs must not be negative");

        SchedulerConfig.WorkersConfig workers = config.getWorkers();
        require(workers != null, "workers section is missing");
        require(workers.getCount() > 0, "workers.count must be positive");
        require(workers.getShutdownTimeoutMs() >= 0, "workers.shutdownTimeoutMs must not be negative");
        require(workers.getQueuePolicy() != null
                        && BatchQueueFactory.create(workers.getQueuePolicy()).isPresent(),
                "workers.queuePolicy is unknown: " + workers.getQueuePolicy());

        SchedulerConfig.BufferPoolConfig pool = config.getBufferPool();
        require(pool != null, "bufferPool section is missing");
        require(pool.getSize() > 0, "bufferPool.size must be positive");
        require(pool.getSlotCapacity() > 0, "bufferPool.slotCapacity must be positive");

        SchedulerConfig.AdmissionConfig admission = config.getAdmission();
        require(admission != null, "admission section is missing");
        require(admission.getDefaultLimit() > 0, "admission.defaultLimit must be positive");
        if (admission.getLimits() != null) {
            for (Map.Entry<String, Integer> limit : admission.getLimits().entrySet()) {
                require(limit.getValue() != null && limit.getValue() > 0,
                        "admission.limits." + limit.getKey() + " must be positive");
            }
        }

        SchedulerConfig.DisruptorConfig disruptor = config.getDisruptor();
        require(disruptor != null, "disruptor section is missing");
        require(disruptor.getRingBufferSize() > 0 && Integer.bitCount(disruptor.getRingBufferSize()) == 1,
                "disruptor.ringBufferSize must be a power of 2");
        require(disruptor.getWaitStrategy() != null
                        && WAIT_STRATEGIES.contains(disruptor.getWaitStrategy().toLowerCase()),
                "disruptor.waitStrategy is unknown: " + disruptor.getWaitStrategy());

        SchedulerConfig.ServerConfig server = config.getServer();
        require(server != null, "server section is missing");
        require(server.getPort() >= 0 && server.getPort() <= 65535, "server.port is out of range");
        require(server.getThreads() > 0, "server.threads must be positive");

        require(config.getMetrics() != null, "metrics section is missing");
        return config;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException("Invalid configuration: " + message);
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
