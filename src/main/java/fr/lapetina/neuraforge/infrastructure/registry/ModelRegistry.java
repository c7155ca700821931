package fr.lapetina.neuraforge.infrastructure.registry;

import fr.lapetina.neuraforge.domain.model.AdmissionCounter;
import fr.lapetina.neuraforge.domain.model.ModelHandle;
import fr.lapetina.neuraforge.executor.BackendException;
import fr.lapetina.neuraforge.executor.ModelExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Registry of served model versions.
 *
 * At most one handle per model name is Ready at any time. Retired handles stay
 * tracked until their in-flight requests are gone and they reach Unloaded.
 *
 * Lookups are lock-free; load, swap and unload are serialized on the registry.
 */
public final class ModelRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final Map<String, ModelHandle> served = new ConcurrentHashMap<>();
    private final Set<ModelHandle> retiring = ConcurrentHashMap.newKeySet();
    // Kept across versions and reloads of a name; retired handles release into it
    private final Map<String, AdmissionCounter> admissions = new ConcurrentHashMap<>();
    private final List<Consumer<RegistryEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Duration closeTimeout;

    public ModelRegistry(Duration closeTimeout) {
        this.closeTimeout = Objects.requireNonNull(closeTimeout, "Close timeout is required");
    }

    public ModelRegistry() {
        this(Duration.ofSeconds(30));
    }

    /**
     * Loads and publishes the first version of a model.
     *
     * @throws ModelLoadException if the name is already served or the executor fails to warm up
     */
    public synchronized ModelHandle load(String name, String version, ModelExecutor executor) {
        if (served.containsKey(name)) {
            throw new ModelLoadException(name, "Model already loaded: " + served.get(name).getId()
                    + "; use swap to replace it");
        }
        ModelHandle handle = warmUp(name, version, executor);
        served.put(name, handle);
        log.info("Model loaded: model={}, backend={}", handle.getId(), executor.getBackendName());
        notifyListeners(new RegistryEvent(RegistryEvent.Type.LOADED, handle));
        return handle;
    }

    /**
     * Replaces the served version of a model.
     *
     * The new version is Ready and receiving traffic before the old one starts draining;
     * if it fails to load, the old version keeps serving.
     *
     * @return the new handle
     * @throws ModelLoadException if the model is not served, the version is unchanged, or warm-up fails
     */
    public synchronized ModelHandle swap(String name, String version, ModelExecutor executor) {
        ModelHandle old = served.get(name);
        if (old == null) {
            throw new ModelLoadException(name, "Model not loaded: " + name);
        }
        if (old.getVersion().equals(version)) {
            throw new ModelLoadException(name, "Version already served: " + old.getId());
        }
        ModelHandle replacement = warmUp(name, version, executor);
        served.put(name, replacement);
        log.info("Model swapped: model={}, {} -> {}", name, old.getVersion(), version);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.LOADED, replacement));
        retire(old);
        return replacement;
    }

    /**
     * Stops serving a model. In-flight requests still complete on the retired handle.
     *
     * @return the retired handle
     * @throws ModelLoadException if the model is not served
     */
    public synchronized ModelHandle unload(String name) {
        ModelHandle handle = served.remove(name);
        if (handle == null) {
            throw new ModelLoadException(name, "Model not loaded: " + name);
        }
        retire(handle);
        return handle;
    }

    /**
     * Returns the Ready handle currently serving the model.
     */
    public Optional<ModelHandle> lookup(String name) {
        ModelHandle handle = served.get(name);
        if (handle == null || !handle.isReady()) {
            return Optional.empty();
        }
        return Optional.of(handle);
    }

    /**
     * Returns the Ready handle for a pinned version; a null version means any.
     */
    public Optional<ModelHandle> lookup(String name, String version) {
        if (version == null) {
            return lookup(name);
        }
        return lookup(name).filter(handle -> handle.getVersion().equals(version));
    }

    /**
     * Gets the handles currently serving traffic.
     */
    public List<ModelHandle> getServedModels() {
        return new ArrayList<>(served.values());
    }

    /**
     * Gets retired handles that still have requests in flight.
     */
    public List<ModelHandle> getRetiringModels() {
        return new ArrayList<>(retiring);
    }

    public int size() {
        return served.size();
    }

    /**
     * Returns the pending requests of a model name across its served and draining versions.
     */
    public int getPendingRequests(String name) {
        AdmissionCounter counter = admissions.get(name);
        return counter != null ? counter.getPending() : 0;
    }

    public void addListener(Consumer<RegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent> listener) {
        listeners.remove(listener);
    }

    /**
     * Retires every model and waits for all of them to unload.
     */
    @Override
    public void close() {
        List<CompletableFuture<ModelHandle>> pending = new ArrayList<>();
        synchronized (this) {
            for (String name : new ArrayList<>(served.keySet())) {
                unload(name);
            }
            for (ModelHandle handle : retiring) {
                pending.add(handle.whenUnloaded());
            }
        }
        if (pending.isEmpty()) {
            return;
        }
        log.info("Waiting for {} model handles to unload", pending.size());
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                    .get(closeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Model handles still draining after {}: {}", closeTimeout, retiring);
        } catch (ExecutionException e) {
            log.error("Error while waiting for model handles to unload", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for model handles to unload");
        }
    }

    private ModelHandle warmUp(String name, String version, ModelExecutor executor) {
        AdmissionCounter admission = admissions.computeIfAbsent(name, AdmissionCounter::new);
        ModelHandle handle = new ModelHandle(name, version, executor, admission, this::onUnloaded);
        try {
            executor.warmUp(handle);
        } catch (BackendException | RuntimeException e) {
            handle.markLoadFailed();
            log.warn("Model load failed: model={}, error={}", handle.getId(), e.getMessage());
            notifyListeners(new RegistryEvent(RegistryEvent.Type.LOAD_FAILED, handle));
            throw new ModelLoadException(name, "Failed to load " + handle.getId() + ": " + e.getMessage(), e);
        }
        handle.markReady();
        return handle;
    }

    private void retire(ModelHandle handle) {
        retiring.add(handle);
        if (handle.markDraining()) {
            notifyListeners(new RegistryEvent(RegistryEvent.Type.DRAINING, handle));
        }
        handle.unloadIfIdle();
    }

    private void onUnloaded(ModelHandle handle) {
        try {
            handle.getExecutor().unload(handle);
        } catch (Exception e) {
            log.error("Executor failed to unload: model={}", handle.getId(), e);
        }
        retiring.remove(handle);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.UNLOADED, handle));
    }

    private void notifyListeners(RegistryEvent event) {
        for (Consumer<RegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener", e);
            }
        }
    }

    /**
     * Event for model lifecycle changes.
     */
    public record RegistryEvent(Type type, ModelHandle handle) {
        public enum Type {
            LOADED,
            LOAD_FAILED,
            DRAINING,
            UNLOADED
        }
    }
}
