package fr.lapetina.neuraforge.domain.model;

import fr.lapetina.neuraforge.executor.ModelExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A loaded model version and the executor serving it.
 *
 * <p>All state transitions and counters are mutated under this handle's monitor, so the
 * Ready check and the in-flight increment of {@link #tryAdmit(int)} are one atomic step.
 * Reads of the state are lock-free.
 *
 * <p>The in-flight request count is the handle's reference count: it is taken at
 * admission and given back when the request's result is delivered. A Draining handle
 * becomes Unloaded on the release that brings it to zero.
 *
 * <p>The admission limit is checked against an {@link AdmissionCounter} shared by all
 * handles of the same model name.
 */
public final class ModelHandle {

    private static final Logger log = LoggerFactory.getLogger(ModelHandle.class);

    /**
     * Outcome of an admission attempt.
     */
    public enum Admission {
        ADMITTED,
        NOT_READY,
        OVERLOADED
    }

    private final String name;
    private final String version;
    private final ModelExecutor executor;
    private final Instant createdAt;
    private final Consumer<ModelHandle> unloadListener;
    private final AdmissionCounter admission;
    private final CompletableFuture<ModelHandle> unloaded = new CompletableFuture<>();

    private volatile ModelState state = ModelState.LOADING;
    private volatile Instant readyAt;

    // Guarded by this
    private int inFlightRequests;
    private int inFlightBatches;
    private long admittedTotal;

    public ModelHandle(String name, String version, ModelExecutor executor,
                       AdmissionCounter admission, Consumer<ModelHandle> unloadListener) {
        this.name = Objects.requireNonNull(name, "Model name is required");
        this.version = Objects.requireNonNull(version, "Model version is required");
        this.executor = Objects.requireNonNull(executor, "Executor is required");
        this.admission = Objects.requireNonNull(admission, "Admission counter is required");
        if (!admission.getModel().equals(name)) {
            throw new IllegalArgumentException("Admission counter of " + admission.getModel() + " used for " + name);
        }
        this.unloadListener = unloadListener;
        this.createdAt = Instant.now();
    }

    public ModelHandle(String name, String version, ModelExecutor executor, Consumer<ModelHandle> unloadListener) {
        this(name, version, executor, new AdmissionCounter(name), unloadListener);
    }

    public ModelHandle(String name, String version, ModelExecutor executor) {
        this(name, version, executor, null);
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    /**
     * Returns {@code name:version}.
     */
    public String getId() {
        return name + ":" + version;
    }

    public ModelExecutor getExecutor() {
        return executor;
    }

    public ModelState getState() {
        return state;
    }

    public boolean isReady() {
        return state == ModelState.READY;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getReadyAt() {
        return readyAt;
    }

    public synchronized int getInFlightRequests() {
        return inFlightRequests;
    }

    public synchronized int getInFlightBatches() {
        return inFlightBatches;
    }

    public AdmissionCounter getAdmission() {
        return admission;
    }

    public synchronized long getAdmittedTotal() {
        return admittedTotal;
    }

    /**
     * LOADING -> READY.
     *
     * @return false if the handle was not loading
     */
    public synchronized boolean markReady() {
        if (state != ModelState.LOADING) {
            return false;
        }
        state = ModelState.READY;
        readyAt = Instant.now();
        return true;
    }

    /**
     * LOADING -> UNLOADED after the executor refused to warm up.
     * The unload listener is not called; the handle never served traffic.
     */
    public void markLoadFailed() {
        synchronized (this) {
            if (state != ModelState.LOADING) {
                throw new IllegalStateException("Handle " + getId() + " is not loading: " + state);
            }
            state = ModelState.UNLOADED;
        }
        unloaded.complete(this);
    }

    /**
     * READY -> DRAINING. New admissions are refused from here on; requests already
     * admitted keep the handle alive until released.
     *
     * @return false if the handle was not Ready
     * @see #unloadIfIdle()
     */
    public boolean markDraining() {
        synchronized (this) {
            if (state != ModelState.READY) {
                return false;
            }
            state = ModelState.DRAINING;
        }
        log.info("Model draining: model={}, inFlightRequests={}", getId(), getInFlightRequests());
        return true;
    }

    /**
     * DRAINING -> UNLOADED when nothing is in flight. Otherwise the last {@link #release()} does it.
     *
     * @return true if this call unloaded the handle
     */
    public boolean unloadIfIdle() {
        synchronized (this) {
            if (state != ModelState.DRAINING || inFlightRequests > 0) {
                return false;
            }
            state = ModelState.UNLOADED;
        }
        fireUnloaded();
        return true;
    }

    /**
     * Admits one request if the handle is Ready and its model name holds fewer than
     * {@code limit} pending requests across all versions.
     */
    public synchronized Admission tryAdmit(int limit) {
        if (state != ModelState.READY) {
            return Admission.NOT_READY;
        }
        if (!admission.tryAcquire(limit)) {
            return Admission.OVERLOADED;
        }
        inFlightRequests++;
        admittedTotal++;
        return Admission.ADMITTED;
    }

    /**
     * Gives back the reference taken by an admitted request.
     */
    public void release() {
        boolean nowUnloaded;
        synchronized (this) {
            if (inFlightRequests == 0) {
                throw new IllegalStateException("Release without admission on " + getId());
            }
            inFlightRequests--;
            admission.release();
            nowUnloaded = state == ModelState.DRAINING && inFlightRequests == 0;
            if (nowUnloaded) {
                state = ModelState.UNLOADED;
            }
        }
        if (nowUnloaded) {
            fireUnloaded();
        }
    }

    public synchronized void batchSealed() {
        inFlightBatches++;
    }

    public synchronized void batchFinished() {
        if (inFlightBatches > 0) {
            inFlightBatches--;
        }
    }

    /**
     * Completes once the handle has reached UNLOADED.
     */
    public CompletableFuture<ModelHandle> whenUnloaded() {
        return unloaded.copy();
    }

    private void fireUnloaded() {
        log.info("Model unloaded: model={}", getId());
        if (unloadListener != null) {
            try {
                unloadListener.accept(this);
            } catch (Exception e) {
                log.error("Error in unload listener: model={}", getId(), e);
            }
        }
        unloaded.complete(this);
    }

    @Override
    public String toString() {
        return "ModelHandle{" +
                "id='" + getId() + '\'' +
                ", state=" + state +
                ", executor=" + executor.getBackendName() +
                '}';
    }
}
