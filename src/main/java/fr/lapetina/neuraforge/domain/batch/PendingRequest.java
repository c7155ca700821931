package fr.lapetina.neuraforge.domain.batch;

import fr.lapetina.neuraforge.domain.model.InferenceRequest;
import fr.lapetina.neuraforge.domain.model.InferenceResult;
import fr.lapetina.neuraforge.domain.model.ModelHandle;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An admitted request travelling through the scheduler.
 *
 * <p>Holds the single-assignment completion handle and the reference on the model handle
 * taken at admission. {@link #fulfil} is the only way to complete the future and gives the
 * reference back, so both happen exactly once whatever the outcome.
 *
 * <p>The request knows its batch only by id, which the assembler uses to find it again
 * on cancellation.
 */
public final class PendingRequest {

    private final InferenceRequest request;
    private final ModelHandle handle;
    private final CompletableFuture<InferenceResult> completion = new CompletableFuture<>();
    private final AtomicReference<RequestState> state = new AtomicReference<>(RequestState.QUEUED);
    private final AtomicBoolean fulfilled = new AtomicBoolean(false);
    private final long admittedAtNanos;

    private volatile boolean cancelRequested;
    private volatile long batchId = -1;

    public PendingRequest(InferenceRequest request, ModelHandle handle) {
        this.request = request;
        this.handle = handle;
        this.admittedAtNanos = System.nanoTime();
    }

    public InferenceRequest getRequest() {
        return request;
    }

    public String getRequestId() {
        return request.requestId();
    }

    public ModelHandle getHandle() {
        return handle;
    }

    public CompletableFuture<InferenceResult> getCompletion() {
        return completion;
    }

    public RequestState getState() {
        return state.get();
    }

    public long getAdmittedAtNanos() {
        return admittedAtNanos;
    }

    public long getBatchId() {
        return batchId;
    }

    void assignBatch(long batchId) {
        this.batchId = batchId;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public boolean isFulfilled() {
        return fulfilled.get();
    }

    /**
     * Records a cancellation request and wins it if the request has not started executing.
     *
     * @return true if the request moved to CANCELLED
     */
    public boolean tryCancel() {
        cancelRequested = true;
        return state.compareAndSet(RequestState.QUEUED, RequestState.CANCELLED);
    }

    /**
     * Claims the request for execution; fails once it has been cancelled.
     */
    public boolean tryStartExecution() {
        return state.compareAndSet(RequestState.QUEUED, RequestState.EXECUTING);
    }

    /**
     * Delivers the terminal result and releases the model handle reference.
     *
     * @return false if a result had already been delivered
     */
    public boolean fulfil(InferenceResult result) {
        if (!fulfilled.compareAndSet(false, true)) {
            return false;
        }
        state.updateAndGet(s -> s == RequestState.CANCELLED ? s : RequestState.COMPLETED);
        try {
            completion.complete(result);
        } finally {
            handle.release();
        }
        return true;
    }

    @Override
    public String toString() {
        return "PendingRequest{" +
                "requestId='" + request.requestId() + '\'' +
                ", model=" + handle.getId() +
                ", state=" + state.get() +
                ", batchId=" + batchId +
                '}';
    }
}
