package fr.lapetina.neuraforge.domain.event;

import fr.lapetina.neuraforge.domain.batch.PendingRequest;
import fr.lapetina.neuraforge.domain.model.ModelHandle;

import java.util.concurrent.CompletableFuture;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * Mutable and reused across the ring: publishers fill it through one of the
 * {@code initialize*} methods and the assembler clears it once handled.
 * It should never be retained outside the handler that is processing it.
 */
public final class SchedulerEvent {

    private SchedulerEventType type;
    private PendingRequest request;
    private ModelHandle handle;
    private long batchId;
    private CompletableFuture<Void> ack;
    private long publishedAtNanos;

    public void clear() {
        this.type = null;
        this.request = null;
        this.handle = null;
        this.batchId = -1;
        this.ack = null;
        this.publishedAtNanos = 0;
    }

    public void initializeSubmit(PendingRequest request) {
        clear();
        this.type = SchedulerEventType.SUBMIT;
        this.request = request;
        this.handle = request.getHandle();
        this.publishedAtNanos = System.nanoTime();
    }

    public void initializeSealTimeout(ModelHandle handle, long batchId) {
        clear();
        this.type = SchedulerEventType.SEAL_TIMEOUT;
        this.handle = handle;
        this.batchId = batchId;
        this.publishedAtNanos = System.nanoTime();
    }

    public void initializeCancel(PendingRequest request) {
        clear();
        this.type = SchedulerEventType.CANCEL;
        this.request = request;
        this.handle = request.getHandle();
        this.batchId = request.getBatchId();
        this.publishedAtNanos = System.nanoTime();
    }

    public void initializeDrain(ModelHandle handle) {
        clear();
        this.type = SchedulerEventType.DRAIN;
        this.handle = handle;
        this.publishedAtNanos = System.nanoTime();
    }

    public void initializeFlush(CompletableFuture<Void> ack) {
        clear();
        this.type = SchedulerEventType.FLUSH;
        this.ack = ack;
        this.publishedAtNanos = System.nanoTime();
    }

    public SchedulerEventType getType() {
        return type;
    }

    public PendingRequest getRequest() {
        return request;
    }

    public ModelHandle getHandle() {
        return handle;
    }

    public long getBatchId() {
        return batchId;
    }

    /**
     * Completed by the assembler once a FLUSH has been applied; may be null.
     */
    public CompletableFuture<Void> getAck() {
        return ack;
    }

    public long getPublishedAtNanos() {
        return publishedAtNanos;
    }

    @Override
    public String toString() {
        return "SchedulerEvent{" +
                "type=" + type +
                ", requestId=" + (request != null ? request.getRequestId() : null) +
                ", model=" + (handle != null ? handle.getId() : null) +
                ", batchId=" + batchId +
                '}';
    }
}
