package fr.lapetina.neuraforge.domain.batch;

import fr.lapetina.neuraforge.domain.model.ModelHandle;
import fr.lapetina.neuraforge.infrastructure.buffer.BufferSlot;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An ordered group of requests for one model handle, executed by one backend call.
 *
 * <p>While Open the batch is owned by the assembler thread alone. Sealing hands it to the
 * ready queue, after which exactly one worker owns it. Request order is insertion order and
 * becomes the batch position of each result.
 */
public final class Batch {

    private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

    private final long id;
    private final ModelHandle handle;
    private final int maxSize;
    private final List<PendingRequest> requests;
    private final Instant createdAt;
    private final long createdAtNanos;
    private final AtomicReference<BufferSlot> slot = new AtomicReference<>();

    private volatile BatchState state = BatchState.OPEN;
    private volatile SealReason sealReason;
    private volatile long sealedAtNanos;
    private int payloadBytes;
    private Future<?> sealTimer;

    public Batch(ModelHandle handle, int maxSize) {
        this.id = ID_SEQUENCE.incrementAndGet();
        this.handle = Objects.requireNonNull(handle, "Handle is required");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Max size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.requests = new ArrayList<>(Math.min(maxSize, 64));
        this.createdAt = Instant.now();
        this.createdAtNanos = System.nanoTime();
    }

    public long getId() {
        return id;
    }

    public ModelHandle getHandle() {
        return handle;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public BatchState getState() {
        return state;
    }

    public SealReason getSealReason() {
        return sealReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * {@link System#nanoTime()} at seal; zero while still Open.
     */
    public long getSealedAtNanos() {
        return sealedAtNanos;
    }

    public int size() {
        return requests.size();
    }

    public boolean isEmpty() {
        return requests.isEmpty();
    }

    public boolean isFull() {
        return requests.size() >= maxSize;
    }

    public int getPayloadBytes() {
        return payloadBytes;
    }

    public List<PendingRequest> requests() {
        return Collections.unmodifiableList(requests);
    }

    /**
     * Time from first request to seal; zero while still Open.
     */
    public Duration getFormationTime() {
        long sealed = sealedAtNanos;
        return sealed == 0 ? Duration.ZERO : Duration.ofNanos(sealed - createdAtNanos);
    }

    public void add(PendingRequest request) {
        requireState(BatchState.OPEN);
        if (request.getHandle() != handle) {
            throw new IllegalArgumentException("Request " + request.getRequestId()
                    + " belongs to " + request.getHandle().getId() + ", not " + handle.getId());
        }
        if (isFull()) {
            throw new IllegalStateException("Batch " + id + " is full");
        }
        requests.add(request);
        payloadBytes += request.getRequest().payloadSize();
        request.assignBatch(id);
    }

    /**
     * Takes a cancelled request out of an Open batch.
     *
     * @return false if the batch is no longer Open or did not hold the request
     */
    public boolean remove(PendingRequest request) {
        if (state != BatchState.OPEN || !requests.remove(request)) {
            return false;
        }
        payloadBytes -= request.getRequest().payloadSize();
        return true;
    }

    public void armTimer(Future<?> timer) {
        this.sealTimer = timer;
    }

    public void cancelTimer() {
        Future<?> timer = sealTimer;
        sealTimer = null;
        if (timer != null) {
            timer.cancel(false);
        }
    }

    public boolean hasTimer() {
        return sealTimer != null;
    }

    public void seal(SealReason reason) {
        requireState(BatchState.OPEN);
        cancelTimer();
        this.sealReason = Objects.requireNonNull(reason);
        this.sealedAtNanos = System.nanoTime();
        this.state = BatchState.SEALED;
    }

    /**
     * Moves every still-queued request to Executing and drops the cancelled ones.
     * Positions are renumbered over the survivors.
     *
     * @return the requests that will be executed, in position order
     */
    public List<PendingRequest> claimForExecution() {
        requireState(BatchState.SEALED);
        List<PendingRequest> live = new ArrayList<>(requests.size());
        int bytes = 0;
        for (PendingRequest request : requests) {
            if (request.tryStartExecution()) {
                live.add(request);
                bytes += request.getRequest().payloadSize();
            }
        }
        requests.clear();
        requests.addAll(live);
        payloadBytes = bytes;
        return requests();
    }

    public void markExecuting() {
        requireState(BatchState.SEALED);
        state = BatchState.EXECUTING;
    }

    /**
     * Moves the batch to a terminal state.
     *
     * @return false if the batch had already finished
     */
    public synchronized boolean finish(BatchState terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        if (state.isTerminal()) {
            return false;
        }
        state = terminal;
        return true;
    }

    public void attachSlot(BufferSlot bufferSlot) {
        if (!slot.compareAndSet(null, bufferSlot)) {
            throw new IllegalStateException("Batch " + id + " already holds a buffer slot");
        }
        bufferSlot.assignOwner(id);
    }

    /**
     * Hands the slot back to the caller at most once.
     */
    public BufferSlot detachSlot() {
        return slot.getAndSet(null);
    }

    public boolean holdsSlot() {
        return slot.get() != null;
    }

    private void requireState(BatchState expected) {
        if (state != expected) {
            throw new IllegalStateException("Batch " + id + " is " + state + ", expected " + expected);
        }
    }

    @Override
    public String toString() {
        return "Batch{" +
                "id=" + id +
                ", model=" + handle.getId() +
                ", size=" + requests.size() +
                ", state=" + state +
                ", sealReason=" + sealReason +
                '}';
    }
}
