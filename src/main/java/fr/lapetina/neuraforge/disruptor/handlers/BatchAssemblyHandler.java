package fr.lapetina.neuraforge.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.neuraforge.domain.batch.Batch;
import fr.lapetina.neuraforge.domain.batch.BatchingPolicy;
import fr.lapetina.neuraforge.domain.batch.PendingRequest;
import fr.lapetina.neuraforge.domain.batch.RequestState;
import fr.lapetina.neuraforge.domain.batch.SealReason;
import fr.lapetina.neuraforge.domain.event.SchedulerEvent;
import fr.lapetina.neuraforge.domain.model.ErrorType;
import fr.lapetina.neuraforge.domain.model.InferenceResult;
import fr.lapetina.neuraforge.domain.model.ModelHandle;
import fr.lapetina.neuraforge.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Single consumer of the admission ring buffer: groups admitted requests into batches.
 *
 * Owns every Open batch, at most one per model handle. Because only this thread touches
 * them, batches need no locking until they are sealed and handed to the ready queue.
 *
 * A batch is sealed on the first of:
 * - it reached the max batch size
 * - the batch timeout elapsed since its first request
 * - the batch timeout is zero (every request is its own batch)
 * - the next request would not fit into one buffer slot
 * - its handle is no longer Ready
 * - a flush, or the scheduler is closing
 */
public final class BatchAssemblyHandler implements EventHandler<SchedulerEvent> {

    private static final Logger log = LoggerFactory.getLogger(BatchAssemblyHandler.class);

    // Keyed by handle identity: two versions of a model never share a batch
    private final Map<ModelHandle, Batch> openBatches = new HashMap<>();

    private final Consumer<Batch> sealedSink;
    private final SealTimer sealTimer;
    private final int slotCapacity;
    private final MetricsRegistry metrics;

    private volatile BatchingPolicy policy;
    private volatile boolean closing;

    public BatchAssemblyHandler(
            BatchingPolicy policy,
            int slotCapacity,
            Consumer<Batch> sealedSink,
            SealTimer sealTimer,
            MetricsRegistry metrics
    ) {
        this.policy = policy;
        this.slotCapacity = slotCapacity;
        this.sealedSink = sealedSink;
        this.sealTimer = sealTimer;
        this.metrics = metrics;
        log.info("BatchAssemblyHandler initialized: maxBatchSize={}, batchTimeout={}, slotCapacity={}",
                policy.maxBatchSize(), policy.batchTimeout(), slotCapacity);
    }

    @Override
    public void onEvent(SchedulerEvent event, long sequence, boolean endOfBatch) {
        try {
            switch (event.getType()) {
                case SUBMIT -> onSubmit(event.getRequest());
                case SEAL_TIMEOUT -> onSealTimeout(event.getHandle(), event.getBatchId());
                case CANCEL -> onCancel(event.getRequest());
                case DRAIN -> onDrain(event.getHandle());
                case FLUSH -> onFlush(event.getAck());
            }
        } catch (RuntimeException e) {
            log.error("Exception in batch assembler: sequence={}, event={}", sequence, event, e);
            failOrphan(event);
        } finally {
            event.clear();
        }
    }

    private void onSubmit(PendingRequest request) {
        if (request.getState() != RequestState.QUEUED) {
            // Cancelled between admission and assembly
            log.debug("Skipping request: requestId={}, state={}", request.getRequestId(), request.getState());
            return;
        }

        ModelHandle handle = request.getHandle();
        BatchingPolicy current = policy;
        int payloadSize = request.getRequest().payloadSize();

        Batch batch = openBatches.get(handle);
        if (batch != null && batch.getPayloadBytes() + payloadSize > slotCapacity) {
            seal(batch, SealReason.CAPACITY);
            batch = null;
        }
        if (batch == null) {
            batch = new Batch(handle, current.maxBatchSize());
            openBatches.put(handle, batch);
            if (!current.isBatchingDisabled()) {
                batch.armTimer(sealTimer.schedule(handle, batch.getId(), current.batchTimeout()));
            }
        }
        batch.add(request);

        log.debug("Request batched: requestId={}, batchId={}, position={}",
                request.getRequestId(), batch.getId(), batch.size() - 1);

        if (current.batchTimeout().isZero()) {
            seal(batch, SealReason.NO_BATCHING);
        } else if (batch.isFull()) {
            seal(batch, SealReason.SIZE);
        } else if (!handle.isReady()) {
            seal(batch, SealReason.DRAIN);
        } else if (closing) {
            seal(batch, SealReason.FLUSH);
        }
    }

    private void onSealTimeout(ModelHandle handle, long batchId) {
        Batch batch = openBatches.get(handle);
        if (batch == null || batch.getId() != batchId) {
            log.debug("Ignoring stale batch timeout: batchId={}, model={}", batchId, handle.getId());
            return;
        }
        seal(batch, SealReason.TIMEOUT);
    }

    private void onCancel(PendingRequest request) {
        Batch batch = openBatches.get(request.getHandle());
        if (batch == null || !batch.remove(request)) {
            // Not yet assembled, or already sealed: the worker drops it
            return;
        }
        log.debug("Request removed from open batch: requestId={}, batchId={}, remaining={}",
                request.getRequestId(), batch.getId(), batch.size());
        if (batch.isEmpty()) {
            openBatches.remove(request.getHandle());
            batch.cancelTimer();
            log.debug("Discarded empty batch: batchId={}", batch.getId());
        }
    }

    private void onDrain(ModelHandle handle) {
        Batch batch = openBatches.get(handle);
        if (batch != null) {
            seal(batch, SealReason.DRAIN);
        }
    }

    private void onFlush(CompletableFuture<Void> ack) {
        for (Batch batch : new ArrayList<>(openBatches.values())) {
            seal(batch, SealReason.FLUSH);
        }
        if (ack != null) {
            ack.complete(null);
        }
    }

    private void seal(Batch batch, SealReason reason) {
        ModelHandle handle = batch.getHandle();
        openBatches.remove(handle);
        batch.seal(reason);
        handle.batchSealed();
        metrics.recordBatchSealed(handle.getName(), batch.size(), reason);

        log.debug("Batch sealed: batchId={}, model={}, size={}, reason={}, formationTime={}",
                batch.getId(), handle.getId(), batch.size(), reason, batch.getFormationTime());

        sealedSink.accept(batch);
    }

    private void failOrphan(SchedulerEvent event) {
        PendingRequest request = event.getRequest();
        if (request != null && !isOpen(request)) {
            request.fulfil(InferenceResult.error(request.getRequest(), ErrorType.BACKEND_FAILURE,
                    "Internal fault while batching"));
        }
        if (event.getAck() != null) {
            event.getAck().complete(null);
        }
    }

    // Outside an open batch after a fault, nothing else would complete the request
    private boolean isOpen(PendingRequest request) {
        Batch batch = openBatches.get(request.getHandle());
        return batch != null && batch.getId() == request.getBatchId();
    }

    public BatchingPolicy getPolicy() {
        return policy;
    }

    /**
     * Applies to batches opened from now on; open batches keep their size limit and timer.
     */
    public void setPolicy(BatchingPolicy policy) {
        BatchingPolicy old = this.policy;
        this.policy = policy;
        log.info("Batching policy changed: maxBatchSize {} -> {}, batchTimeout {} -> {}",
                old.maxBatchSize(), policy.maxBatchSize(), old.batchTimeout(), policy.batchTimeout());
    }

    /**
     * From now on every request is sealed as soon as it is batched.
     */
    public void setClosing(boolean closing) {
        this.closing = closing;
    }

    // Visible for testing; only safe on the assembler thread
    Batch openBatchFor(ModelHandle handle) {
        return openBatches.get(handle);
    }

    int openBatchCount() {
        return openBatches.size();
    }
}
