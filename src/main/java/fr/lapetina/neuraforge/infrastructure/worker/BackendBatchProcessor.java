package fr.lapetina.neuraforge.infrastructure.worker;

import fr.lapetina.neuraforge.domain.batch.Batch;
import fr.lapetina.neuraforge.domain.batch.PendingRequest;
import fr.lapetina.neuraforge.domain.model.ErrorType;
import fr.lapetina.neuraforge.domain.model.ModelHandle;
import fr.lapetina.neuraforge.executor.BackendException;
import fr.lapetina.neuraforge.executor.BatchInput;
import fr.lapetina.neuraforge.executor.BatchOutput;
import fr.lapetina.neuraforge.infrastructure.buffer.BufferPool;
import fr.lapetina.neuraforge.infrastructure.buffer.BufferSlot;
import fr.lapetina.neuraforge.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;

/**
 * Runs a sealed batch against its model's executor.
 *
 * Steps per batch:
 * 1. Claim every still-queued request; cancelled ones are dropped here
 * 2. Lease a buffer slot sized to the surviving payloads (may block)
 * 3. Write the payloads back to back in batch order
 * 4. Call the executor once for the whole batch
 * 5. Dispatch one result per request, then give the slot back
 *
 * A {@link BackendException} fails only this batch. Anything else propagates to the
 * worker pool as an internal fault.
 */
public final class BackendBatchProcessor implements BatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(BackendBatchProcessor.class);

    private final BufferPool bufferPool;
    private final ResultDispatcher dispatcher;
    private final MetricsRegistry metrics;

    public BackendBatchProcessor(BufferPool bufferPool, ResultDispatcher dispatcher, MetricsRegistry metrics) {
        this.bufferPool = bufferPool;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
    }

    @Override
    public void process(Batch batch) throws InterruptedException {
        ModelHandle handle = batch.getHandle();
        MDC.put("batchId", String.valueOf(batch.getId()));
        MDC.put("model", handle.getId());
        try {
            List<PendingRequest> live = batch.claimForExecution();
            if (live.isEmpty()) {
                log.debug("Batch emptied by cancellation: batchId={}", batch.getId());
                dispatcher.dispatch(batch, BatchOutput.ofSegments(List.of()));
                return;
            }

            BufferSlot slot = bufferPool.acquire(batch.getPayloadBytes());
            batch.attachSlot(slot);
            try {
                BatchInput input = compose(batch, live, slot);
                batch.markExecuting();
                execute(batch, handle, input);
            } finally {
                dispatcher.releaseSlot(batch);
            }
        } finally {
            MDC.remove("batchId");
            MDC.remove("model");
        }
    }

    private void execute(Batch batch, ModelHandle handle, BatchInput input) {
        log.debug("Executing batch: batchId={}, model={}, size={}, bytes={}, sealReason={}",
                batch.getId(), handle.getId(), input.size(), input.totalBytes(), batch.getSealReason());

        long start = System.nanoTime();
        BatchOutput output;
        try {
            output = handle.getExecutor().execute(handle, input);
        } catch (BackendException e) {
            metrics.recordExecution(handle.getName(), Duration.ofNanos(System.nanoTime() - start), false);
            log.warn("Backend failure: batchId={}, model={}, size={}, error={}",
                    batch.getId(), handle.getId(), input.size(), e.getMessage());
            dispatcher.dispatchFailure(batch, ErrorType.BACKEND_FAILURE, e.getMessage());
            return;
        }
        metrics.recordExecution(handle.getName(), Duration.ofNanos(System.nanoTime() - start), true);
        dispatcher.dispatch(batch, output);
    }

    private BatchInput compose(Batch batch, List<PendingRequest> live, BufferSlot slot) {
        ByteBuffer buffer = slot.buffer();
        int[] offsets = new int[live.size()];
        int[] lengths = new int[live.size()];
        for (int i = 0; i < live.size(); i++) {
            byte[] payload = live.get(i).getRequest().payload();
            offsets[i] = buffer.position();
            lengths[i] = payload.length;
            buffer.put(payload);
        }
        buffer.flip();
        return new BatchInput(batch.getId(), buffer, offsets, lengths);
    }

    @Override
    public void onInternalFault(Batch batch, Throwable cause) {
        String message = "Internal fault: " + cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        try {
            dispatcher.dispatchFailure(batch, ErrorType.BACKEND_FAILURE, message);
        } finally {
            dispatcher.releaseSlot(batch);
        }
    }
}
