package fr.lapetina.neuraforge.infrastructure.worker;

import fr.lapetina.neuraforge.domain.batch.Batch;
import fr.lapetina.neuraforge.domain.batch.BatchState;
import fr.lapetina.neuraforge.domain.batch.PendingRequest;
import fr.lapetina.neuraforge.domain.model.ErrorType;
import fr.lapetina.neuraforge.domain.model.InferenceResult;
import fr.lapetina.neuraforge.domain.model.ModelHandle;
import fr.lapetina.neuraforge.executor.BatchOutput;
import fr.lapetina.neuraforge.infrastructure.buffer.BufferPool;
import fr.lapetina.neuraforge.infrastructure.buffer.BufferSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns a batch outcome into one result per request.
 *
 * Position {@code i} of the backend output goes to the request at position {@code i}
 * of the batch. Every dispatch finishes the batch at most once, and the batch's buffer
 * slot goes back to the pool at most once however many times release is requested.
 */
public final class ResultDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ResultDispatcher.class);

    private final BufferPool bufferPool;

    public ResultDispatcher(BufferPool bufferPool) {
        this.bufferPool = bufferPool;
    }

    /**
     * Delivers a successful backend output. A segment count that does not match the
     * batch size fails the whole batch instead.
     */
    public void dispatch(Batch batch, BatchOutput output) {
        List<PendingRequest> requests = batch.requests();
        if (output == null || output.size() != requests.size()) {
            int segments = output == null ? 0 : output.size();
            dispatchFailure(batch, ErrorType.BACKEND_FAILURE,
                    "Backend returned " + segments + " output segments for a batch of " + requests.size());
            return;
        }

        ModelHandle handle = batch.getHandle();
        int size = requests.size();
        for (int position = 0; position < size; position++) {
            PendingRequest pending = requests.get(position);
            InferenceResult result = InferenceResult.success(
                    pending.getRequest(),
                    handle.getVersion(),
                    output.segmentBytes(position),
                    batch.getId(),
                    size,
                    position
            );
            pending.fulfil(result);
        }
        finish(batch, BatchState.COMPLETED);

        log.debug("Batch dispatched: batchId={}, model={}, size={}", batch.getId(), handle.getId(), size);
    }

    /**
     * Fails every request of the batch that has no result yet with the same error.
     */
    public void dispatchFailure(Batch batch, ErrorType errorType, String message) {
        List<PendingRequest> requests = batch.requests();
        ModelHandle handle = batch.getHandle();
        int size = requests.size();
        for (int position = 0; position < size; position++) {
            PendingRequest pending = requests.get(position);
            InferenceResult result = InferenceResult.error(
                    pending.getRequest(),
                    handle.getVersion(),
                    batch.getId(),
                    size,
                    position,
                    errorType,
                    message
            );
            pending.fulfil(result);
        }
        finish(batch, BatchState.FAILED);

        log.debug("Batch failed: batchId={}, model={}, size={}, errorType={}",
                batch.getId(), handle.getId(), size, errorType);
    }

    /**
     * Gives the batch's slot back to the pool; later calls are no-ops.
     */
    public void releaseSlot(Batch batch) {
        BufferSlot slot = batch.detachSlot();
        if (slot != null) {
            bufferPool.release(slot);
        }
    }

    private void finish(Batch batch, BatchState terminal) {
        if (batch.finish(terminal)) {
            batch.getHandle().batchFinished();
        }
    }
}
