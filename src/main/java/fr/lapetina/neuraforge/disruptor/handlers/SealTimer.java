package fr.lapetina.neuraforge.disruptor.handlers;

import fr.lapetina.neuraforge.domain.model.ModelHandle;

import java.time.Duration;
import java.util.concurrent.Future;

/**
 * Arms batch timeouts for the assembler.
 *
 * When the delay elapses the implementation must feed a SEAL_TIMEOUT event for the
 * handle and batch id back into the ring buffer. Cancelling the returned future is
 * best effort; the assembler ignores timeouts for batches that are no longer open.
 */
@FunctionalInterface
public interface SealTimer {

    Future<?> schedule(ModelHandle handle, long batchId, Duration delay);
}
