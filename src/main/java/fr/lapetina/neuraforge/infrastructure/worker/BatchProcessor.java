package fr.lapetina.neuraforge.infrastructure.worker;

import fr.lapetina.neuraforge.domain.batch.Batch;

/**
 * What a worker does with a sealed batch taken from the ready queue.
 */
public interface BatchProcessor {

    /**
     * Executes the batch and dispatches a terminal result to every request in it.
     *
     * @throws InterruptedException if the worker was interrupted while waiting for a buffer slot
     */
    void process(Batch batch) throws InterruptedException;

    /**
     * Called by the pool when {@link #process} ended abnormally. Must fail every request of the
     * batch that has no result yet and give back the batch's resources.
     */
    void onInternalFault(Batch batch, Throwable cause);
}
