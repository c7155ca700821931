package fr.lapetina.neuraforge.domain.queue;

import fr.lapetina.neuraforge.domain.batch.Batch;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Ready queue between the batch assembler and the worker pool.
 *
 * Implementations must be thread-safe: one assembler thread offers while
 * every worker polls concurrently. A sealed batch is never refused, so the
 * queue is unbounded; admission limits bound it in practice.
 */
public interface BatchQueue {

    /**
     * Returns the name of this queue policy for configuration and metrics.
     */
    String getName();

    /**
     * Enqueues a sealed batch.
     */
    void offer(Batch batch);

    /**
     * Removes the next batch to execute, waiting up to the given time.
     *
     * @return the batch, or null if none became available
     */
    Batch poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Number of batches waiting.
     */
    int size();

    /**
     * Removes every waiting batch, in the order they would have been polled.
     */
    List<Batch> drain();
}
