package fr.lapetina.neuraforge.executor;

import fr.lapetina.neuraforge.domain.model.ModelHandle;

/**
 * Backend capability that runs one batched forward pass.
 *
 * <p>Implementations must be safe to call concurrently from several worker threads for
 * different handles. The call is synchronous from the worker's point of view; an
 * asynchronous backend blocks the calling worker until its result is available.
 *
 * <p>A batch is atomic: either every request gets its segment of the output or the whole
 * call fails with {@link BackendException}. Any other exception is treated as an internal
 * fault of the worker.
 */
@FunctionalInterface
public interface ModelExecutor {

    /**
     * Runs the model on a composed batch.
     *
     * @param handle the handle the batch was assembled against
     * @param input  request payloads laid out in batch order
     * @return one output segment per input segment, in the same order
     * @throws BackendException if the backend could not produce an output for the batch
     */
    BatchOutput execute(ModelHandle handle, BatchInput input) throws BackendException;

    /**
     * Called once while the handle is LOADING. Throwing keeps the handle from becoming Ready.
     */
    default void warmUp(ModelHandle handle) throws BackendException {
        // Default no-op, override for backends that need to load weights or compile
    }

    /**
     * Called once when the handle reaches UNLOADED.
     */
    default void unload(ModelHandle handle) {
        // Default no-op
    }

    /**
     * Returns the backend name for logs and the admin endpoints.
     */
    default String getBackendName() {
        return getClass().getSimpleName();
    }
}
