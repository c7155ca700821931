/**
 * Domain model classes representing requests, results and served model versions.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.neuraforge.domain.model.InferenceRequest} - Immutable request with an opaque payload</li>
 *   <li>{@link fr.lapetina.neuraforge.domain.model.InferenceResult} - Immutable per-request outcome, success or error</li>
 *   <li>{@link fr.lapetina.neuraforge.domain.model.ModelHandle} - Thread-safe handle on one loaded model version</li>
 *   <li>{@link fr.lapetina.neuraforge.domain.model.ModelState} - Handle lifecycle (LOADING, READY, DRAINING, UNLOADED)</li>
 *   <li>{@link fr.lapetina.neuraforge.domain.model.ErrorType} - Categorized error types for results</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code InferenceRequest} and {@code InferenceResult} are immutable records that copy their
 * byte arrays in and out. {@code ModelHandle} guards its state and counters with its own monitor.
 *
 * @see fr.lapetina.neuraforge.domain.model.ModelHandle
 */
package fr.lapetina.neuraforge.domain.model;
