/**
 * Ready queues holding sealed batches until a worker picks them up.
 *
 * <p>The queue policy decides which sealed batch runs next when several are waiting.
 * All implementations are thread-safe: the assembler offers while workers poll.
 *
 * <h2>Available Policies</h2>
 * <table border="1">
 *   <tr><th>Policy</th><th>Description</th><th>Best For</th></tr>
 *   <tr><td>{@code fifo}</td><td>Global seal order</td><td>Single model, or fairness by arrival</td></tr>
 *   <tr><td>{@code round-robin}</td><td>Takes turns between models</td><td>Many models sharing few workers</td></tr>
 * </table>
 *
 * <h2>Custom Policies</h2>
 * <p>Implement {@link fr.lapetina.neuraforge.domain.queue.BatchQueue} and register
 * with {@link fr.lapetina.neuraforge.domain.queue.BatchQueueFactory}.
 *
 * @see fr.lapetina.neuraforge.domain.queue.BatchQueue
 * @see fr.lapetina.neuraforge.domain.queue.BatchQueueFactory
 */
package fr.lapetina.neuraforge.domain.queue;
