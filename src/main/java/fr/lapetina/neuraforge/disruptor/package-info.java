/**
 * LMAX Disruptor-based admission and batch assembly.
 *
 * <p>Caller threads publish admitted requests into a ring buffer; a single assembler thread
 * consumes it and owns every open batch, so batch formation needs no locks. The batch timer
 * and the model registry publish into the same ring, which keeps every change to an open
 * batch on that one thread.
 *
 * <h2>Events</h2>
 * <pre>
 * SUBMIT | SEAL_TIMEOUT | CANCEL | DRAIN | FLUSH  →  BatchAssemblyHandler  →  ready queue
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.neuraforge.disruptor.BatchScheduler} - Scheduler entry point and lifecycle</li>
 *   <li>{@link fr.lapetina.neuraforge.disruptor.handlers.BatchAssemblyHandler} - Batch formation and sealing</li>
 * </ul>
 *
 * @see fr.lapetina.neuraforge.disruptor.BatchScheduler
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.neuraforge.disruptor;
