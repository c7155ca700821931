/**
 * NeuraForge batching scheduler - groups concurrent inference requests into batched
 * backend calls.
 *
 * <p>Requests for the same model version that arrive within a short window are executed
 * together in one forward pass, trading a bounded amount of latency for throughput.
 * Admission runs on an LMAX Disruptor ring buffer; sealed batches are executed by a fixed
 * worker pool using pre-allocated staging buffers.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.neuraforge.SchedulerFactory} - Main entry point for creating
 *       a fully-configured scheduler from YAML configuration</li>
 *   <li>{@link fr.lapetina.neuraforge.disruptor.BatchScheduler} - Admission, cancellation and shutdown</li>
 *   <li>{@link fr.lapetina.neuraforge.infrastructure.registry.ModelRegistry} - Model versions, hot swap and drain</li>
 *   <li>{@link fr.lapetina.neuraforge.executor.ModelExecutor} - Backend plug-in point</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (SchedulerFactory factory = SchedulerFactory.create("config.yaml").start()) {
 *     factory.getModelRegistry().load("resnet50", "v1", executor);
 *
 *     InferenceRequest request = InferenceRequest.of("resnet50", payload);
 *     InferenceResult result = factory.getScheduler().submit(request).join();
 *     if (result.isSuccess()) {
 *         byte[] output = result.output();
 *     }
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Size, timeout and capacity triggered batch sealing</li>
 *   <li>Zero-downtime model swap with in-flight draining</li>
 *   <li>Per-model admission limits with immediate overload rejection</li>
 *   <li>Hot-reload of batching thresholds and admission limits</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.neuraforge.SchedulerFactory
 * @see fr.lapetina.neuraforge.disruptor.BatchScheduler
 */
package fr.lapetina.neuraforge;
