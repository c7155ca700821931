package fr.lapetina.neuraforge.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.neuraforge.disruptor.handlers.BatchAssemblyHandler;
import fr.lapetina.neuraforge.domain.batch.Batch;
import fr.lapetina.neuraforge.domain.batch.BatchingPolicy;
import fr.lapetina.neuraforge.domain.batch.PendingRequest;
import fr.lapetina.neuraforge.domain.event.SchedulerEvent;
import fr.lapetina.neuraforge.domain.event.SchedulerEventFactory;
import fr.lapetina.neuraforge.domain.model.ErrorType;
import fr.lapetina.neuraforge.domain.model.InferenceRequest;
import fr.lapetina.neuraforge.domain.model.InferenceResult;
import fr.lapetina.neuraforge.domain.model.ModelHandle;
import fr.lapetina.neuraforge.domain.queue.BatchQueue;
import fr.lapetina.neuraforge.domain.queue.BatchQueueFactory;
import fr.lapetina.neuraforge.domain.queue.FifoBatchQueue;
import fr.lapetina.neuraforge.infrastructure.buffer.BufferPool;
import fr.lapetina.neuraforge.infrastructure.buffer.FixedBufferPool;
import fr.lapetina.neuraforge.infrastructure.config.SchedulerConfig;
import fr.lapetina.neuraforge.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.neuraforge.infrastructure.registry.ModelRegistry;
import fr.lapetina.neuraforge.infrastructure.worker.BackendBatchProcessor;
import fr.lapetina.neuraforge.infrastructure.worker.ResultDispatcher;
import fr.lapetina.neuraforge.infrastructure.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Batching scheduler: admits inference requests, groups them per model version and runs
 * each group as one backend call on a worker pool.
 *
 * Flow:
 * <pre>
 *   submit() --ring buffer--> BatchAssemblyHandler --BatchQueue--> WorkerPool --> ModelExecutor
 *      |                           ^                                   |
 *      |                     SEAL_TIMEOUT (timer)                ResultDispatcher
 *      +------------------------ CompletableFuture <-------------------+
 * </pre>
 *
 * PRODUCER TYPE CHOICE: MULTI
 *
 * Requests arrive from any number of caller threads, the batch timer and the registry
 * listener all publish into the same ring.
 *
 * ADMISSION
 *
 * Admission never blocks: the Ready check and the in-flight increment happen in one step on
 * the model handle, and the ring slot is claimed with {@code tryNext}. Every outcome,
 * rejections included, is delivered through the returned future as an
 * {@link InferenceResult}; the future never completes exceptionally.
 *
 * WAIT STRATEGY CHOICE: Configurable (default BlockingWaitStrategy)
 *
 * The assembler mostly idles between bursts, so the CPU friendly strategy is the default.
 */
public final class BatchScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    // A handle may turn Draining between lookup and admission during a swap
    private static final int MAX_ADMISSION_ATTEMPTS = 3;

    private static final long TIMEOUT_RETRY_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final Disruptor<SchedulerEvent> disruptor;
    private final RingBuffer<SchedulerEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private final ModelRegistry registry;
    private final BufferPool bufferPool;
    private final BatchQueue readyQueue;
    private final BatchAssemblyHandler assembler;
    private final ResultDispatcher dispatcher;
    private final WorkerPool workerPool;
    private final MetricsRegistry metrics;
    private final ScheduledThreadPoolExecutor timerExecutor;
    private final Duration shutdownTimeout;

    private final Map<String, PendingRequest> pendingById = new ConcurrentHashMap<>();
    private final Consumer<ModelRegistry.RegistryEvent> registryListener = this::onRegistryEvent;

    private volatile int defaultAdmissionLimit;
    private volatile Map<String, Integer> admissionLimits;

    private BatchScheduler(Builder builder) {
        this.registry = builder.registry;
        this.metrics = builder.metricsRegistry != null
                ? builder.metricsRegistry
                : new MetricsRegistry("neuraforge", false);
        this.bufferPool = builder.bufferPool != null
                ? builder.bufferPool
                : new FixedBufferPool(builder.bufferPoolSize, builder.slotCapacity, builder.directBuffers);
        this.readyQueue = BatchQueueFactory.createOrDefault(builder.queuePolicy, FifoBatchQueue::new);
        this.shutdownTimeout = builder.shutdownTimeout;
        this.defaultAdmissionLimit = builder.defaultAdmissionLimit;
        this.admissionLimits = Map.copyOf(builder.admissionLimits);

        this.timerExecutor = new ScheduledThreadPoolExecutor(1, new SchedulerThreadFactory("batch-timer", true));
        this.timerExecutor.setRemoveOnCancelPolicy(true);

        this.assembler = new BatchAssemblyHandler(
                builder.batchingPolicy,
                bufferPool.slotCapacity(),
                readyQueue::offer,
                this::scheduleSealTimeout,
                metrics
        );

        this.dispatcher = new ResultDispatcher(bufferPool);
        this.workerPool = new WorkerPool(
                builder.workerCount,
                readyQueue,
                new BackendBatchProcessor(bufferPool, dispatcher, metrics),
                metrics
        );

        this.disruptor = new Disruptor<>(
                new SchedulerEventFactory(),
                builder.ringBufferSize,
                new SchedulerThreadFactory("batch-assembler", false),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );
        disruptor.handleEventsWith(assembler);
        disruptor.setDefaultExceptionHandler(new AssemblerExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        metrics.registerGauge("pending_requests", "Admitted requests without a result", pendingById::size);
        metrics.registerGauge("ready_queue_depth", "Sealed batches waiting for a worker", readyQueue::size);
        metrics.registerGauge("buffer_slots_free", "Free staging buffer slots", bufferPool::available);
        metrics.registerGauge("ringbuffer_remaining", "Remaining capacity in the ring buffer",
                ringBuffer::remainingCapacity);
        metrics.registerGauge("workers_busy", "Workers executing a batch", workerPool::getBusyWorkers);

        log.info("BatchScheduler created: ringBufferSize={}, waitStrategy={}, workers={}, queuePolicy={}, "
                        + "maxBatchSize={}, batchTimeout={}, bufferSlots={}x{}",
                builder.ringBufferSize, builder.waitStrategy, builder.workerCount, readyQueue.getName(),
                builder.batchingPolicy.maxBatchSize(), builder.batchingPolicy.batchTimeout(),
                bufferPool.size(), bufferPool.slotCapacity());
    }

    /**
     * Starts the assembler and the workers.
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Scheduler already closed");
        }
        if (running.compareAndSet(false, true)) {
            workerPool.start();
            disruptor.start();
            registry.addListener(registryListener);
            log.info("BatchScheduler started");
        }
    }

    /**
     * Submits a request for batched execution.
     *
     * <p>Never blocks. Rejections complete the returned future immediately with an error result.
     * The returned future is a copy: completing it from outside does not affect the scheduler.
     *
     * @param request The inference request
     * @return CompletableFuture that completes with exactly one result
     */
    public CompletableFuture<InferenceResult> submit(InferenceRequest request) {
        Objects.requireNonNull(request, "Request is required");
        if (!running.get()) {
            return reject(request, ErrorType.SHUTDOWN, "Scheduler not running");
        }
        if (request.payloadSize() > bufferPool.slotCapacity()) {
            return reject(request, ErrorType.INVALID_REQUEST,
                    "Payload of " + request.payloadSize() + " bytes exceeds slot capacity " + bufferPool.slotCapacity());
        }
        if (pendingById.containsKey(request.requestId())) {
            return reject(request, ErrorType.INVALID_REQUEST, "Request id already pending: " + request.requestId());
        }

        ModelHandle handle = null;
        int limit = admissionLimitFor(request.model());
        for (int attempt = 1; handle == null; attempt++) {
            Optional<ModelHandle> found = registry.lookup(request.model(), request.version());
            if (found.isEmpty()) {
                return reject(request, ErrorType.UNKNOWN_MODEL, "No ready model: " + describeModel(request));
            }
            ModelHandle candidate = found.get();
            switch (candidate.tryAdmit(limit)) {
                case ADMITTED -> handle = candidate;
                case OVERLOADED -> {
                    return reject(request, ErrorType.REJECTED_OVERLOAD,
                            "Model " + request.model() + " at admission limit " + limit);
                }
                case NOT_READY -> {
                    if (attempt >= MAX_ADMISSION_ATTEMPTS) {
                        return reject(request, ErrorType.UNKNOWN_MODEL, "No ready model: " + describeModel(request));
                    }
                }
            }
        }

        PendingRequest pending = new PendingRequest(request, handle);
        if (pendingById.putIfAbsent(request.requestId(), pending) != null) {
            pending.fulfil(InferenceResult.error(request, ErrorType.INVALID_REQUEST,
                    "Request id already pending: " + request.requestId()));
            metrics.recordOutcome(request.model(), ErrorType.INVALID_REQUEST);
            return pending.getCompletion().copy();
        }
        pending.getCompletion().whenComplete((result, error) -> {
            pendingById.remove(request.requestId(), pending);
            metrics.recordOutcome(request.model(), result != null ? result.errorType() : ErrorType.BACKEND_FAILURE);
        });

        // Close may have started after the first check; its final sweep only sees mapped requests
        if (!running.get()) {
            pending.fulfil(InferenceResult.error(request, ErrorType.SHUTDOWN, "Scheduler not running"));
            return pending.getCompletion().copy();
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            log.warn("Rejected: requestId={}, model={}, reason=ring buffer full",
                    request.requestId(), request.model());
            pending.fulfil(InferenceResult.error(request, ErrorType.REJECTED_OVERLOAD, "Admission ring buffer full"));
            return pending.getCompletion().copy();
        }

        try {
            ringBuffer.get(sequence).initializeSubmit(pending);
        } finally {
            ringBuffer.publish(sequence);
        }

        log.debug("Request admitted: requestId={}, model={}, sequence={}, inFlight={}/{}",
                request.requestId(), handle.getId(), sequence, handle.getAdmission().getPending(), limit);

        return pending.getCompletion().copy();
    }

    /**
     * Cancels a request that has not started executing.
     *
     * @return true if the request was cancelled and completed with CANCELLED; false if it is
     * unknown, already finished, or already executing (it then completes normally)
     */
    public boolean cancel(String requestId) {
        PendingRequest pending = pendingById.get(requestId);
        if (pending == null) {
            return false;
        }
        if (!pending.tryCancel()) {
            log.debug("Cancel too late: requestId={}, state={}", requestId, pending.getState());
            return false;
        }
        pending.fulfil(InferenceResult.error(pending.getRequest(), ErrorType.CANCELLED, "Cancelled before execution"));

        // Best effort: a sealed batch drops the request at claim time anyway
        try {
            long sequence = ringBuffer.tryNext();
            try {
                ringBuffer.get(sequence).initializeCancel(pending);
            } finally {
                ringBuffer.publish(sequence);
            }
        } catch (InsufficientCapacityException e) {
            log.debug("Ring buffer full, cancel left to the worker: requestId={}", requestId);
        }

        log.debug("Request cancelled: requestId={}, batchId={}", requestId, pending.getBatchId());
        return true;
    }

    /**
     * Seals every open batch now.
     *
     * @return completes once the open batches have been handed to the ready queue
     */
    public CompletableFuture<Void> flush() {
        CompletableFuture<Void> ack = new CompletableFuture<>();
        if (!running.get()) {
            ack.complete(null);
            return ack;
        }
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).initializeFlush(ack);
        } finally {
            ringBuffer.publish(sequence);
        }
        return ack;
    }

    private Future<?> scheduleSealTimeout(ModelHandle handle, long batchId, Duration delay) {
        return timerExecutor.schedule(() -> publishSealTimeout(handle, batchId), delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void publishSealTimeout(ModelHandle handle, long batchId) {
        if (!running.get()) {
            return;
        }
        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            // Never block the timer thread; retry shortly
            timerExecutor.schedule(() -> publishSealTimeout(handle, batchId), TIMEOUT_RETRY_NANOS, TimeUnit.NANOSECONDS);
            return;
        }
        try {
            ringBuffer.get(sequence).initializeSealTimeout(handle, batchId);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    private void onRegistryEvent(ModelRegistry.RegistryEvent event) {
        if (event.type() != ModelRegistry.RegistryEvent.Type.DRAINING || !running.get()) {
            return;
        }
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).initializeDrain(event.handle());
        } finally {
            ringBuffer.publish(sequence);
        }
        log.debug("Drain published: model={}", event.handle().getId());
    }

    private CompletableFuture<InferenceResult> reject(InferenceRequest request, ErrorType errorType, String message) {
        log.warn("Rejected: requestId={}, model={}, errorType={}, reason={}",
                request.requestId(), request.model(), errorType, message);
        metrics.recordOutcome(request.model(), errorType);
        return CompletableFuture.completedFuture(InferenceResult.error(request, errorType, message));
    }

    private static String describeModel(InferenceRequest request) {
        return request.version() == null ? request.model() : request.model() + ":" + request.version();
    }

    /**
     * Changes the batching thresholds for batches opened from now on.
     */
    public void updateBatchingPolicy(BatchingPolicy policy) {
        assembler.setPolicy(Objects.requireNonNull(policy));
    }

    /**
     * Replaces the per-model in-flight limits. Requests already admitted are unaffected.
     */
    public void updateAdmissionLimits(int defaultLimit, Map<String, Integer> limits) {
        if (defaultLimit <= 0) {
            throw new IllegalArgumentException("Default admission limit must be positive: " + defaultLimit);
        }
        this.admissionLimits = Map.copyOf(limits);
        this.defaultAdmissionLimit = defaultLimit;
        log.info("Admission limits changed: defaultLimit={}, limits={}", defaultLimit, limits);
    }

    public int admissionLimitFor(String model) {
        return admissionLimits.getOrDefault(model, defaultAdmissionLimit);
    }

    public BatchingPolicy getBatchingPolicy() {
        return assembler.getPolicy();
    }

    /**
     * Returns the number of admitted requests without a result.
     */
    public int getPendingCount() {
        return pendingById.size();
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /**
     * Returns the number of sealed batches waiting for a worker.
     */
    public int getReadyQueueDepth() {
        return readyQueue.size();
    }

    public boolean isRunning() {
        return running.get();
    }

    public ModelRegistry getRegistry() {
        return registry;
    }

    public BufferPool getBufferPool() {
        return bufferPool;
    }

    public WorkerPool getWorkerPool() {
        return workerPool;
    }

    /**
     * Gracefully shuts down the scheduler.
     *
     * Admission stops first. Open batches are sealed and the workers drain the ready
     * queue; anything still without a result afterwards completes with SHUTDOWN.
     */
    @Override
    public void close() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (!running.getAndSet(false)) {
            timerExecutor.shutdownNow();
            return;
        }
        log.info("Shutting down BatchScheduler: pending={}", pendingById.size());
        registry.removeListener(registryListener);

        assembler.setClosing(true);
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).initializeFlush(null);
        } finally {
            ringBuffer.publish(sequence);
        }

        try {
            disruptor.shutdown(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Batch assembler shutdown timed out, halting...");
            disruptor.halt();
        }
        timerExecutor.shutdownNow();

        for (Batch batch : workerPool.shutdown(shutdownTimeout)) {
            dispatcher.dispatchFailure(batch, ErrorType.SHUTDOWN, "Scheduler shut down");
            dispatcher.releaseSlot(batch);
        }

        int abandoned = 0;
        for (PendingRequest pending : new ArrayList<>(pendingById.values())) {
            if (pending.fulfil(InferenceResult.error(pending.getRequest(), ErrorType.SHUTDOWN, "Scheduler shut down"))) {
                abandoned++;
            }
        }
        log.info("BatchScheduler shut down: abandonedRequests={}", abandoned);
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for the assembler and timer threads.
     */
    private static class SchedulerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final boolean daemon;
        private final AtomicInteger counter = new AtomicInteger(0);

        SchedulerThreadFactory(String namePrefix, boolean daemon) {
            this.namePrefix = namePrefix;
            this.daemon = daemon;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(daemon);
            return t;
        }
    }

    /**
     * Exception handler for Disruptor.
     */
    private static class AssemblerExceptionHandler
            implements ExceptionHandler<SchedulerEvent> {

        private static final Logger log = LoggerFactory.getLogger(AssemblerExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, SchedulerEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for BatchScheduler.
     */
    public static final class Builder {
        private ModelRegistry registry;
        private BufferPool bufferPool;
        private MetricsRegistry metricsRegistry;
        private BatchingPolicy batchingPolicy = BatchingPolicy.of(8, 5);
        private int workerCount = 4;
        private String queuePolicy = "fifo";
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int bufferPoolSize = 16;
        private int slotCapacity = 1024 * 1024;
        private boolean directBuffers = false;
        private int defaultAdmissionLimit = 256;
        private Map<String, Integer> admissionLimits = Map.of();
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public Builder registry(ModelRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Uses the given pool instead of creating a {@link FixedBufferPool}.
         */
        public Builder bufferPool(BufferPool bufferPool) {
            this.bufferPool = bufferPool;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder batchingPolicy(BatchingPolicy policy) {
            this.batchingPolicy = policy;
            return this;
        }

        public Builder workerCount(int count) {
            if (count <= 0) {
                throw new IllegalArgumentException("Worker count must be positive");
            }
            this.workerCount = count;
            return this;
        }

        public Builder queuePolicy(String policy) {
            this.queuePolicy = policy;
            return this;
        }

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder bufferPool(int size, int slotCapacity, boolean direct) {
            this.bufferPoolSize = size;
            this.slotCapacity = slotCapacity;
            this.directBuffers = direct;
            return this;
        }

        public Builder defaultAdmissionLimit(int limit) {
            this.defaultAdmissionLimit = limit;
            return this;
        }

        public Builder admissionLimits(Map<String, Integer> limits) {
            this.admissionLimits = limits;
            return this;
        }

        public Builder shutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        public Builder fromConfig(SchedulerConfig config) {
            this.batchingPolicy = BatchingPolicy.of(
                    config.getBatching().getMaxBatchSize(),
                    config.getBatching().getBatchTimeoutMs());
            this.workerCount = config.getWorkers().getCount();
            this.queuePolicy = config.getWorkers().getQueuePolicy();
            this.shutdownTimeout = Duration.ofMillis(config.getWorkers().getShutdownTimeoutMs());
            this.bufferPoolSize = config.getBufferPool().getSize();
            this.slotCapacity = config.getBufferPool().getSlotCapacity();
            this.directBuffers = config.getBufferPool().isDirect();
            this.defaultAdmissionLimit = config.getAdmission().getDefaultLimit();
            this.admissionLimits = config.getAdmission().getLimits() != null
                    ? config.getAdmission().getLimits()
                    : Map.of();
            this.ringBufferSize = config.getDisruptor().getRingBufferSize();
            this.waitStrategy = config.getDisruptor().getWaitStrategy();
            return this;
        }

        public BatchScheduler build() {
            if (registry == null) {
                throw new IllegalStateException("ModelRegistry is required");
            }
            if (batchingPolicy == null) {
                throw new IllegalStateException("BatchingPolicy is required");
            }
            if (defaultAdmissionLimit <= 0) {
                throw new IllegalStateException("Default admission limit must be positive");
            }
            return new BatchScheduler(this);
        }
    }
}
