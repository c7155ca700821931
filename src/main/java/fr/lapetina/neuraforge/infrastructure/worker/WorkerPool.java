package fr.lapetina.neuraforge.infrastructure.worker;

import fr.lapetina.neuraforge.domain.batch.Batch;
import fr.lapetina.neuraforge.domain.queue.BatchQueue;
import fr.lapetina.neuraforge.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads executing sealed batches from a shared ready queue.
 *
 * A worker runs one batch at a time. When {@link BatchProcessor#process} throws anything,
 * the pool fails the batch through {@link BatchProcessor#onInternalFault}, lets the
 * faulty thread end and starts a replacement, so the pool size stays constant.
 * Interrupts do not shrink the pool either: a worker only ends on interrupt once
 * shutdown has timed out.
 *
 * Stopping lets the workers finish every batch already queued before they exit.
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private static final long POLL_INTERVAL_MS = 50;

    private final BatchQueue queue;
    private final BatchProcessor processor;
    private final MetricsRegistry metrics;
    private final int size;
    private final ThreadFactory threadFactory;

    private final Set<Thread> workers = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    // Set when shutdown gives up waiting and interrupts the workers
    private final AtomicBoolean halted = new AtomicBoolean(false);
    private final AtomicInteger busy = new AtomicInteger(0);
    private final AtomicInteger respawnCount = new AtomicInteger(0);
    private final AtomicInteger processedCount = new AtomicInteger(0);

    public WorkerPool(int size, BatchQueue queue, BatchProcessor processor, MetricsRegistry metrics) {
        if (size <= 0) {
            throw new IllegalArgumentException("Worker count must be positive: " + size);
        }
        this.size = size;
        this.queue = queue;
        this.processor = processor;
        this.metrics = metrics;
        this.threadFactory = new WorkerThreadFactory("batch-worker");
    }

    /**
     * Starts the worker threads.
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Worker pool already stopped");
        }
        if (running.compareAndSet(false, true)) {
            for (int i = 0; i < size; i++) {
                spawn();
            }
            log.info("WorkerPool started: workers={}, queuePolicy={}", size, queue.getName());
        }
    }

    private void spawn() {
        Thread worker = threadFactory.newThread(this::runWorker);
        workers.add(worker);
        worker.start();
    }

    private void runWorker() {
        try {
            while (running.get() || queue.size() > 0) {
                Batch batch;
                try {
                    batch = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    if (halted.get()) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    log.warn("Worker interrupted while idle, ignoring: thread={}", Thread.currentThread().getName());
                    continue;
                }
                if (batch == null) {
                    continue;
                }
                if (!runBatch(batch)) {
                    return;
                }
                // Executors may restore an interrupt they caught; only a halt ends the worker
                if (Thread.interrupted()) {
                    if (halted.get()) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    log.warn("Cleared interrupt left by batch: thread={}, batchId={}",
                            Thread.currentThread().getName(), batch.getId());
                }
            }
        } finally {
            workers.remove(Thread.currentThread());
        }
    }

    /**
     * @return false if this worker must end
     */
    private boolean runBatch(Batch batch) {
        long sealedAt = batch.getSealedAtNanos();
        if (sealedAt != 0) {
            metrics.recordQueueWait(Duration.ofNanos(System.nanoTime() - sealedAt));
        }
        busy.incrementAndGet();
        try {
            processor.process(batch);
            processedCount.incrementAndGet();
            return true;
        } catch (InterruptedException e) {
            log.warn("Worker interrupted while processing: thread={}, batchId={}",
                    Thread.currentThread().getName(), batch.getId());
            failBatch(batch, e);
            if (halted.get()) {
                Thread.currentThread().interrupt();
            } else {
                respawn();
            }
            return false;
        } catch (Throwable t) {
            log.error("Internal fault in worker: thread={}, batch={}",
                    Thread.currentThread().getName(), batch, t);
            failBatch(batch, t);
            respawn();
            return false;
        } finally {
            busy.decrementAndGet();
        }
    }

    private void failBatch(Batch batch, Throwable cause) {
        try {
            processor.onInternalFault(batch, cause);
        } catch (RuntimeException e) {
            log.error("Failed to fail batch after internal fault: batchId={}", batch.getId(), e);
        }
    }

    private void respawn() {
        if (stopped.get() && queue.size() == 0) {
            return;
        }
        respawnCount.incrementAndGet();
        metrics.incrementWorkerRespawns();
        spawn();
        log.info("Worker respawned: respawnCount={}", respawnCount.get());
    }

    /**
     * Stops intake, lets workers drain the queue and waits for them to exit.
     *
     * @return batches still queued when the timeout elapsed; the caller must fail them
     */
    public List<Batch> shutdown(Duration timeout) {
        if (!stopped.compareAndSet(false, true)) {
            return List.of();
        }
        running.set(false);
        log.info("Shutting down WorkerPool: queued={}, busy={}", queue.size(), busy.get());

        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            // Respawns may add threads while we wait
            while (!workers.isEmpty()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                for (Thread worker : new ArrayList<>(workers)) {
                    TimeUnit.NANOSECONDS.timedJoin(worker, Math.max(1, deadline - System.nanoTime()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        List<Batch> leftover = queue.drain();
        if (!workers.isEmpty()) {
            log.warn("WorkerPool shutdown timed out, interrupting {} workers", workers.size());
            halted.set(true);
            for (Thread worker : workers) {
                worker.interrupt();
            }
        } else {
            log.info("WorkerPool shut down gracefully");
        }
        return leftover;
    }

    @Override
    public void close() {
        List<Batch> leftover = shutdown(Duration.ofSeconds(30));
        for (Batch batch : leftover) {
            failBatch(batch, new IllegalStateException("Worker pool closed"));
        }
    }

    public int getSize() {
        return size;
    }

    public int getLiveWorkers() {
        return workers.size();
    }

    public int getBusyWorkers() {
        return busy.get();
    }

    public int getRespawnCount() {
        return respawnCount.get();
    }

    public int getProcessedCount() {
        return processedCount.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Thread factory for worker threads.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        WorkerThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }
}
