package fr.lapetina.neuraforge.domain.queue;

import fr.lapetina.neuraforge.domain.batch.Batch;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ready queue that takes turns between models.
 *
 * Each model name has its own FIFO lane. Polling serves the lanes in rotation, so one
 * busy model cannot starve the others. Within a lane, batches keep their seal order.
 *
 * Thread-safe via a single lock.
 */
public final class RoundRobinBatchQueue implements BatchQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    // Lane order is rotation order: the head lane is served next
    private final LinkedHashMap<String, Deque<Batch>> lanes = new LinkedHashMap<>();
    private int size;

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public void offer(Batch batch) {
        lock.lock();
        try {
            lanes.computeIfAbsent(batch.getHandle().getName(), k -> new ArrayDeque<>()).addLast(batch);
            size++;
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Batch poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (size == 0) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return takeNext();
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock and size > 0
    private Batch takeNext() {
        Iterator<Map.Entry<String, Deque<Batch>>> it = lanes.entrySet().iterator();
        Map.Entry<String, Deque<Batch>> head = it.next();
        String model = head.getKey();
        Deque<Batch> lane = head.getValue();
        Batch batch = lane.pollFirst();
        it.remove();
        if (!lane.isEmpty()) {
            // Back of the rotation
            lanes.put(model, lane);
        }
        size--;
        return batch;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Batch> drain() {
        lock.lock();
        try {
            List<Batch> drained = new ArrayList<>(size);
            while (size > 0) {
                drained.add(takeNext());
            }
            return drained;
        } finally {
            lock.unlock();
        }
    }
}
