package fr.lapetina.neuraforge.infrastructure.buffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Buffer pool with a slot count and slot capacity fixed at construction.
 *
 * <p>Free slots sit in a LIFO stack so recently used (cache-warm) memory is handed out
 * first. Every FREE/LEASED transition happens under one lock; waiting workers park on a
 * condition and are woken one per released slot.
 */
public final class FixedBufferPool implements BufferPool {

    private static final Logger log = LoggerFactory.getLogger(FixedBufferPool.class);

    private final BufferSlot[] slots;
    private final int slotCapacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotFreed = lock.newCondition();

    // Guarded by lock
    private final ArrayDeque<BufferSlot> free;
    private int waiting;

    public FixedBufferPool(int poolSize, int slotCapacity, boolean direct) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("Pool size must be positive: " + poolSize);
        }
        if (slotCapacity <= 0) {
            throw new IllegalArgumentException("Slot capacity must be positive: " + slotCapacity);
        }
        this.slotCapacity = slotCapacity;
        this.slots = new BufferSlot[poolSize];
        this.free = new ArrayDeque<>(poolSize);
        for (int i = 0; i < poolSize; i++) {
            ByteBuffer buffer = direct ? ByteBuffer.allocateDirect(slotCapacity) : ByteBuffer.allocate(slotCapacity);
            slots[i] = new BufferSlot(this, i, buffer);
            free.push(slots[i]);
        }
        log.info("FixedBufferPool initialized: slots={}, slotCapacity={}, direct={}", poolSize, slotCapacity, direct);
    }

    public FixedBufferPool(int poolSize, int slotCapacity) {
        this(poolSize, slotCapacity, false);
    }

    @Override
    public BufferSlot acquire(int sizeHint) throws InterruptedException {
        if (sizeHint > slotCapacity) {
            throw new IllegalArgumentException(
                    "Requested " + sizeHint + " bytes exceeds slot capacity " + slotCapacity);
        }
        lock.lockInterruptibly();
        try {
            if (free.isEmpty()) {
                log.debug("Buffer pool exhausted, waiting: sizeHint={}, waiting={}", sizeHint, waiting + 1);
            }
            while (free.isEmpty()) {
                waiting++;
                try {
                    slotFreed.await();
                } finally {
                    waiting--;
                }
            }
            BufferSlot slot = free.pop();
            slot.lease();
            return slot;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(BufferSlot slot) {
        if (slot == null || !slot.belongsTo(this)) {
            throw new IllegalStateException("Slot does not belong to this pool: " + slot);
        }
        lock.lock();
        try {
            if (slot.getState() != SlotState.LEASED) {
                throw new IllegalStateException("Slot " + slot.getIndex() + " released twice");
            }
            slot.free();
            free.push(slot);
            slotFreed.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int available() {
        lock.lock();
        try {
            return free.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        return slots.length;
    }

    @Override
    public int slotCapacity() {
        return slotCapacity;
    }

    @Override
    public int waiting() {
        lock.lock();
        try {
            return waiting;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "FixedBufferPool{" +
                "slots=" + slots.length +
                ", slotCapacity=" + slotCapacity +
                ", available=" + available() +
                '}';
    }
}
