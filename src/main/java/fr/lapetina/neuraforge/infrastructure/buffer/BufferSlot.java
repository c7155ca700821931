package fr.lapetina.neuraforge.infrastructure.buffer;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * A fixed-capacity memory region owned by at most one batch at a time.
 *
 * <p>State changes are made by the owning {@link BufferPool} under its lock; the
 * volatile fields only give lock-free readers a consistent view.
 */
public final class BufferSlot {

    private final BufferPool pool;
    private final int index;
    private final ByteBuffer buffer;

    private volatile SlotState state = SlotState.FREE;
    private volatile long ownerBatchId = -1;
    private volatile long leaseCount;

    BufferSlot(BufferPool pool, int index, ByteBuffer buffer) {
        this.pool = pool;
        this.index = index;
        this.buffer = buffer;
    }

    public int getIndex() {
        return index;
    }

    public int capacity() {
        return buffer.capacity();
    }

    public SlotState getState() {
        return state;
    }

    public long getOwnerBatchId() {
        return ownerBatchId;
    }

    public long getLeaseCount() {
        return leaseCount;
    }

    /**
     * The slot's memory, cleared for writing. Only the current lessee may use it.
     */
    public ByteBuffer buffer() {
        if (state != SlotState.LEASED) {
            throw new IllegalStateException("Slot " + index + " is not leased");
        }
        return buffer.clear();
    }

    /**
     * Records the batch that will write into this slot.
     */
    public void assignOwner(long batchId) {
        this.ownerBatchId = batchId;
    }

    boolean belongsTo(BufferPool candidate) {
        return pool == candidate;
    }

    void lease() {
        state = SlotState.LEASED;
        leaseCount++;
    }

    void free() {
        wipe();
        ownerBatchId = -1;
        state = SlotState.FREE;
    }

    private void wipe() {
        buffer.clear();
        if (buffer.hasArray()) {
            Arrays.fill(buffer.array(), buffer.arrayOffset(), buffer.arrayOffset() + buffer.capacity(), (byte) 0);
            return;
        }
        int i = 0;
        for (; i + Long.BYTES <= buffer.capacity(); i += Long.BYTES) {
            buffer.putLong(i, 0L);
        }
        for (; i < buffer.capacity(); i++) {
            buffer.put(i, (byte) 0);
        }
    }

    @Override
    public String toString() {
        return "BufferSlot{" +
                "index=" + index +
                ", capacity=" + buffer.capacity() +
                ", state=" + state +
                ", owner=" + ownerBatchId +
                '}';
    }
}
