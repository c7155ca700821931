package fr.lapetina.neuraforge.infrastructure.buffer;

/**
 * Fixed set of reusable memory slots for batched inputs.
 *
 * <p>Exhaustion is the backpressure mechanism for workers: {@link #acquire(int)} blocks
 * until a slot comes back rather than allocating a new one.
 */
public interface BufferPool {

    /**
     * Leases a free slot of at least {@code sizeHint} bytes, blocking until one is available.
     *
     * @throws IllegalArgumentException if no slot of this pool can ever hold {@code sizeHint} bytes
     * @throws InterruptedException     if interrupted while waiting
     */
    BufferSlot acquire(int sizeHint) throws InterruptedException;

    /**
     * Returns a leased slot. Each lease is released exactly once.
     *
     * @throws IllegalStateException if the slot is not currently leased from this pool
     */
    void release(BufferSlot slot);

    /**
     * Number of free slots.
     */
    int available();

    /**
     * Total number of slots.
     */
    int size();

    /**
     * Capacity of each slot in bytes.
     */
    int slotCapacity();

    /**
     * Number of workers currently blocked in {@link #acquire(int)}.
     */
    int waiting();
}
