package fr.lapetina.neuraforge.executor;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Read-only view of a composed batch: the request payloads written back to back into a
 * leased buffer slot, plus the offset and length of each request's segment.
 *
 * <p>The view is only valid for the duration of {@link ModelExecutor#execute}; the slot is
 * wiped and reused once the batch is dispatched.
 */
public final class BatchInput {

    private final long batchId;
    private final ByteBuffer data;
    private final int[] offsets;
    private final int[] lengths;

    public BatchInput(long batchId, ByteBuffer data, int[] offsets, int[] lengths) {
        Objects.requireNonNull(data, "Data is required");
        if (offsets.length != lengths.length) {
            throw new IllegalArgumentException("Offsets and lengths differ in size");
        }
        this.batchId = batchId;
        this.data = data.asReadOnlyBuffer();
        this.offsets = offsets.clone();
        this.lengths = lengths.clone();
    }

    public long getBatchId() {
        return batchId;
    }

    /**
     * Number of requests in the batch.
     */
    public int size() {
        return offsets.length;
    }

    /**
     * Total bytes across all segments.
     */
    public int totalBytes() {
        return data.remaining();
    }

    /**
     * The whole composed input, positioned at the first segment.
     */
    public ByteBuffer data() {
        return data.duplicate();
    }

    public int offset(int position) {
        return offsets[position];
    }

    public int length(int position) {
        return lengths[position];
    }

    /**
     * The segment of the request at {@code position}.
     */
    public ByteBuffer segment(int position) {
        return data.slice(data.position() + offsets[position], lengths[position]);
    }

    /**
     * Copy of the segment of the request at {@code position}.
     */
    public byte[] segmentBytes(int position) {
        byte[] bytes = new byte[lengths[position]];
        segment(position).get(bytes);
        return bytes;
    }
}
