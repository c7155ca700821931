package fr.lapetina.neuraforge.executor;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

/**
 * Output of one batch call: a buffer and one segment per request, in batch order.
 */
public final class BatchOutput {

    private final ByteBuffer data;
    private final int[] offsets;
    private final int[] lengths;

    private BatchOutput(ByteBuffer data, int[] offsets, int[] lengths) {
        this.data = data;
        this.offsets = offsets;
        this.lengths = lengths;
    }

    /**
     * Wraps a backend-owned buffer. Segment bounds are relative to {@code data.position()}.
     *
     * @throws IllegalArgumentException if a segment falls outside the buffer
     */
    public static BatchOutput of(ByteBuffer data, int[] offsets, int[] lengths) {
        Objects.requireNonNull(data, "Data is required");
        if (offsets.length != lengths.length) {
            throw new IllegalArgumentException("Offsets and lengths differ in size");
        }
        ByteBuffer view = data.slice();
        for (int i = 0; i < offsets.length; i++) {
            if (offsets[i] < 0 || lengths[i] < 0 || offsets[i] + lengths[i] > view.limit()) {
                throw new IllegalArgumentException("Segment " + i + " out of bounds: offset="
                        + offsets[i] + ", length=" + lengths[i] + ", limit=" + view.limit());
            }
        }
        return new BatchOutput(view, offsets.clone(), lengths.clone());
    }

    /**
     * Lays out the given segments back to back.
     */
    public static BatchOutput ofSegments(List<byte[]> segments) {
        int total = 0;
        for (byte[] segment : segments) {
            total += segment.length;
        }
        ByteBuffer data = ByteBuffer.allocate(total);
        int[] offsets = new int[segments.size()];
        int[] lengths = new int[segments.size()];
        for (int i = 0; i < segments.size(); i++) {
            byte[] segment = segments.get(i);
            offsets[i] = data.position();
            lengths[i] = segment.length;
            data.put(segment);
        }
        data.flip();
        return new BatchOutput(data, offsets, lengths);
    }

    /**
     * Number of segments.
     */
    public int size() {
        return offsets.length;
    }

    /**
     * Copy of the segment at {@code position}.
     */
    public byte[] segmentBytes(int position) {
        byte[] bytes = new byte[lengths[position]];
        data.slice(offsets[position], lengths[position]).get(bytes);
        return bytes;
    }
}
