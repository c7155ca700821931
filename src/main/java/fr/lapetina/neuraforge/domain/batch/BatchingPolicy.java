package fr.lapetina.neuraforge.domain.batch;

import java.time.Duration;
import java.util.Objects;

/**
 * Sealing thresholds for the batch assembler.
 *
 * @param maxBatchSize seal as soon as a batch holds this many requests
 * @param batchTimeout seal this long after the first request arrived; zero disables batching
 */
public record BatchingPolicy(int maxBatchSize, Duration batchTimeout) {

    public BatchingPolicy {
        Objects.requireNonNull(batchTimeout, "Batch timeout is required");
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("Max batch size must be positive: " + maxBatchSize);
        }
        if (batchTimeout.isNegative()) {
            throw new IllegalArgumentException("Batch timeout must not be negative: " + batchTimeout);
        }
    }

    public static BatchingPolicy of(int maxBatchSize, long batchTimeoutMs) {
        return new BatchingPolicy(maxBatchSize, Duration.ofMillis(batchTimeoutMs));
    }

    /**
     * True when every request should be sealed into its own batch.
     */
    public boolean isBatchingDisabled() {
        return batchTimeout.isZero() || maxBatchSize == 1;
    }
}
