package fr.lapetina.neuraforge.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Terminal outcome of one inference request.
 * Immutable and thread-safe.
 *
 * <p>A successful result carries the output segment that corresponds to the request's
 * position in its batch. A failed result carries an {@link ErrorType} and a message;
 * batch fields are {@code -1} when the request never reached a batch.
 */
public record InferenceResult(
        String requestId,
        String model,
        String version,
        byte[] output,
        long batchId,
        int batchSize,
        int batchPosition,
        Instant createdAt,
        Instant completedAt,
        ErrorType errorType,
        String errorMessage
) {
    public InferenceResult {
        Objects.requireNonNull(requestId, "Request ID is required");
        if (completedAt == null) {
            completedAt = Instant.now();
        }
        output = output != null ? output.clone() : null;
    }

    @Override
    public byte[] output() {
        return output != null ? output.clone() : null;
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isError() {
        return errorType != null;
    }

    /**
     * Time from request creation to completion.
     */
    public Duration latency() {
        return createdAt != null ? Duration.between(createdAt, completedAt) : Duration.ZERO;
    }

    /**
     * Creates a successful result for a request at {@code batchPosition} of a batch.
     */
    public static InferenceResult success(
            InferenceRequest request,
            String version,
            byte[] output,
            long batchId,
            int batchSize,
            int batchPosition
    ) {
        return new InferenceResult(
                request.requestId(), request.model(), version, output,
                batchId, batchSize, batchPosition,
                request.createdAt(), Instant.now(), null, null
        );
    }

    /**
     * Creates an error result for a request that never reached a batch.
     */
    public static InferenceResult error(InferenceRequest request, ErrorType errorType, String errorMessage) {
        return error(request, request.version(), -1, -1, -1, errorType, errorMessage);
    }

    /**
     * Creates an error result for a request that was part of a batch.
     */
    public static InferenceResult error(
            InferenceRequest request,
            String version,
            long batchId,
            int batchSize,
            int batchPosition,
            ErrorType errorType,
            String errorMessage
    ) {
        return new InferenceResult(
                request.requestId(), request.model(), version, null,
                batchId, batchSize, batchPosition,
                request.createdAt(), Instant.now(), errorType, errorMessage
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InferenceResult that)) return false;
        return requestId.equals(that.requestId) && batchId == that.batchId && errorType == that.errorType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestId, batchId, errorType);
    }

    @Override
    public String toString() {
        return "InferenceResult{" +
                "requestId='" + requestId + '\'' +
                ", model='" + model + '\'' +
                ", version=" + version +
                ", batchId=" + batchId +
                ", position=" + batchPosition + "/" + batchSize +
                (errorType != null ? ", errorType=" + errorType + ", error='" + errorMessage + '\'' : "") +
                '}';
    }
}
