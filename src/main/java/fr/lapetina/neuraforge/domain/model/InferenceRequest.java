package fr.lapetina.neuraforge.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Represents an inference request to be batched and executed against a model.
 * Immutable and thread-safe; the payload is copied on the way in and on the way out.
 *
 * @param version pinned model version, or {@code null} for whichever version is currently Ready
 */
public record InferenceRequest(
        String requestId,
        String model,
        String version,
        byte[] payload,
        Instant createdAt,
        String correlationId
) {
    public InferenceRequest {
        Objects.requireNonNull(model, "Model is required");
        Objects.requireNonNull(payload, "Payload is required");
        if (model.isBlank()) {
            throw new IllegalArgumentException("Model name must not be blank");
        }
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (correlationId == null) {
            correlationId = requestId;
        }
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * Payload size in bytes, without copying.
     */
    public int payloadSize() {
        return payload.length;
    }

    /**
     * Creates a request against the currently Ready version of a model.
     */
    public static InferenceRequest of(String model, byte[] payload) {
        return new InferenceRequest(null, model, null, payload, null, null);
    }

    /**
     * Creates a request pinned to a specific model version.
     */
    public static InferenceRequest of(String model, String version, byte[] payload) {
        return new InferenceRequest(null, model, version, payload, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InferenceRequest that)) return false;
        return requestId.equals(that.requestId);
    }

    @Override
    public int hashCode() {
        return requestId.hashCode();
    }

    @Override
    public String toString() {
        return "InferenceRequest{" +
                "requestId='" + requestId + '\'' +
                ", model='" + model + '\'' +
                ", version=" + version +
                ", payloadBytes=" + payload.length +
                '}';
    }

    public static final class Builder {
        private String requestId;
        private String model;
        private String version;
        private byte[] payload;
        private Instant createdAt;
        private String correlationId;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public InferenceRequest build() {
            return new InferenceRequest(requestId, model, version, payload, createdAt, correlationId);
        }
    }
}
