package fr.lapetina.neuraforge.domain.batch;

/**
 * Why an Open batch was sealed.
 */
public enum SealReason {
    /** Reached max batch size */
    SIZE,

    /** Batch timeout elapsed since the first request */
    TIMEOUT,

    /** Batch timeout is zero: every request is its own batch */
    NO_BATCHING,

    /** Next request would not fit into one buffer slot */
    CAPACITY,

    /** Model handle left the Ready state */
    DRAIN,

    /** Explicit flush or scheduler shutdown */
    FLUSH
}
