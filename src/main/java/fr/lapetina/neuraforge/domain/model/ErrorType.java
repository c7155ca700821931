package fr.lapetina.neuraforge.domain.model;

/**
 * Error taxonomy for inference requests.
 * Every non-successful {@link InferenceResult} carries exactly one of these.
 */
public enum ErrorType {
    /** Per-model admission limit reached, or the admission ring buffer is full */
    REJECTED_OVERLOAD,

    /** No Ready handle for the requested model name (and version, if pinned) */
    UNKNOWN_MODEL,

    /** Cancelled before its batch started executing */
    CANCELLED,

    /** The backend failed the batch call, or the worker hit an internal fault */
    BACKEND_FAILURE,

    /** Request cannot be served as submitted (payload too large, duplicate id) */
    INVALID_REQUEST,

    /** Scheduler is not accepting or has stopped processing work */
    SHUTDOWN
}
