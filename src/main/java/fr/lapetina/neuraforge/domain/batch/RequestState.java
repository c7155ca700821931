package fr.lapetina.neuraforge.domain.batch;

/**
 * Lifecycle state of an admitted request.
 */
public enum RequestState {
    /** Waiting in an Open or Sealed batch */
    QUEUED,

    /** Claimed by a worker; no longer cancellable */
    EXECUTING,

    /** Result delivered */
    COMPLETED,

    /** Cancelled before execution */
    CANCELLED
}
