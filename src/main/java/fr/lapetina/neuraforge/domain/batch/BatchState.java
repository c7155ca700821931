package fr.lapetina.neuraforge.domain.batch;

/**
 * Lifecycle state of a {@link Batch}.
 */
public enum BatchState {
    /** Accepting requests on the assembler thread */
    OPEN,

    /** Closed to new requests, waiting in the ready queue */
    SEALED,

    /** Backend call in progress */
    EXECUTING,

    /** Results dispatched */
    COMPLETED,

    /** Backend or worker failure dispatched to every request */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
