package fr.lapetina.neuraforge.domain.event;

/**
 * Kinds of event the batch assembler consumes from the ring buffer.
 */
public enum SchedulerEventType {
    /** Admitted request to place into its model's open batch */
    SUBMIT,

    /** Batch timer fired; seal the batch if it is still the open one */
    SEAL_TIMEOUT,

    /** Request was cancelled while queued; take it out of its open batch */
    CANCEL,

    /** Model handle left Ready; seal its open batch now */
    DRAIN,

    /** Seal every open batch */
    FLUSH
}
