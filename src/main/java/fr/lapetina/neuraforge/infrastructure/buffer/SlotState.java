package fr.lapetina.neuraforge.infrastructure.buffer;

/**
 * Ownership state of a {@link BufferSlot}.
 */
public enum SlotState {
    FREE,
    LEASED
}
