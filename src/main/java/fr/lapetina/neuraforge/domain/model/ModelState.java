package fr.lapetina.neuraforge.domain.model;

/**
 * Lifecycle state of a {@link ModelHandle}.
 */
public enum ModelState {
    /** Handle created, executor warming up */
    LOADING,

    /** Serving new requests */
    READY,

    /** Replaced or retired; finishing in-flight work, admitting nothing new */
    DRAINING,

    /** No in-flight work remains; executor released */
    UNLOADED
}
