package fr.lapetina.neuraforge.infrastructure.registry;

/**
 * Thrown when a model version cannot be loaded, swapped in or retired.
 */
public class ModelLoadException extends RuntimeException {

    private final String model;

    public ModelLoadException(String model, String message) {
        super(message);
        this.model = model;
    }

    public ModelLoadException(String model, String message, Throwable cause) {
        super(message, cause);
        this.model = model;
    }

    public String getModel() {
        return model;
    }
}
