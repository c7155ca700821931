package fr.lapetina.neuraforge.executor;

/**
 * Thrown by a {@link ModelExecutor} when a batch call or warm-up fails.
 * The message is delivered to every request of the failed batch.
 */
public class BackendException extends Exception {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
