package app.augmenter.service.generation;

/**
 * A single generation call failed. The note is skipped and stays pending.
 */
public class GenerationException extends Exception {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
