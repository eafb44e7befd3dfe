package app.augmenter.service;

/**
 * Fatal failure of an augmentation run. The run stops and nothing is written.
 */
public class AugmentException extends RuntimeException {

    private final AugmentError error;

    public AugmentException(AugmentError error, String message) {
        super(message);
        this.error = error;
    }

    public AugmentException(AugmentError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public AugmentError getError() {
        return error;
    }
}
