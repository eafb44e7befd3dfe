package app.augmenter.service.generation;

/**
 * Turns a filled prompt into generated text (lightweight Markdown).
 */
public interface GenerationService {

    String generate(String prompt) throws GenerationException;

    /**
     * Fails fast when the service cannot be used at all, before any call is dispatched.
     */
    default void ensureReady() {
    }
}
