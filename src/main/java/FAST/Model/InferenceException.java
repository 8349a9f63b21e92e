package FAST.Model;

/**
 * Base of the user-facing failures of an inference run.
 * A failed run never returns partial candidates.
 */
public class InferenceException extends RuntimeException {
    public InferenceException(String message) {
        super(message);
    }
}
