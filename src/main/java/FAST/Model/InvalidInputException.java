package FAST.Model;

/**
 * Empty sample, or examples using symbols outside of the declared alphabet.
 */
public class InvalidInputException extends InferenceException {
    public InvalidInputException(String message) {
        super(message);
    }
}
