package FAST.Model;

/**
 * A supplied automaton violates the acceptor contract: unreachable or dead states,
 * non-deterministic transitions, no accepting state, or an infinite language where a
 * finite one is required. Never repaired silently.
 */
public class InconsistentAutomatonException extends InferenceException {
    public InconsistentAutomatonException(String message) {
        super(message);
    }
}
