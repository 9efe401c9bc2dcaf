package TableFill.Model;

/**
 * Start state, accepting state or transition refers to something outside the automaton.
 * Raised while an {@link Automaton} is constructed, so no table work ever starts on malformed input.
 */
public class MalformedAutomatonException extends MinimizationException {
    public MalformedAutomatonException(String message) {
        super(message);
    }

    public MalformedAutomatonException(String message, Throwable cause) {
        super(message, cause);
    }
}
