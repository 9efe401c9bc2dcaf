package TableFill.Model;

/**
 * The computed partition is not compatible with the transition function, e.g. two members of one class move to
 * different classes on the same symbol.
 */
public class InvariantViolationException extends MinimizationException {
    public InvariantViolationException(String message) {
        super(message);
    }
}
