package TableFill.Model;

/**
 * Root of the errors a minimization run can end with. None of them is recoverable: the computation is
 * deterministic, so repeating it with the same input reproduces the same failure.
 */
public abstract class MinimizationException extends RuntimeException {
    protected MinimizationException(String message) {
        super(message);
    }

    protected MinimizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
