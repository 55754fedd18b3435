package express.mvp.retry;

import java.time.Duration;

/**
 * Thrown when a failure was classified as not worth retrying.
 *
 * <p>The cause is the operation's failure, or, when the configured error evaluator itself failed,
 * the evaluator's exception with the operation's failure attached as suppressed.
 */
public class NonRetriableException extends RetryException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception.
     *
     * @param message the detail message
     * @param cause the failure that stopped the session
     * @param attempts attempts made
     * @param elapsed time spent in the session
     */
    public NonRetriableException(String message, Throwable cause, int attempts, Duration elapsed) {
        super(message, cause, attempts, elapsed);
    }
}
