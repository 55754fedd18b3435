package express.mvp.retry;

import java.time.Duration;

/**
 * Thrown when a retriable failure occurs but the attempt budget is spent.
 *
 * <p>The budget is either the session's maximum attempt count or the backoff strategy's own retry
 * cap, whichever is reached first.
 */
public class MaxRetriesExceededException extends RetryException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception.
     *
     * @param message the detail message
     * @param cause the last observed failure
     * @param attempts attempts made
     * @param elapsed time spent in the session
     */
    public MaxRetriesExceededException(
            String message, Throwable cause, int attempts, Duration elapsed) {
        super(message, cause, attempts, elapsed);
    }
}
