package express.mvp.retry;

import java.time.Duration;

/** Thrown when the session's time budget is exhausted before the operation succeeded. */
public class RetryTimeoutException extends RetryException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception.
     *
     * @param message the detail message
     * @param cause the last observed failure (may be null)
     * @param attempts attempts made
     * @param elapsed time spent in the session
     */
    public RetryTimeoutException(String message, Throwable cause, int attempts, Duration elapsed) {
        super(message, cause, attempts, elapsed);
    }
}
