package express.mvp.retry;

import java.time.Duration;

/**
 * Thrown when a session is aborted on request of its caller.
 *
 * <p>Asynchronous sessions raise it when their {@code CancellationToken} fires or their result
 * future is cancelled. Synchronous sessions raise it when the running thread is interrupted, after
 * restoring the thread's interrupt flag. Cancellation is never retried.
 */
public class RetryCancelledException extends RetryException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception.
     *
     * @param message the detail message
     * @param cause the cancellation signal or last observed failure (may be null)
     * @param attempts attempts made
     * @param elapsed time spent in the session
     */
    public RetryCancelledException(String message, Throwable cause, int attempts, Duration elapsed) {
        super(message, cause, attempts, elapsed);
    }
}
