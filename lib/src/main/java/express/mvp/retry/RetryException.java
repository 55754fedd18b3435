package express.mvp.retry;

import java.time.Duration;

/**
 * Unchecked exception thrown when a retry session ends without producing a value.
 *
 * <p>Every terminal failure of a session surfaces as one of the subclasses below, so callers can
 * tell apart why the session gave up:
 *
 * <ul>
 *   <li>{@link NonRetriableException} - the failure was classified as fatal
 *   <li>{@link MaxRetriesExceededException} - the attempt budget ran out
 *   <li>{@link RetryTimeoutException} - the time budget ran out
 *   <li>{@link RetryCancelledException} - the caller asked the session to stop
 * </ul>
 *
 * <p>The cause is the last failure observed by the session, or {@code null} when the session ended
 * before any attempt failed.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try {
 *     return session.run(client::fetch);
 * } catch (MaxRetriesExceededException | RetryTimeoutException e) {
 *     alerting.budgetExhausted(e.getAttempts(), e.getElapsed(), e.getCause());
 *     throw e;
 * } catch (NonRetriableException e) {
 *     throw new IllegalStateException("fetch rejected", e.getCause());
 * }
 * }</pre>
 */
public class RetryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Attempts made before the session ended. */
    private final int attempts;

    /** Time spent in the session. */
    private final Duration elapsed;

    /**
     * Constructs a new retry exception.
     *
     * @param message the detail message
     * @param cause the last observed failure (may be null)
     * @param attempts attempts made before the session ended
     * @param elapsed time spent in the session
     */
    public RetryException(String message, Throwable cause, int attempts, Duration elapsed) {
        super(message, cause);
        this.attempts = attempts;
        this.elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    /**
     * Returns the number of attempts made.
     *
     * @return attempts, including the initial one
     */
    public int getAttempts() {
        return attempts;
    }

    /**
     * Returns the time spent in the session.
     *
     * @return elapsed duration
     */
    public Duration getElapsed() {
        return elapsed;
    }
}
