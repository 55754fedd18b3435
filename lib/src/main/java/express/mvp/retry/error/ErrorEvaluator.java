package express.mvp.retry.error;

/**
 * Custom retry decision for failures that are on neither classification list.
 *
 * <p>Returning true retries the failure, false stops the session. Throwing is treated as a
 * stronger stop: the thrown exception replaces the original failure and is reported to the caller.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ErrorEvaluator onlyServerErrors = failure ->
 *     failure instanceof HttpStatusException e && e.status() >= 500;
 * }</pre>
 */
@FunctionalInterface
public interface ErrorEvaluator {

    /**
     * Decides whether the failure should be retried.
     *
     * @param failure the failure raised by the attempt
     * @return true to retry
     * @throws Exception to stop the session with this exception instead
     */
    boolean shouldRetry(Throwable failure) throws Exception;
}
