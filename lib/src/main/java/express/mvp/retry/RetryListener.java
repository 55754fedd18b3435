package express.mvp.retry;

/**
 * Observer notified before every wait between attempts.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryConfig config = RetryConfig.builder()
 *     .retryListener((failure, delayMillis) ->
 *         logger.info("retrying in " + delayMillis + "ms after " + failure))
 *     .build();
 * }</pre>
 *
 * <p>The callback runs synchronously on the session's thread (the scheduler thread for
 * asynchronous sessions) and should return quickly. Exceptions thrown by the listener are logged
 * and do not affect the session.
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * Called after a retriable failure, before the session waits.
     *
     * @param failure the failure that triggered the retry
     * @param delayMillis the delay about to be applied
     */
    void onRetry(Throwable failure, long delayMillis);
}
