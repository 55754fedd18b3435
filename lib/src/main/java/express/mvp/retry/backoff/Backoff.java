package express.mvp.retry.backoff;

/**
 * Delay policy applied between retry attempts.
 *
 * <p>A backoff maps the number of the attempt that just failed to the time to wait before the next
 * attempt. Implementations may keep a cursor (see {@link FibonacciBackoff}), so a single instance
 * must never be shared by concurrently running sessions: each session works on its own
 * {@link #copy()}.
 *
 * <h2>Contract</h2>
 *
 * <ul>
 *   <li>{@link #nextDelayMillis(int)} never throws for a positive attempt number
 *   <li>Returned delays are non-negative; overflowing delays saturate at {@link Long#MAX_VALUE}
 *   <li>{@link #STOP} is returned once the strategy's own retry cap is exhausted
 *   <li>{@link #reset()} returns the instance to its freshly constructed state
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Backoff backoff = ExponentialBackoff.ofSeconds(0.1, 2.0, 5.0, 8);
 * backoff.reset();
 *
 * long delay = backoff.nextDelayMillis(attempt);
 * if (delay == Backoff.STOP) {
 *     // give up, policy exhausted
 * }
 * }</pre>
 *
 * @see ConstantBackoff
 * @see FibonacciBackoff
 * @see ExponentialBackoff
 */
public interface Backoff {

    /** Returned by {@link #nextDelayMillis(int)} when no further retries are allowed. */
    long STOP = -1L;

    /** Sentinel for "no retry cap". */
    int UNLIMITED = 0;

    /**
     * Returns the delay to apply after the given attempt failed.
     *
     * @param attempt the 1-based number of the attempt that just failed
     * @return delay in milliseconds, or {@link #STOP} when the retry cap is exhausted
     * @throws IllegalArgumentException if attempt is not positive
     */
    long nextDelayMillis(int attempt);

    /** Re-arms internal cursors. Called once at the start of every session. */
    void reset();

    /**
     * Returns the maximum number of retries this strategy allows.
     *
     * @return the retry cap, or {@link #UNLIMITED}
     */
    int getMaxRetries();

    /**
     * Returns a fresh instance with identical configuration and no accumulated state.
     *
     * @return an independent copy
     */
    Backoff copy();
}
