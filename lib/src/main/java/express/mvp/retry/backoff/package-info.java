/**
 * Backoff strategies deciding how long a retry session waits between attempts.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.retry.backoff.Backoff} - Strategy contract
 *   <li>{@link express.mvp.retry.backoff.ConstantBackoff} - Fixed delay
 *   <li>{@link express.mvp.retry.backoff.FibonacciBackoff} - Fibonacci-scaled delay
 *   <li>{@link express.mvp.retry.backoff.ExponentialBackoff} - Capped exponential delay
 * </ul>
 *
 * <p>Delays are expressed in milliseconds. Factory methods taking {@code double} seconds are
 * provided for callers that configure durations as fractional seconds.
 */
package express.mvp.retry.backoff;
