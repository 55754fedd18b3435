/**
 * Retry engine: runs an operation until it succeeds, waiting between failed attempts according to
 * a backoff strategy and giving up on fatal failures, spent budgets or cancellation.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.retry.Retrier} - Entry point creating sessions
 *   <li>{@link express.mvp.retry.RetryConfig} - Immutable session configuration
 *   <li>{@link express.mvp.retry.RetryException} - Base of the terminal failure kinds
 * </ul>
 *
 * @see express.mvp.retry.backoff
 * @see express.mvp.retry.error
 * @see express.mvp.retry.session
 */
package express.mvp.retry;
