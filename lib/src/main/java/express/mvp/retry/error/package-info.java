/**
 * Failure classification for retry sessions.
 *
 * <p>This package decides, per failed attempt, whether the session should try again.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.retry.error.ErrorClassifier} - Applies lists and evaluator in order
 *   <li>{@link express.mvp.retry.error.ClassificationLists} - Whitelist/blacklist of failure kinds
 *   <li>{@link express.mvp.retry.error.ErrorEvaluator} - Custom per-failure decision
 *   <li>{@link express.mvp.retry.error.RetryDecision} - RETRY or STOP
 *   <li>{@link express.mvp.retry.error.PermanentFailureException} - Base type for fatal failures
 * </ul>
 *
 * <p>Whitelisted failures always stop, even if blacklisted too. Failures on neither list are
 * retried unless a custom evaluator says otherwise.
 */
package express.mvp.retry.error;
