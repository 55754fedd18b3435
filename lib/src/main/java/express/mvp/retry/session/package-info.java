/**
 * Retry sessions: the shared attempt/timeout state machine and its blocking and asynchronous
 * drivers.
 *
 * <p>{@link express.mvp.retry.session.RetryStateMachine} decides; {@link
 * express.mvp.retry.session.RetrySession} and {@link express.mvp.retry.session.AsyncRetrySession}
 * carry out its steps on the calling thread or on a {@link
 * express.mvp.retry.session.RetryScheduler}.
 */
package express.mvp.retry.session;
