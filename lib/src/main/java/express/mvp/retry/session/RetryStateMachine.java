package express.mvp.retry.session;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.retry.MaxRetriesExceededException;
import express.mvp.retry.NonRetriableException;
import express.mvp.retry.RetryCancelledException;
import express.mvp.retry.RetryConfig;
import express.mvp.retry.RetryException;
import express.mvp.retry.RetryListener;
import express.mvp.retry.RetryTimeoutException;
import express.mvp.retry.backoff.Backoff;
import express.mvp.retry.error.Classification;
import express.mvp.retry.error.ClassificationLists;
import express.mvp.retry.error.ErrorClassifier;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The attempt/timeout state machine shared by {@link RetrySession} and {@link AsyncRetrySession}.
 *
 * <p>The machine makes every decision of a session: whether a failure is retried, how long to
 * wait, and which exception ends the session. Drivers only carry out the returned
 * {@link RetryStep}s, blocking or scheduling as their concurrency model requires, so both session
 * variants share one transition table.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * INIT       → ATTEMPTING, CANCELLED
 * ATTEMPTING → SUCCEEDED, RETRYING, FAILED_TERMINAL, ATTEMPTS_EXHAUSTED, TIMED_OUT, CANCELLED
 * RETRYING   → ATTEMPTING, TIMED_OUT, CANCELLED
 * terminal   → (no transitions)
 * </pre>
 *
 * <h2>Decision Order After a Failure</h2>
 *
 * <ol>
 *   <li>Classify: cancellation ends as CANCELLED, STOP ends as FAILED_TERMINAL
 *   <li>Time budget spent: TIMED_OUT
 *   <li>Attempt budget spent: ATTEMPTS_EXHAUSTED
 *   <li>Backoff cap reached ({@link Backoff#STOP}): ATTEMPTS_EXHAUSTED
 *   <li>Otherwise notify the listener and wait; a delay longer than the remaining time budget is
 *       shortened to it
 * </ol>
 *
 * <p>The time budget is checked again when the wait ends, before the attempt counter moves, so no
 * attempt starts after the deadline.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is not thread-safe. A machine belongs to exactly one session and is driven by one
 * thread at a time; the state getters may be read from other threads.
 */
public final class RetryStateMachine {

    private static final Logger LOGGER = Logger.getLogger(RetryStateMachine.class.getName());

    private static final Set<SessionState> FROM_INIT =
            EnumSet.of(SessionState.ATTEMPTING, SessionState.CANCELLED);

    private static final Set<SessionState> FROM_ATTEMPTING =
            EnumSet.of(
                    SessionState.SUCCEEDED,
                    SessionState.RETRYING,
                    SessionState.FAILED_TERMINAL,
                    SessionState.ATTEMPTS_EXHAUSTED,
                    SessionState.TIMED_OUT,
                    SessionState.CANCELLED);

    private static final Set<SessionState> FROM_RETRYING =
            EnumSet.of(SessionState.ATTEMPTING, SessionState.TIMED_OUT, SessionState.CANCELLED);

    private final String operationName;
    private final Backoff backoff;
    private final ErrorClassifier classifier;
    private final RetryListener listener;
    private final int maxAttempts;
    private final long timeoutNanos;
    private final LongSupplier nanoClock;

    private volatile SessionState state = SessionState.INIT;
    private volatile int attempts;
    private volatile Throwable lastFailure;
    private long startNanos;
    private volatile long endNanos = -1;

    /**
     * Creates a machine for one session.
     *
     * @param config the retry configuration; its backoff is copied
     * @param lists the classification lists to consult
     */
    public RetryStateMachine(RetryConfig config, ClassificationLists lists) {
        this(config, lists, System::nanoTime);
    }

    RetryStateMachine(RetryConfig config, ClassificationLists lists, LongSupplier nanoClock) {
        Objects.requireNonNull(config, "config");
        this.operationName = config.operationName();
        this.backoff = config.backoff().copy();
        this.classifier = new ErrorClassifier(lists, config.errorEvaluator());
        this.listener = config.retryListener();
        this.maxAttempts = config.maxAttempts();
        this.timeoutNanos = saturatedNanos(config.timeout());
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    /**
     * Starts the session: resets the backoff, records the start time and enters the first attempt.
     *
     * @return a {@link RetryStep.Kind#PROCEED} step
     * @throws IllegalStateException if the session was already started
     */
    public RetryStep start() {
        if (state != SessionState.INIT) {
            throw new IllegalStateException(
                    "Retry session for " + operationName + " already started (" + state + ")");
        }
        backoff.reset();
        startNanos = nanoClock.getAsLong();
        attempts = 1;
        transition(SessionState.ATTEMPTING);
        return RetryStep.proceed();
    }

    /** Records that the current attempt produced an accepted value. */
    public void succeed() {
        requireState(SessionState.ATTEMPTING);
        transition(SessionState.SUCCEEDED);
        end();
    }

    /**
     * Records a failed attempt and decides what happens next.
     *
     * @param failure the failure raised by the attempt
     * @return a WAIT step, or a TERMINATE step carrying the exception to report
     */
    public RetryStep fail(Throwable failure) {
        Objects.requireNonNull(failure, "failure");
        requireState(SessionState.ATTEMPTING);
        lastFailure = failure;

        Classification classification = classifier.classify(failure);

        if (classification.isCancellation()) {
            return terminate(
                    SessionState.CANCELLED,
                    new RetryCancelledException(
                            operationName + " cancelled", failure, attempts, getElapsed()));
        }

        if (!classification.isRetry()) {
            String message = classification.isEscalated()
                    ? operationName + " failed: error evaluator rejected "
                            + failure.getClass().getName()
                    : operationName + " failed with non-retriable "
                            + failure.getClass().getName();
            return terminate(
                    SessionState.FAILED_TERMINAL,
                    new NonRetriableException(
                            message, classification.failure(), attempts, getElapsed()));
        }

        if (isTimedOut()) {
            return timedOut();
        }

        if (maxAttempts != RetryConfig.UNLIMITED_ATTEMPTS && attempts >= maxAttempts) {
            return terminate(
                    SessionState.ATTEMPTS_EXHAUSTED,
                    new MaxRetriesExceededException(
                            operationName + " failed after " + attempts + " attempts",
                            failure,
                            attempts,
                            getElapsed()));
        }

        long delay = backoff.nextDelayMillis(attempts);
        if (delay == Backoff.STOP) {
            return terminate(
                    SessionState.ATTEMPTS_EXHAUSTED,
                    new MaxRetriesExceededException(
                            operationName + " exhausted backoff retries after "
                                    + attempts + " attempts",
                            failure,
                            attempts,
                            getElapsed()));
        }

        notifyListener(failure, delay);

        long wait = clipToDeadline(delay);
        transition(SessionState.RETRYING);

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format(
                    "%s attempt %d failed (%s), retrying in %dms",
                    operationName, attempts, failure, wait));
        }
        return RetryStep.waitFor(wait);
    }

    /**
     * Ends the wait between attempts and enters the next attempt.
     *
     * @return a PROCEED step, or a TERMINATE step if the time budget ran out during the wait
     */
    public RetryStep resume() {
        requireState(SessionState.RETRYING);
        if (isTimedOut()) {
            return timedOut();
        }
        attempts++;
        transition(SessionState.ATTEMPTING);
        return RetryStep.proceed();
    }

    /**
     * Aborts the session on request of its caller.
     *
     * @param cause the cancellation signal (may be null)
     * @return the exception to report, or null if the session had already ended
     */
    public RetryCancelledException cancel(Throwable cause) {
        if (state.isTerminal()) {
            return null;
        }
        Throwable reported = cause != null ? cause : lastFailure;
        RetryCancelledException exception =
                new RetryCancelledException(
                        operationName + " cancelled", reported, attempts, getElapsed());
        transition(SessionState.CANCELLED);
        end();
        return exception;
    }

    /**
     * Ends the session because the attempt raised a JVM {@link Error}. The error is not classified.
     *
     * @param error the error that escaped the attempt
     */
    public void abandon(Error error) {
        if (state.isTerminal()) {
            return;
        }
        lastFailure = error;
        state = SessionState.FAILED_TERMINAL;
        end();
        LOGGER.log(Level.FINE, operationName + " abandoned after error", error);
    }

    private RetryStep timedOut() {
        return terminate(
                SessionState.TIMED_OUT,
                new RetryTimeoutException(
                        operationName + " exceeded timeout of " + timeoutNanos / 1_000_000 + "ms",
                        lastFailure,
                        attempts,
                        getElapsed()));
    }

    private RetryStep terminate(SessionState terminal, RetryException exception) {
        transition(terminal);
        end();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(operationName + " ended " + terminal + " after " + attempts + " attempts");
        }
        return RetryStep.terminate(exception);
    }

    private boolean isTimedOut() {
        return timeoutNanos > 0 && nanoClock.getAsLong() - startNanos >= timeoutNanos;
    }

    private long clipToDeadline(long delayMillis) {
        if (timeoutNanos <= 0) {
            return delayMillis;
        }
        long remainingNanos = timeoutNanos - (nanoClock.getAsLong() - startNanos);
        if (remainingNanos <= 0) {
            return 0;
        }
        long remainingMillis =
                remainingNanos / 1_000_000 + (remainingNanos % 1_000_000 == 0 ? 0 : 1);
        return Math.min(delayMillis, remainingMillis);
    }

    private static long saturatedNanos(Duration timeout) {
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private void notifyListener(Throwable failure, long delayMillis) {
        if (listener == null) {
            return;
        }
        try {
            listener.onRetry(failure, delayMillis);
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "Retry listener failed for " + operationName, e);
        }
    }

    private void requireState(SessionState expected) {
        if (state != expected) {
            throw new IllegalStateException(
                    "Retry session for " + operationName + " is " + state + ", expected " + expected);
        }
    }

    private void transition(SessionState next) {
        SessionState current = state;
        if (!isValidTransition(current, next)) {
            throw new IllegalStateException(
                    "Invalid retry session transition " + current + " -> " + next);
        }
        state = next;
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer(operationName + ": " + current + " -> " + next);
        }
    }

    private void end() {
        endNanos = nanoClock.getAsLong();
    }

    /**
     * Checks if a transition from one state to another is valid.
     *
     * @param from the source state
     * @param to the target state
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(SessionState from, SessionState to) {
        if (from == to) {
            return false;
        }
        return switch (from) {
            case INIT -> FROM_INIT.contains(to);
            case ATTEMPTING -> FROM_ATTEMPTING.contains(to);
            case RETRYING -> FROM_RETRYING.contains(to);
            case SUCCEEDED, FAILED_TERMINAL, ATTEMPTS_EXHAUSTED, TIMED_OUT, CANCELLED -> false;
        };
    }

    /**
     * Returns the current state.
     *
     * @return the state
     */
    public SessionState getState() {
        return state;
    }

    /**
     * Returns the number of attempts started so far.
     *
     * @return attempts, 0 before {@link #start()}
     */
    public int getAttempts() {
        return attempts;
    }

    /**
     * Returns the most recent failure.
     *
     * @return the last failure, or null if no attempt has failed
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Throwable is exposed for diagnostics and cannot be safely copied.")
    public Throwable getLastFailure() {
        return lastFailure;
    }

    /**
     * Returns the time spent in the session; frozen once the session ends.
     *
     * @return elapsed duration, zero before {@link #start()}
     */
    public Duration getElapsed() {
        if (state == SessionState.INIT) {
            return Duration.ZERO;
        }
        long end = endNanos;
        return Duration.ofNanos((end >= 0 ? end : nanoClock.getAsLong()) - startNanos);
    }

    /**
     * Returns the operation label.
     *
     * @return the name
     */
    public String getOperationName() {
        return operationName;
    }

    @Override
    public String toString() {
        return String.format(
                "RetryStateMachine[op=%s, state=%s, attempt=%d/%s, elapsed=%dms]",
                operationName,
                state,
                attempts,
                maxAttempts == RetryConfig.UNLIMITED_ATTEMPTS ? "∞" : String.valueOf(maxAttempts),
                getElapsed().toMillis());
    }
}
