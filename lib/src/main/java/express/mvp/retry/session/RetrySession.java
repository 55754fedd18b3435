package express.mvp.retry.session;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.retry.Operation;
import express.mvp.retry.ResultEvaluator;
import express.mvp.retry.RetryCancelledException;
import express.mvp.retry.RetryConfig;
import express.mvp.retry.RetryException;
import express.mvp.retry.Sleeper;
import express.mvp.retry.error.ClassificationLists;
import java.time.Duration;
import java.util.Objects;

/**
 * Synchronous retry session: runs a blocking operation on the calling thread until it succeeds or
 * the session gives up.
 *
 * <p>A session guards exactly one invocation. It owns a private copy of the configured backoff and
 * private counters, so independent sessions can run concurrently on separate threads.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetrySession session = retrier.createSession();
 * try {
 *     Response response = session.run(() -> client.send(request));
 * } catch (RetryTimeoutException e) {
 *     log.warn("gave up after " + e.getAttempts() + " attempts", e.getCause());
 * }
 * }</pre>
 *
 * <h2>Cancellation</h2>
 *
 * <p>The engine cannot interrupt an attempt it does not control. Interrupting the running thread
 * ends the session with {@link RetryCancelledException} once the interrupt is observed: during the
 * wait between attempts, or when the operation itself throws {@link InterruptedException}. The
 * thread's interrupt flag is restored in both cases.
 *
 * @see AsyncRetrySession
 * @see RetryStateMachine
 */
public final class RetrySession {

    private final RetryStateMachine machine;
    private final Sleeper sleeper;

    /**
     * Creates a session.
     *
     * @param config the retry configuration
     * @param lists the classification lists to consult
     */
    public RetrySession(RetryConfig config, ClassificationLists lists) {
        this(new RetryStateMachine(config, lists), config.sleeper());
    }

    RetrySession(RetryStateMachine machine, Sleeper sleeper) {
        this.machine = Objects.requireNonNull(machine, "machine");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Runs the operation until it succeeds or the session gives up.
     *
     * @param operation the operation to guard
     * @param <T> the result type
     * @return the value of the first successful attempt
     * @throws RetryException if the session ends without a value
     * @throws IllegalStateException if this session was already used
     */
    public <T> T run(Operation<T> operation) {
        return run(operation, null);
    }

    /**
     * Runs the operation, retrying values rejected by the result evaluator as well as failures.
     *
     * @param operation the operation to guard
     * @param evaluator result evaluator (may be null)
     * @param <T> the result type
     * @return the value of the first successful, accepted attempt
     * @throws RetryException if the session ends without a value
     * @throws IllegalStateException if this session was already used
     */
    public <T> T run(Operation<T> operation, ResultEvaluator<? super T> evaluator) {
        Objects.requireNonNull(operation, "operation");
        machine.start();

        while (true) {
            Throwable failure;
            try {
                T value = operation.call();
                failure = Results.evaluate(value, evaluator);
                if (failure == null) {
                    machine.succeed();
                    return value;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failure = e;
            } catch (Exception e) {
                failure = e;
            } catch (Error e) {
                machine.abandon(e);
                throw e;
            }

            RetryStep step;
            try {
                step = machine.fail(failure);
            } catch (Error e) {
                // Raised by the error evaluator or the listener
                machine.abandon(e);
                throw e;
            }
            if (step.isTerminal()) {
                throw step.exception();
            }

            await(step.delayMillis());

            step = machine.resume();
            if (step.isTerminal()) {
                throw step.exception();
            }
        }
    }

    private void await(long delayMillis) {
        if (delayMillis <= 0) {
            return;
        }
        try {
            sleeper.sleep(delayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw machine.cancel(e);
        }
    }

    /**
     * Returns the current state.
     *
     * @return the session state
     */
    public SessionState getState() {
        return machine.getState();
    }

    /**
     * Returns the number of attempts started.
     *
     * @return attempts so far
     */
    public int getAttempts() {
        return machine.getAttempts();
    }

    /**
     * Returns the most recent failure.
     *
     * @return the last failure, or null
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Throwable is exposed for diagnostics and cannot be safely copied.")
    public Throwable getLastFailure() {
        return machine.getLastFailure();
    }

    /**
     * Returns the time spent in the session.
     *
     * @return elapsed duration
     */
    public Duration getElapsed() {
        return machine.getElapsed();
    }

    @Override
    public String toString() {
        return "RetrySession[" + machine + "]";
    }
}
