package express.mvp.retry.session;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.retry.AsyncOperation;
import express.mvp.retry.ResultEvaluator;
import express.mvp.retry.RetryCancelledException;
import express.mvp.retry.RetryConfig;
import express.mvp.retry.RetryException;
import express.mvp.retry.error.ClassificationLists;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Asynchronous retry session: drives an operation that returns a {@link CompletionStage} on a
 * {@link RetryScheduler}, without blocking any thread while attempts run or while waiting between
 * them.
 *
 * <p>The session uses the same {@link RetryStateMachine} as {@link RetrySession}; only the two
 * suspension points differ. The attempt is awaited by completion callback and the wait is a
 * scheduler timer.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CancellationToken token = new CancellationToken();
 * CompletableFuture<Quote> quote =
 *     retrier.createAsyncSession(scheduler).runAsync(() -> pricing.quoteAsync(sku), token);
 *
 * quote.whenComplete((q, error) -> {
 *     if (error instanceof RetryCancelledException) {
 *         // aborted by token.cancel() or quote.cancel(true)
 *     }
 * });
 * }</pre>
 *
 * <h2>Cancellation</h2>
 *
 * <p>A session is aborted by cancelling its {@link CancellationToken} or by cancelling the returned
 * future. The abort takes effect on the next scheduler tick: a pending wait is dropped, an
 * in-flight attempt is cancelled when its stage is a {@link Future}, and the operation is not
 * invoked again. The returned future completes with {@link RetryCancelledException} (or stays
 * cancelled if the caller cancelled it). Shutting down the {@link RetryScheduler} aborts the
 * session the same way.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>A session runs once. State changes happen on the scheduler thread, except the abort applied
 * when the scheduler shuts down, which runs on the thread shutting it down. The getters may be
 * read from any thread.
 */
public final class AsyncRetrySession {

    private static final Logger LOGGER = Logger.getLogger(AsyncRetrySession.class.getName());

    private final RetryStateMachine machine;
    private final RetryScheduler scheduler;
    private final AtomicBoolean used = new AtomicBoolean(false);

    /**
     * Creates a session.
     *
     * @param config the retry configuration
     * @param lists the classification lists to consult
     * @param scheduler the scheduler driving the session
     */
    public AsyncRetrySession(RetryConfig config, ClassificationLists lists, RetryScheduler scheduler) {
        this(new RetryStateMachine(config, lists), scheduler);
    }

    AsyncRetrySession(RetryStateMachine machine, RetryScheduler scheduler) {
        this.machine = Objects.requireNonNull(machine, "machine");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Runs the operation until it succeeds or the session gives up.
     *
     * @param operation the operation to guard
     * @param <T> the result type
     * @return a future completed with the first successful value or a {@link RetryException}
     * @throws IllegalStateException if this session was already used
     */
    public <T> CompletableFuture<T> runAsync(AsyncOperation<T> operation) {
        return runAsync(operation, null, null);
    }

    /**
     * Runs the operation with a caller-held cancellation handle.
     *
     * @param operation the operation to guard
     * @param token the cancellation token (may be null)
     * @param <T> the result type
     * @return a future completed with the first successful value or a {@link RetryException}
     * @throws IllegalStateException if this session was already used
     */
    public <T> CompletableFuture<T> runAsync(AsyncOperation<T> operation, CancellationToken token) {
        return runAsync(operation, null, token);
    }

    /**
     * Runs the operation, retrying values rejected by the result evaluator as well as failures.
     *
     * @param operation the operation to guard
     * @param evaluator result evaluator (may be null)
     * @param token the cancellation token (may be null)
     * @param <T> the result type
     * @return a future completed with the first successful value or a {@link RetryException}
     * @throws IllegalStateException if this session was already used
     */
    public <T> CompletableFuture<T> runAsync(
            AsyncOperation<T> operation,
            ResultEvaluator<? super T> evaluator,
            CancellationToken token) {
        Objects.requireNonNull(operation, "operation");
        if (!used.compareAndSet(false, true)) {
            throw new IllegalStateException(
                    "Retry session for " + machine.getOperationName() + " already started");
        }

        Run<T> run = new Run<>(operation, evaluator);
        Runnable unhost = scheduler.host(run::shutDown);
        Runnable unlisten = token == null
                ? () -> {}
                : token.onCancel(() -> run.abort(new CancellationException("Token cancelled")));
        run.result.whenComplete((value, error) -> {
            unhost.run();
            unlisten.run();
            if (run.result.isCancelled()) {
                run.abort(new CancellationException("Result future cancelled"));
            }
        });
        run.dispatch(run::begin);
        return run.result;
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
        return "AsyncRetrySession[" + machine + "]";
    }

    /**
     * One execution of the session. Steps run on the scheduler; {@link #abort} may be called from
     * any thread and {@link #shutDown} also runs on the thread that shuts the scheduler down, so
     * both hold the run's lock while they touch the machine.
     */
    private final class Run<T> {

        final CompletableFuture<T> result = new CompletableFuture<>();
        private final AsyncOperation<T> operation;
        private final ResultEvaluator<? super T> evaluator;

        private volatile Future<?> pendingWait;
        private volatile CompletionStage<T> pendingAttempt;

        Run(AsyncOperation<T> operation, ResultEvaluator<? super T> evaluator) {
            this.operation = operation;
            this.evaluator = evaluator;
        }

        void begin() {
            if (result.isDone()) {
                return;
            }
            machine.start();
            attempt();
        }

        private void attempt() {
            if (result.isDone()) {
                return;
            }
            CompletionStage<T> stage;
            try {
                stage = operation.call();
                if (stage == null) {
                    throw new NullPointerException(
                            machine.getOperationName() + " returned a null CompletionStage");
                }
            } catch (Exception e) {
                onFailure(e);
                return;
            } catch (Error e) {
                onError(e);
                return;
            }
            CompletionStage<T> inFlight = stage;
            pendingAttempt = inFlight;
            inFlight.whenComplete((value, error) -> dispatch(() -> onOutcome(inFlight, value, error)));
        }

        private void onOutcome(CompletionStage<T> stage, T value, Throwable error) {
            if (pendingAttempt != stage || machine.getState() != SessionState.ATTEMPTING) {
                return;
            }
            pendingAttempt = null;
            if (error != null) {
                Throwable failure = Results.unwrap(error);
                if (failure instanceof Error) {
                    onError((Error) failure);
                } else {
                    onFailure(failure);
                }
                return;
            }
            Throwable rejected = Results.evaluate(value, evaluator);
            if (rejected != null) {
                onFailure(rejected);
                return;
            }
            machine.succeed();
            result.complete(value);
        }

        private void onFailure(Throwable failure) {
            RetryStep step = machine.fail(failure);
            if (step.isTerminal()) {
                result.completeExceptionally(step.exception());
                return;
            }
            try {
                pendingWait = scheduler.schedule(this::resume, step.delayMillis());
            } catch (RejectedExecutionException e) {
                shutDown(e);
            }
        }

        private void onError(Error error) {
            machine.abandon(error);
            result.completeExceptionally(error);
        }

        private void resume() {
            pendingWait = null;
            if (result.isDone()) {
                return;
            }
            RetryStep step = machine.resume();
            if (step.isTerminal()) {
                result.completeExceptionally(step.exception());
                return;
            }
            attempt();
        }

        /** Requests cancellation; safe to call from any thread. */
        void abort(Throwable cause) {
            dispatch(() -> {
                RetryCancelledException cancelled = machine.cancel(cause);
                if (cancelled == null) {
                    return;
                }
                LOGGER.fine(() -> machine.getOperationName() + " aborted: " + cause.getMessage());
                cancelPending();
                result.completeExceptionally(cancelled);
            });
        }

        private void cancelPending() {
            Future<?> wait = pendingWait;
            if (wait != null) {
                wait.cancel(false);
                pendingWait = null;
            }
            CompletionStage<T> inFlight = pendingAttempt;
            if (inFlight instanceof Future) {
                ((Future<?>) inFlight).cancel(true);
            }
            pendingAttempt = null;
        }

        void dispatch(Runnable step) {
            try {
                scheduler.execute(() -> guarded(step));
            } catch (RejectedExecutionException e) {
                shutDown(e);
            }
        }

        private synchronized void guarded(Runnable step) {
            try {
                step.run();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Retry session step failed for "
                        + machine.getOperationName(), e);
                result.completeExceptionally(e);
            } catch (Error e) {
                onError(e);
            }
        }

        /** The scheduler refused work, so the session can make no further progress. */
        private synchronized void shutDown(RejectedExecutionException e) {
            RetryCancelledException cancelled = machine.cancel(e);
            if (cancelled != null) {
                // Complete first; cancelling the stage re-enters here via a rejected dispatch
                result.completeExceptionally(cancelled);
                cancelPending();
            } else if (!result.isDone()) {
                result.completeExceptionally(e);
            }
        }
    }
}
