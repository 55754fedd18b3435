package express.mvp.retry;

import express.mvp.retry.error.ClassificationLists;
import express.mvp.retry.session.AsyncRetrySession;
import express.mvp.retry.session.CancellationToken;
import express.mvp.retry.session.RetryScheduler;
import express.mvp.retry.session.RetrySession;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the retry engine: holds a configuration and hands out single-use sessions.
 *
 * <p>A retrier is immutable and may be shared. Each {@code run} call creates a fresh session, so
 * concurrent calls never share counters or backoff state.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Retrier retrier = new Retrier(RetryConfig.builder()
 *     .backoff(ExponentialBackoff.defaults())
 *     .timeoutSeconds(30)
 *     .operationName("inventory-lookup")
 *     .build());
 *
 * Stock stock = retrier.run(() -> inventory.lookup(sku));
 * }</pre>
 *
 * <h2>Failure Kinds</h2>
 *
 * <ul>
 *   <li>{@link NonRetriableException} - a failure was classified as fatal
 *   <li>{@link MaxRetriesExceededException} - attempt budget or backoff cap spent
 *   <li>{@link RetryTimeoutException} - time budget spent
 *   <li>{@link RetryCancelledException} - the caller aborted the session
 * </ul>
 */
public final class Retrier {

    private final RetryConfig config;
    private final ClassificationLists lists;

    /**
     * Creates a retrier that consults the process-wide classification lists.
     *
     * @param config the retry configuration
     */
    public Retrier(RetryConfig config) {
        this(config, ClassificationLists.global());
    }

    /**
     * Creates a retrier with its own classification lists.
     *
     * @param config the retry configuration
     * @param lists the classification lists to consult
     */
    public Retrier(RetryConfig config, ClassificationLists lists) {
        this.config = Objects.requireNonNull(config, "config");
        this.lists = Objects.requireNonNull(lists, "lists");
    }

    /**
     * Creates a synchronous session.
     *
     * @return a new session
     */
    public RetrySession createSession() {
        return new RetrySession(config, lists);
    }

    /**
     * Creates an asynchronous session driven by the given scheduler.
     *
     * @param scheduler the scheduler
     * @return a new session
     */
    public AsyncRetrySession createAsyncSession(RetryScheduler scheduler) {
        return new AsyncRetrySession(config, lists, scheduler);
    }

    /**
     * Runs the operation in a new synchronous session.
     *
     * @param operation the operation to guard
     * @param <T> the result type
     * @return the first successful value
     * @throws RetryException if the session ends without a value
     */
    public <T> T run(Operation<T> operation) {
        return createSession().run(operation);
    }

    /**
     * Runs the operation in a new synchronous session, also retrying rejected values.
     *
     * @param operation the operation to guard
     * @param evaluator decides whether a value must be retried
     * @param <T> the result type
     * @return the first accepted value
     * @throws RetryException if the session ends without a value
     */
    public <T> T run(Operation<T> operation, ResultEvaluator<? super T> evaluator) {
        return createSession().run(operation, evaluator);
    }

    /**
     * Runs the operation in a new asynchronous session.
     *
     * @param scheduler the scheduler driving the session
     * @param operation the operation to guard
     * @param <T> the result type
     * @return a future of the first successful value
     */
    public <T> CompletableFuture<T> runAsync(RetryScheduler scheduler, AsyncOperation<T> operation) {
        return createAsyncSession(scheduler).runAsync(operation);
    }

    /**
     * Runs the operation in a new asynchronous session that the token can abort.
     *
     * @param scheduler the scheduler driving the session
     * @param operation the operation to guard
     * @param token the cancellation token
     * @param <T> the result type
     * @return a future of the first successful value
     */
    public <T> CompletableFuture<T> runAsync(
            RetryScheduler scheduler, AsyncOperation<T> operation, CancellationToken token) {
        return createAsyncSession(scheduler).runAsync(operation, token);
    }

    /**
     * Returns the configuration.
     *
     * @return the configuration
     */
    public RetryConfig getConfig() {
        return config;
    }

    /**
     * Returns the classification lists consulted by this retrier's sessions.
     *
     * @return the lists
     */
    public ClassificationLists getLists() {
        return lists;
    }

    @Override
    public String toString() {
        return "Retrier[" + config + "]";
    }
}
