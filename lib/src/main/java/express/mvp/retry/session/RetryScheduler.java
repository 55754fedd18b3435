package express.mvp.retry.session;

import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded scheduler that drives {@link AsyncRetrySession}s.
 *
 * <p>Every state change of every hosted session runs on the one scheduler thread, so sessions are
 * interleaved cooperatively. Waits between attempts are timer tasks, not
 * sleeping threads: thousands of sessions waiting for their next attempt cost no threads.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * caller ──runAsync──► [ task queue ] ──► scheduler thread ──► operation.call()
 *                            ▲                                      │
 *                            │                             CompletionStage completes
 *                            └──── resume after delay ◄──── classify / backoff
 * </pre>
 *
 * <p>The guarded operation is invoked on the scheduler thread and must not block: it should start
 * its work and return a {@link java.util.concurrent.CompletionStage} at once.
 *
 * <p>Shutting the scheduler down aborts every session it still hosts, including sessions parked
 * on a wait timer, so their futures complete with
 * {@link express.mvp.retry.RetryCancelledException}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (RetryScheduler scheduler = RetryScheduler.create("http-retry")) {
 *     AsyncRetrySession session = retrier.createAsyncSession(scheduler);
 *     String body = session.runAsync(() -> client.getAsync(url)).join();
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe. Tasks may be submitted from any thread.
 */
public final class RetryScheduler implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(RetryScheduler.class.getName());

    private final ScheduledThreadPoolExecutor executor;
    private final SchedulerThreadFactory threadFactory;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final Set<Consumer<RejectedExecutionException>> hosted = ConcurrentHashMap.newKeySet();

    private final AtomicLong submittedTasks = new AtomicLong(0);
    private final AtomicLong completedTasks = new AtomicLong(0);
    private final AtomicLong failedTasks = new AtomicLong(0);
    private final AtomicLong rejectedTasks = new AtomicLong(0);

    private RetryScheduler(SchedulerThreadFactory threadFactory) {
        this.threadFactory = threadFactory;
        this.executor = new ScheduledThreadPoolExecutor(1, threadFactory);
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    /**
     * Creates a new builder for configuring the scheduler.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a scheduler with default settings.
     *
     * @return a new scheduler
     */
    public static RetryScheduler create() {
        return builder().build();
    }

    /**
     * Creates a scheduler with the given thread name prefix.
     *
     * @param namePrefix the prefix for the scheduler thread name
     * @return a new scheduler
     */
    public static RetryScheduler create(String namePrefix) {
        return builder().namePrefix(namePrefix).build();
    }

    /**
     * Runs a task on the scheduler thread as soon as possible.
     *
     * @param task the task to run
     * @throws RejectedExecutionException if the scheduler has been shut down
     */
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        checkOpen();
        submittedTasks.incrementAndGet();
        try {
            executor.execute(track(task));
        } catch (RejectedExecutionException e) {
            submittedTasks.decrementAndGet();
            rejectedTasks.incrementAndGet();
            throw e;
        }
    }

    /**
     * Runs a task on the scheduler thread after a delay.
     *
     * @param task the task to run
     * @param delayMillis the delay in milliseconds; zero or less runs the task as soon as possible
     * @return a future that cancels the pending task
     * @throws RejectedExecutionException if the scheduler has been shut down
     */
    public ScheduledFuture<?> schedule(Runnable task, long delayMillis) {
        Objects.requireNonNull(task, "task must not be null");
        checkOpen();
        submittedTasks.incrementAndGet();
        try {
            return executor.schedule(track(task), Math.max(0, delayMillis), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            submittedTasks.decrementAndGet();
            rejectedTasks.incrementAndGet();
            throw e;
        }
    }

    private void checkOpen() {
        if (shutdown.get()) {
            rejectedTasks.incrementAndGet();
            throw new RejectedExecutionException("RetryScheduler has been shut down");
        }
    }

    private Runnable track(Runnable task) {
        return () -> {
            try {
                task.run();
                completedTasks.incrementAndGet();
            } catch (RuntimeException e) {
                failedTasks.incrementAndGet();
                LOGGER.log(Level.WARNING, "Retry scheduler task failed", e);
            }
        };
    }

    /**
     * Registers a live session to be aborted when the scheduler shuts down.
     *
     * @param onShutdown receives the shutdown reason on the thread that shuts the scheduler down
     * @return a handle that deregisters the session once it has completed
     */
    Runnable host(Consumer<RejectedExecutionException> onShutdown) {
        hosted.add(onShutdown);
        if (shutdown.get()) {
            // The session's first dispatch is rejected and ends it
            hosted.remove(onShutdown);
            return () -> {};
        }
        return () -> hosted.remove(onShutdown);
    }

    private void abortHosted() {
        Iterator<Consumer<RejectedExecutionException>> it = hosted.iterator();
        while (it.hasNext()) {
            Consumer<RejectedExecutionException> onShutdown = it.next();
            it.remove();
            try {
                onShutdown.accept(
                        new RejectedExecutionException("RetryScheduler has been shut down"));
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Failed to abort retry session on shutdown", e);
            }
        }
    }

    /**
     * Initiates an orderly shutdown: tasks already queued for immediate execution still run,
     * pending delayed tasks are dropped and no new tasks are accepted. Hosted sessions are aborted
     * with {@link express.mvp.retry.RetryCancelledException}.
     *
     * <p>Invocation has no additional effect if already shut down.
     *
     * @param timeout maximum time to wait for running tasks to complete
     * @return true if the scheduler terminated before the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean shutdown(Duration timeout) throws InterruptedException {
        if (!shutdown.compareAndSet(false, true)) {
            return executor.isTerminated();
        }
        executor.shutdown();
        abortHosted();
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stops the scheduler without waiting; queued and pending tasks are dropped and hosted sessions
     * are aborted with {@link express.mvp.retry.RetryCancelledException}.
     */
    public void shutdownNow() {
        shutdown.set(true);
        executor.shutdownNow();
        abortHosted();
    }

    /**
     * Returns whether this scheduler has been shut down.
     *
     * @return true if shutdown has been initiated
     */
    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Returns whether all tasks have completed following shutdown.
     *
     * @return true if terminated
     */
    public boolean isTerminated() {
        return executor.isTerminated();
    }

    /**
     * Returns the number of delayed tasks waiting for their time.
     *
     * @return the queued task count
     */
    public int getQueuedTasks() {
        return executor.getQueue().size();
    }

    /**
     * Returns the number of sessions that have started on this scheduler and not yet completed.
     *
     * @return the hosted session count
     */
    public int getHostedSessions() {
        return hosted.size();
    }

    /**
     * Returns a snapshot of the scheduler's statistics.
     *
     * @return the current statistics
     */
    public Stats getStats() {
        return new Stats(
                submittedTasks.get(),
                completedTasks.get(),
                failedTasks.get(),
                rejectedTasks.get(),
                threadFactory.getThreadCount());
    }

    @Override
    public void close() {
        shutdownNow();
    }

    @Override
    public String toString() {
        return "RetryScheduler["
                + "prefix=" + threadFactory.getNamePrefix()
                + ", submitted=" + submittedTasks.get()
                + ", completed=" + completedTasks.get()
                + ", failed=" + failedTasks.get()
                + ", hosted=" + hosted.size()
                + ", shutdown=" + shutdown.get()
                + "]";
    }

    // ========== Builder ==========

    /** Builder for creating {@link RetryScheduler} instances. */
    public static final class Builder {

        private String namePrefix = "retry-scheduler";
        private boolean daemon = true;

        private Builder() {}

        /**
         * Sets the name prefix for the scheduler thread.
         *
         * @param namePrefix the prefix for thread names
         * @return this builder
         */
        public Builder namePrefix(String namePrefix) {
            this.namePrefix = Objects.requireNonNull(namePrefix);
            return this;
        }

        /**
         * Sets whether the scheduler thread is a daemon thread.
         *
         * @param daemon true for a daemon thread
         * @return this builder
         */
        public Builder daemon(boolean daemon) {
            this.daemon = daemon;
            return this;
        }

        /**
         * Builds the scheduler.
         *
         * @return a new RetryScheduler
         */
        public RetryScheduler build() {
            return new RetryScheduler(new SchedulerThreadFactory(namePrefix, daemon));
        }
    }

    // ========== Statistics Record ==========

    /**
     * Immutable snapshot of scheduler statistics.
     *
     * @param submitted number of tasks accepted
     * @param completed number of tasks that ran to completion
     * @param failed number of tasks that threw
     * @param rejected number of tasks refused after shutdown
     * @param threads number of threads created
     */
    public record Stats(long submitted, long completed, long failed, long rejected, long threads) {

        @Override
        public String toString() {
            return String.format(
                    "Stats[submitted=%d, completed=%d, failed=%d, rejected=%d, threads=%d]",
                    submitted, completed, failed, rejected, threads);
        }
    }
}
