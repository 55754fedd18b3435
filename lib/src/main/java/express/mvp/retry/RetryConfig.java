package express.mvp.retry;

import express.mvp.retry.backoff.Backoff;
import express.mvp.retry.backoff.ConstantBackoff;
import express.mvp.retry.error.ErrorEvaluator;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration shared by the sessions of a {@link Retrier}.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Retry Configuration Parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>backoff</td><td>100ms, 10 retries</td><td>Delay strategy between attempts</td></tr>
 *   <tr><td>maxAttempts</td><td>0 (unlimited)</td><td>Total attempts, including the first</td></tr>
 *   <tr><td>timeout</td><td>0 (unlimited)</td><td>Wall-clock budget for the whole session</td></tr>
 *   <tr><td>errorEvaluator</td><td>none</td><td>Custom retry decision for unlisted failures</td></tr>
 *   <tr><td>retryListener</td><td>none</td><td>Observer called before every wait</td></tr>
 *   <tr><td>sleeper</td><td>Thread.sleep</td><td>Blocking wait of synchronous sessions</td></tr>
 *   <tr><td>operationName</td><td>"operation"</td><td>Label used in logs and messages</td></tr>
 * </table>
 *
 * <p>The configured backoff acts as a prototype: every session works on its own
 * {@link Backoff#copy()}, so one configuration can serve concurrent sessions.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryConfig config = RetryConfig.builder()
 *     .backoff(FibonacciBackoff.ofSeconds(0.05, 8))
 *     .maxAttempts(5)
 *     .timeout(Duration.ofSeconds(10))
 *     .retryListener((failure, delay) -> metrics.retried())
 *     .build();
 * }</pre>
 */
public final class RetryConfig {

    /** Sentinel for "no attempt limit". */
    public static final int UNLIMITED_ATTEMPTS = 0;

    private final Backoff backoff;
    private final int maxAttempts;
    private final Duration timeout;
    private final ErrorEvaluator errorEvaluator;
    private final RetryListener retryListener;
    private final Sleeper sleeper;
    private final String operationName;

    private RetryConfig(Builder builder) {
        this.backoff = builder.backoff;
        this.maxAttempts = builder.maxAttempts;
        this.timeout = builder.timeout;
        this.errorEvaluator = builder.errorEvaluator;
        this.retryListener = builder.retryListener;
        this.sleeper = builder.sleeper;
        this.operationName = builder.operationName;
    }

    /**
     * Returns a configuration with all defaults.
     *
     * @return default configuration
     */
    public static RetryConfig defaults() {
        return builder().build();
    }

    /**
     * Returns a new builder.
     *
     * @return the builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the backoff prototype.
     *
     * @return the backoff
     */
    public Backoff backoff() {
        return backoff;
    }

    /**
     * Returns the maximum number of attempts.
     *
     * @return max attempts, or {@link #UNLIMITED_ATTEMPTS}
     */
    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Returns the session time budget.
     *
     * @return timeout, {@link Duration#ZERO} for none
     */
    public Duration timeout() {
        return timeout;
    }

    /**
     * Returns the custom error evaluator.
     *
     * @return the evaluator, or null
     */
    public ErrorEvaluator errorEvaluator() {
        return errorEvaluator;
    }

    /**
     * Returns the retry listener.
     *
     * @return the listener, or null
     */
    public RetryListener retryListener() {
        return retryListener;
    }

    /**
     * Returns the sleeper used by synchronous sessions.
     *
     * @return the sleeper
     */
    public Sleeper sleeper() {
        return sleeper;
    }

    /**
     * Returns the operation label.
     *
     * @return the name
     */
    public String operationName() {
        return operationName;
    }

    /**
     * Returns a builder pre-populated with this configuration.
     *
     * @return new builder
     */
    public Builder toBuilder() {
        return new Builder()
                .backoff(backoff)
                .maxAttempts(maxAttempts)
                .timeout(timeout)
                .errorEvaluator(errorEvaluator)
                .retryListener(retryListener)
                .sleeper(sleeper)
                .operationName(operationName);
    }

    @Override
    public String toString() {
        return "RetryConfig[op=" + operationName
                + ", backoff=" + backoff
                + ", maxAttempts=" + maxAttempts
                + ", timeout=" + timeout
                + ", evaluator=" + (errorEvaluator != null)
                + "]";
    }

    /** Builder for {@link RetryConfig}. */
    public static final class Builder {
        private Backoff backoff = ConstantBackoff.defaults();
        private int maxAttempts = UNLIMITED_ATTEMPTS;
        private Duration timeout = Duration.ZERO;
        private ErrorEvaluator errorEvaluator;
        private RetryListener retryListener;
        private Sleeper sleeper = Sleeper.THREAD_SLEEP;
        private String operationName = "operation";

        private Builder() {}

        /**
         * Sets the backoff strategy.
         *
         * @param backoff the strategy
         * @return this builder
         * @throws NullPointerException if backoff is null
         */
        public Builder backoff(Backoff backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff");
            return this;
        }

        /**
         * Sets the maximum number of attempts, including the first one.
         *
         * @param maxAttempts attempt limit (0 = unlimited)
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 0) {
                throw new RetryConfigurationException("maxAttempts must be >= 0 (0 = unlimited)");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets the wall-clock budget of a session.
         *
         * @param timeout the budget ({@link Duration#ZERO} = unlimited)
         * @return this builder
         */
        public Builder timeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative()) {
                throw new RetryConfigurationException("timeout must not be negative");
            }
            this.timeout = timeout;
            return this;
        }

        /**
         * Sets the wall-clock budget in fractional seconds.
         *
         * @param seconds the budget (0 = unlimited)
         * @return this builder
         */
        public Builder timeoutSeconds(double seconds) {
            if (!(seconds >= 0) || Double.isInfinite(seconds)) {
                throw new RetryConfigurationException("timeout must be a non-negative number");
            }
            return timeout(Duration.ofNanos(Math.round(seconds * 1_000_000_000d)));
        }

        /**
         * Sets the custom error evaluator.
         *
         * @param evaluator the evaluator (null for none)
         * @return this builder
         */
        public Builder errorEvaluator(ErrorEvaluator evaluator) {
            this.errorEvaluator = evaluator;
            return this;
        }

        /**
         * Sets the retry listener.
         *
         * @param listener the listener (null for none)
         * @return this builder
         */
        public Builder retryListener(RetryListener listener) {
            this.retryListener = listener;
            return this;
        }

        /**
         * Sets the blocking wait used by synchronous sessions.
         *
         * @param sleeper the sleeper
         * @return this builder
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        /**
         * Sets the operation label used in logs and messages.
         *
         * @param name the label
         * @return this builder
         */
        public Builder operationName(String name) {
            this.operationName = Objects.requireNonNull(name, "name");
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return new configuration
         */
        public RetryConfig build() {
            return new RetryConfig(this);
        }
    }
}
