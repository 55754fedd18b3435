package express.mvp.retry.backoff;

import express.mvp.retry.RetryConfigurationException;
import java.time.Duration;

/**
 * Backoff that waits the same amount of time after every failed attempt.
 *
 * <p>The strategy is stateless: {@link #nextDelayMillis(int)} depends only on the attempt number.
 * An optional retry cap bounds the session independently of its own attempt limit; once the
 * attempt number exceeds the cap, {@link Backoff#STOP} is returned.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * // 250ms between attempts, at most 5 retries
 * Backoff backoff = ConstantBackoff.ofSeconds(0.25, 5);
 *
 * // Same, through the builder
 * Backoff backoff = ConstantBackoff.builder()
 *     .delay(Duration.ofMillis(250))
 *     .maxRetries(5)
 *     .build();
 * }</pre>
 */
public final class ConstantBackoff implements Backoff {

    /** Delay used by {@link #defaults()}. */
    public static final long DEFAULT_DELAY_MILLIS = 100;

    /** Retry cap used by {@link #defaults()}. */
    public static final int DEFAULT_MAX_RETRIES = 10;

    private final long delayMillis;
    private final int maxRetries;

    private ConstantBackoff(Builder builder) {
        this.delayMillis = builder.delayMillis;
        this.maxRetries = builder.maxRetries;
    }

    /**
     * Returns a backoff of 100ms with at most 10 retries.
     *
     * @return default constant backoff
     */
    public static ConstantBackoff defaults() {
        return builder().build();
    }

    /**
     * Creates a constant backoff from fractional seconds.
     *
     * @param delaySeconds delay between attempts in seconds (0 = no wait)
     * @param maxRetries maximum retries (0 = unlimited)
     * @return new backoff
     * @throws RetryConfigurationException if a parameter is out of range
     */
    public static ConstantBackoff ofSeconds(double delaySeconds, int maxRetries) {
        if (delaySeconds < 0) {
            throw new RetryConfigurationException("delay must not be negative");
        }
        return builder()
                .delayMillis(Delays.secondsToMillis(delaySeconds, "delay"))
                .maxRetries(maxRetries)
                .build();
    }

    /**
     * Returns a builder for custom configuration.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public long nextDelayMillis(int attempt) {
        Delays.checkAttempt(attempt);
        if (Delays.capExceeded(maxRetries, attempt)) {
            return STOP;
        }
        return delayMillis;
    }

    @Override
    public void reset() {
        // Stateless
    }

    @Override
    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Returns the configured delay.
     *
     * @return delay in milliseconds
     */
    public long getDelayMillis() {
        return delayMillis;
    }

    @Override
    public ConstantBackoff copy() {
        return this;
    }

    @Override
    public String toString() {
        return "ConstantBackoff[delay=" + delayMillis + "ms, maxRetries=" + maxRetries + "]";
    }

    /** Builder for {@link ConstantBackoff}. */
    public static final class Builder {
        private long delayMillis = DEFAULT_DELAY_MILLIS;
        private int maxRetries = DEFAULT_MAX_RETRIES;

        private Builder() {}

        /**
         * Sets the delay between attempts.
         *
         * @param delay the delay (zero = no wait)
         * @return this builder
         */
        public Builder delay(Duration delay) {
            this.delayMillis = Delays.toMillis(delay, "delay");
            return this;
        }

        /**
         * Sets the delay between attempts in milliseconds.
         *
         * @param millis the delay (0 = no wait)
         * @return this builder
         */
        public Builder delayMillis(long millis) {
            if (millis < 0) {
                throw new RetryConfigurationException("delay must not be negative");
            }
            this.delayMillis = millis;
            return this;
        }

        /**
         * Sets the maximum number of retries.
         *
         * @param maxRetries retry cap (0 = unlimited)
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            Delays.checkMaxRetries(maxRetries);
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Builds the backoff.
         *
         * @return new backoff
         */
        public ConstantBackoff build() {
            return new ConstantBackoff(this);
        }
    }
}
