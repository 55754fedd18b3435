package express.mvp.retry.backoff;

import express.mvp.retry.RetryConfigurationException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff whose delay grows geometrically with the attempt number, clamped to a maximum.
 *
 * <p>The delay after attempt {@code n} is {@code min(maxDelay, base * factor^(n - 1))}. Without
 * jitter the result depends only on {@code n}, which makes the strategy stateless and
 * {@link #copy()} free. A jitter factor {@code j > 0} scales each delay by a random value in
 * {@code [1 - j, 1 + j]}; the jittered delay is still clamped to {@code [0, maxDelay]}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Backoff backoff = ExponentialBackoff.builder()
 *     .base(Duration.ofMillis(100))   // first retry after 100ms
 *     .factor(2.0)                    // 100, 200, 400, ...
 *     .maxDelay(Duration.ofSeconds(5))
 *     .maxRetries(8)
 *     .build();
 * }</pre>
 */
public final class ExponentialBackoff implements Backoff {

    /** Base delay used by the builder when none is set. */
    public static final long DEFAULT_BASE_MILLIS = 500;

    /** Growth factor used by the builder when none is set. */
    public static final double DEFAULT_FACTOR = 2.0;

    /** Delay cap used by the builder when none is set. */
    public static final long DEFAULT_MAX_DELAY_MILLIS = 6_000;

    private final double baseMillis;
    private final double factor;
    private final long maxDelayMillis;
    private final int maxRetries;
    private final double jitterFactor;

    private ExponentialBackoff(Builder builder) {
        this.baseMillis = builder.baseMillis;
        this.factor = builder.factor;
        this.maxDelayMillis = builder.maxDelayMillis;
        this.maxRetries = builder.maxRetries;
        this.jitterFactor = builder.jitterFactor;
    }

    /**
     * Returns a backoff of 500ms doubling up to 6s, with no retry cap.
     *
     * @return default exponential backoff
     */
    public static ExponentialBackoff defaults() {
        return builder().build();
    }

    /**
     * Creates an exponential backoff from fractional seconds.
     *
     * @param baseSeconds delay after the first attempt, in seconds (must be positive)
     * @param factor growth factor (must be positive)
     * @param maxDelaySeconds delay cap in seconds (must be positive)
     * @param maxRetries maximum retries (0 = unlimited)
     * @return new backoff
     * @throws RetryConfigurationException if a parameter is out of range
     */
    public static ExponentialBackoff ofSeconds(
            double baseSeconds, double factor, double maxDelaySeconds, int maxRetries) {
        if (!(baseSeconds > 0)) {
            throw new RetryConfigurationException("base must be positive");
        }
        if (!(maxDelaySeconds > 0)) {
            throw new RetryConfigurationException("maxDelay must be positive");
        }
        return builder()
                .fractionalBaseMillis(Delays.secondsToFractionalMillis(baseSeconds, "base"))
                .factor(factor)
                .maxDelayMillis(Math.max(1, Delays.secondsToMillis(maxDelaySeconds, "maxDelay")))
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

        double raw = baseMillis * Math.pow(factor, attempt - 1);
        double delay = Double.isNaN(raw) ? maxDelayMillis : Math.min(raw, maxDelayMillis);

        if (jitterFactor > 0) {
            double jitter = ThreadLocalRandom.current().nextDouble(-jitterFactor, jitterFactor);
            delay = Math.min(delay * (1 + jitter), maxDelayMillis);
            delay = Math.max(0, delay);
        }

        return Delays.roundMillis(delay);
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
     * Returns the delay applied after the first attempt.
     *
     * @return base delay in milliseconds, possibly fractional
     */
    public double getBaseMillis() {
        return baseMillis;
    }

    /**
     * Returns the growth factor.
     *
     * @return factor applied per attempt
     */
    public double getFactor() {
        return factor;
    }

    /**
     * Returns the delay cap.
     *
     * @return maximum delay in milliseconds
     */
    public long getMaxDelayMillis() {
        return maxDelayMillis;
    }

    /**
     * Returns the jitter factor.
     *
     * @return jitter in {@code [0, 1]}
     */
    public double getJitterFactor() {
        return jitterFactor;
    }

    @Override
    public ExponentialBackoff copy() {
        return this;
    }

    @Override
    public String toString() {
        return String.format(
                "ExponentialBackoff[base=%sms, factor=%s, maxDelay=%dms, maxRetries=%d, jitter=%s]",
                baseMillis, factor, maxDelayMillis, maxRetries, jitterFactor);
    }

    /** Builder for {@link ExponentialBackoff}. */
    public static final class Builder {
        private double baseMillis = DEFAULT_BASE_MILLIS;
        private double factor = DEFAULT_FACTOR;
        private long maxDelayMillis = DEFAULT_MAX_DELAY_MILLIS;
        private int maxRetries = UNLIMITED;
        private double jitterFactor = 0.0;

        private Builder() {}

        /**
         * Sets the delay applied after the first attempt.
         *
         * @param base base delay (must be positive)
         * @return this builder
         */
        public Builder base(Duration base) {
            return fractionalBaseMillis(Delays.toFractionalMillis(base, "base"));
        }

        /**
         * Sets the base delay in milliseconds.
         *
         * @param millis base delay (must be positive)
         * @return this builder
         */
        public Builder baseMillis(long millis) {
            if (millis <= 0) {
                throw new RetryConfigurationException("base must be positive");
            }
            this.baseMillis = millis;
            return this;
        }

        Builder fractionalBaseMillis(double millis) {
            if (!(millis > 0) || Double.isInfinite(millis)) {
                throw new RetryConfigurationException("base must be positive");
            }
            this.baseMillis = millis;
            return this;
        }

        /**
         * Sets the growth factor.
         *
         * @param factor multiplier per attempt (must be positive)
         * @return this builder
         */
        public Builder factor(double factor) {
            if (!(factor > 0) || Double.isInfinite(factor)) {
                throw new RetryConfigurationException("factor must be positive");
            }
            this.factor = factor;
            return this;
        }

        /**
         * Sets the delay cap.
         *
         * @param maxDelay maximum delay (must be positive)
         * @return this builder
         */
        public Builder maxDelay(Duration maxDelay) {
            return maxDelayMillis(Delays.toMillis(maxDelay, "maxDelay"));
        }

        /**
         * Sets the delay cap in milliseconds.
         *
         * @param millis maximum delay (must be positive)
         * @return this builder
         */
        public Builder maxDelayMillis(long millis) {
            if (millis <= 0) {
                throw new RetryConfigurationException("maxDelay must be positive");
            }
            this.maxDelayMillis = millis;
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
         * Sets the jitter factor.
         *
         * @param jitter jitter factor (0.0-1.0, e.g. 0.2 for ±20%)
         * @return this builder
         */
        public Builder jitterFactor(double jitter) {
            if (!(jitter >= 0 && jitter <= 1.0)) {
                throw new RetryConfigurationException("jitterFactor must be 0.0-1.0");
            }
            this.jitterFactor = jitter;
            return this;
        }

        /**
         * Builds the backoff.
         *
         * @return new backoff
         */
        public ExponentialBackoff build() {
            return new ExponentialBackoff(this);
        }
    }
}
