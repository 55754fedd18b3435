package express.mvp.retry.backoff;

import express.mvp.retry.RetryConfigurationException;
import java.time.Duration;

/**
 * Backoff whose delays follow the Fibonacci sequence scaled by a base unit.
 *
 * <p>For a base unit of {@code b} the delays after attempts 1..6 are {@code b, b, 2b, 3b, 5b, 8b}.
 * The strategy keeps the last two sequence values and the highest attempt number it has seen. It
 * only advances when a larger attempt number is presented, so asking twice for the same attempt
 * returns the same delay without moving the cursor. A smaller (replayed) attempt number returns the
 * most recently computed delay.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is not thread-safe. Sessions obtain their own instance through {@link #copy()}.
 */
public final class FibonacciBackoff implements Backoff {

    /** Base unit used by {@link #defaults()}. */
    public static final long DEFAULT_BASE_MILLIS = 100;

    /** Retry cap used by {@link #defaults()}. */
    public static final int DEFAULT_MAX_RETRIES = 10;

    private final double baseMillis;
    private final int maxRetries;

    /** fib(highestAttempt - 1), seeded so that fib(1) == fib(2) == 1. */
    private long previous;

    /** fib(highestAttempt). */
    private long current;

    /** Highest attempt number seen since the last reset (0 = none). */
    private int highestAttempt;

    private FibonacciBackoff(double baseMillis, int maxRetries) {
        this.baseMillis = baseMillis;
        this.maxRetries = maxRetries;
        reset();
    }

    /**
     * Returns a backoff with a 100ms base unit and at most 10 retries.
     *
     * @return default Fibonacci backoff
     */
    public static FibonacciBackoff defaults() {
        return builder().build();
    }

    /**
     * Creates a Fibonacci backoff from fractional seconds.
     *
     * @param baseUnitSeconds base unit in seconds (must be positive)
     * @param maxRetries maximum retries (0 = unlimited)
     * @return new backoff
     * @throws RetryConfigurationException if a parameter is out of range
     */
    public static FibonacciBackoff ofSeconds(double baseUnitSeconds, int maxRetries) {
        if (!(baseUnitSeconds > 0)) {
            throw new RetryConfigurationException("baseUnit must be positive");
        }
        return builder()
                .fractionalBaseUnitMillis(
                        Delays.secondsToFractionalMillis(baseUnitSeconds, "baseUnit"))
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
        while (highestAttempt < attempt) {
            if (current == Long.MAX_VALUE) {
                // Saturated: every later term is Long.MAX_VALUE too
                highestAttempt = attempt;
                break;
            }
            advance();
        }
        return Delays.roundMillis(current * baseMillis);
    }

    private void advance() {
        highestAttempt++;
        if (highestAttempt <= 2) {
            previous = 1;
            current = 1;
            return;
        }
        long next = current > Long.MAX_VALUE - previous ? Long.MAX_VALUE : current + previous;
        previous = current;
        current = next;
    }

    @Override
    public void reset() {
        previous = 0;
        current = 0;
        highestAttempt = 0;
    }

    @Override
    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Returns the base unit the sequence is scaled by.
     *
     * @return base unit in milliseconds, possibly fractional
     */
    public double getBaseMillis() {
        return baseMillis;
    }

    @Override
    public FibonacciBackoff copy() {
        return new FibonacciBackoff(baseMillis, maxRetries);
    }

    @Override
    public String toString() {
        return "FibonacciBackoff[base=" + baseMillis + "ms, maxRetries=" + maxRetries
                + ", attempt=" + highestAttempt + "]";
    }

    /** Builder for {@link FibonacciBackoff}. */
    public static final class Builder {
        private double baseMillis = DEFAULT_BASE_MILLIS;
        private int maxRetries = DEFAULT_MAX_RETRIES;

        private Builder() {}

        /**
         * Sets the base unit the sequence is multiplied by.
         *
         * @param baseUnit base unit (must be positive)
         * @return this builder
         */
        public Builder baseUnit(Duration baseUnit) {
            return fractionalBaseUnitMillis(Delays.toFractionalMillis(baseUnit, "baseUnit"));
        }

        /**
         * Sets the base unit in milliseconds.
         *
         * @param millis base unit (must be positive)
         * @return this builder
         */
        public Builder baseUnitMillis(long millis) {
            if (millis <= 0) {
                throw new RetryConfigurationException("baseUnit must be positive");
            }
            this.baseMillis = millis;
            return this;
        }

        Builder fractionalBaseUnitMillis(double millis) {
            if (!(millis > 0) || Double.isInfinite(millis)) {
                throw new RetryConfigurationException("baseUnit must be positive");
            }
            this.baseMillis = millis;
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
        public FibonacciBackoff build() {
            return new FibonacciBackoff(baseMillis, maxRetries);
        }
    }
}
