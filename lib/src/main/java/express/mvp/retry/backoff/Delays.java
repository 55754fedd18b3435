package express.mvp.retry.backoff;

import express.mvp.retry.RetryConfigurationException;
import java.time.Duration;

/** Conversion and validation helpers shared by the backoff implementations. */
final class Delays {

    private Delays() {
        // Utility class
    }

    static long secondsToMillis(double seconds, String name) {
        if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            throw new RetryConfigurationException(name + " must be a finite number");
        }
        double millis = seconds * 1000.0;
        if (millis >= Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        return Math.round(millis);
    }

    static double secondsToFractionalMillis(double seconds, String name) {
        if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            throw new RetryConfigurationException(name + " must be a finite number");
        }
        return seconds * 1000.0;
    }

    static double toFractionalMillis(Duration duration, String name) {
        if (duration == null) {
            throw new RetryConfigurationException(name + " must not be null");
        }
        if (duration.isNegative()) {
            throw new RetryConfigurationException(name + " must not be negative");
        }
        return duration.getSeconds() * 1000.0 + duration.getNano() / 1_000_000.0;
    }

    static long roundMillis(double millis) {
        return millis >= Long.MAX_VALUE ? Long.MAX_VALUE : Math.round(millis);
    }

    static long toMillis(Duration duration, String name) {
        if (duration == null) {
            throw new RetryConfigurationException(name + " must not be null");
        }
        if (duration.isNegative()) {
            throw new RetryConfigurationException(name + " must not be negative");
        }
        try {
            return duration.toMillis();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    static void checkMaxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new RetryConfigurationException("maxRetries must be >= 0 (0 = unlimited)");
        }
    }

    static void checkAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, was " + attempt);
        }
    }

    static boolean capExceeded(int maxRetries, int attempt) {
        return maxRetries != Backoff.UNLIMITED && attempt > maxRetries;
    }
}
