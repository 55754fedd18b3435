package express.mvp.retry.backoff;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.retry.RetryConfigurationException;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Unit tests for {@link ConstantBackoff}. */
@DisplayName("ConstantBackoff")
class ConstantBackoffTest {

    @Nested
    @DisplayName("Delays")
    class DelayTests {

        @ParameterizedTest
        @ValueSource(ints = {1, 2, 3})
        @DisplayName("Returns the same delay for every attempt within the cap")
        void sameDelayWithinCap(int attempt) {
            ConstantBackoff backoff = ConstantBackoff.ofSeconds(0.1, 3);
            assertEquals(100, backoff.nextDelayMillis(attempt));
        }

        @Test
        @DisplayName("Stops once the retry cap is exceeded")
        void stopsAfterCap() {
            ConstantBackoff backoff = ConstantBackoff.ofSeconds(0.1, 3);
            assertEquals(Backoff.STOP, backoff.nextDelayMillis(4));
        }

        @Test
        @DisplayName("Zero retry cap never stops")
        void unlimitedNeverStops() {
            ConstantBackoff backoff = ConstantBackoff.builder()
                    .delayMillis(5)
                    .maxRetries(Backoff.UNLIMITED)
                    .build();
            assertEquals(5, backoff.nextDelayMillis(1_000_000));
        }

        @Test
        @DisplayName("Zero delay is allowed")
        void zeroDelayAllowed() {
            ConstantBackoff backoff = ConstantBackoff.ofSeconds(0, 2);
            assertEquals(0, backoff.nextDelayMillis(1));
        }

        @Test
        @DisplayName("Attempt numbers below 1 are rejected")
        void rejectsAttemptZero() {
            assertThrows(IllegalArgumentException.class,
                    () -> ConstantBackoff.defaults().nextDelayMillis(0));
        }
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("Defaults are 100ms and 10 retries")
        void defaults() {
            ConstantBackoff backoff = ConstantBackoff.defaults();
            assertEquals(ConstantBackoff.DEFAULT_DELAY_MILLIS, backoff.getDelayMillis());
            assertEquals(ConstantBackoff.DEFAULT_MAX_RETRIES, backoff.getMaxRetries());
        }

        @Test
        @DisplayName("Builder accepts a Duration")
        void builderAcceptsDuration() {
            ConstantBackoff backoff = ConstantBackoff.builder()
                    .delay(Duration.ofMillis(250))
                    .build();
            assertEquals(250, backoff.getDelayMillis());
        }

        @Test
        @DisplayName("Negative delay is rejected")
        void negativeDelayRejected() {
            assertThrows(RetryConfigurationException.class, () -> ConstantBackoff.ofSeconds(-1, 3));
            assertThrows(RetryConfigurationException.class,
                    () -> ConstantBackoff.builder().delayMillis(-1));
        }

        @Test
        @DisplayName("Negative retry cap is rejected")
        void negativeCapRejected() {
            assertThrows(RetryConfigurationException.class, () -> ConstantBackoff.ofSeconds(1, -1));
        }

        @Test
        @DisplayName("Non-finite seconds are rejected")
        void nonFiniteRejected() {
            assertThrows(RetryConfigurationException.class,
                    () -> ConstantBackoff.ofSeconds(Double.NaN, 3));
            assertThrows(RetryConfigurationException.class,
                    () -> ConstantBackoff.ofSeconds(Double.POSITIVE_INFINITY, 3));
        }

        @Test
        @DisplayName("Configuration errors are IllegalArgumentExceptions")
        void configurationErrorIsIllegalArgument() {
            assertThrows(IllegalArgumentException.class, () -> ConstantBackoff.ofSeconds(-1, 3));
        }
    }

    @Test
    @DisplayName("Reset is a no-op and copies share the stateless instance")
    void resetAndCopy() {
        ConstantBackoff backoff = ConstantBackoff.ofSeconds(0.2, 1);
        backoff.reset();
        assertEquals(200, backoff.nextDelayMillis(1));
        assertSame(backoff, backoff.copy());
    }

    @Test
    @DisplayName("toString includes delay and cap")
    void toStringIncludesSettings() {
        String str = ConstantBackoff.ofSeconds(0.1, 3).toString();
        assertTrue(str.contains("100ms"));
        assertTrue(str.contains("maxRetries=3"));
    }
}
