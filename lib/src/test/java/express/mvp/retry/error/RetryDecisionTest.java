package express.mvp.retry.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/** Unit tests for {@link RetryDecision}. */
@DisplayName("RetryDecision")
class RetryDecisionTest {

    @Test
    @DisplayName("Only RETRY allows another attempt")
    void onlyRetryRetries() {
        assertTrue(RetryDecision.RETRY.isRetry());
        assertFalse(RetryDecision.STOP.isRetry());
    }

    @Test
    @DisplayName("of() maps booleans")
    void ofMapsBooleans() {
        assertEquals(RetryDecision.RETRY, RetryDecision.of(true));
        assertEquals(RetryDecision.STOP, RetryDecision.of(false));
    }

    @ParameterizedTest
    @EnumSource(RetryDecision.class)
    @DisplayName("Every decision has a description")
    void hasDescription(RetryDecision decision) {
        assertNotNull(decision.description());
        assertFalse(decision.description().isEmpty());
        assertTrue(decision.toString().contains(decision.name()));
    }
}
