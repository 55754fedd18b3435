package express.mvp.retry.error;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.retry.RetryCancelledException;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ErrorClassifier}. */
@DisplayName("ErrorClassifier")
class ErrorClassifierTest {

    private ClassificationLists lists;

    @BeforeEach
    void setUp() {
        lists = new ClassificationLists();
    }

    @Nested
    @DisplayName("Without evaluator")
    class DefaultPolicyTests {

        @Test
        @DisplayName("Unknown failures are retried")
        void unknownRetried() {
            Classification c = new ErrorClassifier(lists, null).classify(new IOException("io"));
            assertEquals(RetryDecision.RETRY, c.decision());
            assertFalse(c.isEscalated());
            assertFalse(c.isCancellation());
        }

        @Test
        @DisplayName("Whitelisted failures stop")
        void whitelistedStops() {
            Classification c = new ErrorClassifier(lists, null)
                    .classify(new PermanentFailureException("bad request"));
            assertEquals(RetryDecision.STOP, c.decision());
        }

        @Test
        @DisplayName("Blacklisted failures are retried")
        void blacklistedRetried() {
            lists.addBlacklisted(TimeoutException.class);
            assertTrue(new ErrorClassifier(lists, null).classify(new TimeoutException()).isRetry());
        }

        @Test
        @DisplayName("A kind on both lists stops: whitelist wins")
        void whitelistWinsOverBlacklist() {
            lists.addWhitelisted(IOException.class);
            lists.addBlacklisted(IOException.class);
            Classification c = new ErrorClassifier(lists, null).classify(new IOException());
            assertEquals(RetryDecision.STOP, c.decision());
        }

        @Test
        @DisplayName("The classified failure is the original failure")
        void failureIsOriginal() {
            IOException failure = new IOException();
            assertSame(failure, new ErrorClassifier(lists, null).classify(failure).failure());
        }
    }

    @Nested
    @DisplayName("With evaluator")
    class EvaluatorTests {

        @Test
        @DisplayName("Evaluator verdict decides for unlisted failures")
        void evaluatorDecides() {
            ErrorClassifier classifier = new ErrorClassifier(
                    lists, failure -> failure instanceof TimeoutException);

            assertTrue(classifier.classify(new TimeoutException()).isRetry());
            assertFalse(classifier.classify(new IOException()).isRetry());
        }

        @Test
        @DisplayName("Evaluator overrides the blacklist")
        void evaluatorBeforeBlacklist() {
            lists.addBlacklisted(IOException.class);
            ErrorClassifier classifier = new ErrorClassifier(lists, failure -> false);
            assertEquals(RetryDecision.STOP, classifier.classify(new IOException()).decision());
        }

        @Test
        @DisplayName("Whitelisted failures never reach the evaluator")
        void whitelistBeforeEvaluator() {
            AtomicInteger calls = new AtomicInteger();
            ErrorClassifier classifier = new ErrorClassifier(lists, failure -> {
                calls.incrementAndGet();
                return true;
            });
            assertFalse(classifier.classify(new SecurityException()).isRetry());
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("A failing evaluator escalates its own failure and stops")
        void failingEvaluatorEscalates() {
            IllegalStateException broken = new IllegalStateException("evaluator bug");
            IOException original = new IOException("io");
            ErrorClassifier classifier = new ErrorClassifier(lists, failure -> {
                throw broken;
            });

            Classification c = classifier.classify(original);

            assertEquals(RetryDecision.STOP, c.decision());
            assertTrue(c.isEscalated());
            assertSame(broken, c.failure());
            assertSame(original, c.failure().getSuppressed()[0]);
        }

        @Test
        @DisplayName("Escalated failures are not checked against the lists")
        void escalationIgnoresBlacklist() {
            lists.addBlacklisted(IllegalStateException.class);
            ErrorClassifier classifier = new ErrorClassifier(lists, failure -> {
                throw new IllegalStateException("evaluator bug");
            });
            assertFalse(classifier.classify(new IOException()).isRetry());
        }

        @Test
        @DisplayName("hasEvaluator reports the configuration")
        void hasEvaluator() {
            assertTrue(new ErrorClassifier(lists, f -> true).hasEvaluator());
            assertFalse(new ErrorClassifier(lists, null).hasEvaluator());
            assertSame(lists, new ErrorClassifier(lists, null).getLists());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        @DisplayName("Cancellation kinds always stop and bypass the evaluator")
        void cancellationBypassesEvaluator() {
            AtomicInteger calls = new AtomicInteger();
            lists.addBlacklisted(CancellationException.class);
            ErrorClassifier classifier = new ErrorClassifier(lists, failure -> {
                calls.incrementAndGet();
                return true;
            });

            Classification c = classifier.classify(new CancellationException());

            assertTrue(c.isCancellation());
            assertFalse(c.isRetry());
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("Interrupts and engine cancellations are cancellation kinds")
        void cancellationKinds() {
            assertTrue(ErrorClassifier.isCancellation(new InterruptedException()));
            assertTrue(ErrorClassifier.isCancellation(
                    new RetryCancelledException("stop", null, 1, Duration.ZERO)));
            assertFalse(ErrorClassifier.isCancellation(new IOException()));
        }
    }

    @Test
    @DisplayName("Lists are read at classification time")
    void listsReadPerCall() {
        ErrorClassifier classifier = new ErrorClassifier(lists, null);
        assertTrue(classifier.classify(new IOException()).isRetry());

        lists.addWhitelisted(IOException.class);

        assertFalse(classifier.classify(new IOException()).isRetry());
    }

    @Test
    @DisplayName("Null failure is rejected")
    void nullRejected() {
        assertThrows(NullPointerException.class,
                () -> new ErrorClassifier(lists, null).classify(null));
    }
}
