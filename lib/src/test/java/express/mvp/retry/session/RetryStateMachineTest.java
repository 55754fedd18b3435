package express.mvp.retry.session;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.retry.MaxRetriesExceededException;
import express.mvp.retry.NonRetriableException;
import express.mvp.retry.RetryCancelledException;
import express.mvp.retry.RetryConfig;
import express.mvp.retry.RetryTimeoutException;
import express.mvp.retry.backoff.ConstantBackoff;
import express.mvp.retry.backoff.FibonacciBackoff;
import express.mvp.retry.error.ClassificationLists;
import express.mvp.retry.error.PermanentFailureException;
import java.io.IOException;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/** Unit tests for {@link RetryStateMachine}. */
@DisplayName("RetryStateMachine")
class RetryStateMachineTest {

    private final AtomicLong clock = new AtomicLong(1_000_000_000L);
    private ClassificationLists lists;

    @BeforeEach
    void setUp() {
        lists = new ClassificationLists();
    }

    private RetryStateMachine machine(RetryConfig config) {
        return new RetryStateMachine(config, lists, clock::get);
    }

    private void advanceMillis(long millis) {
        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Starts in INIT with no attempts")
        void startsInInit() {
            RetryStateMachine m = machine(RetryConfig.defaults());
            assertEquals(SessionState.INIT, m.getState());
            assertEquals(0, m.getAttempts());
            assertEquals(Duration.ZERO, m.getElapsed());
            assertNull(m.getLastFailure());
        }

        @Test
        @DisplayName("start() enters the first attempt")
        void startEntersFirstAttempt() {
            RetryStateMachine m = machine(RetryConfig.defaults());
            RetryStep step = m.start();
            assertEquals(RetryStep.Kind.PROCEED, step.kind());
            assertEquals(SessionState.ATTEMPTING, m.getState());
            assertEquals(1, m.getAttempts());
        }

        @Test
        @DisplayName("start() twice is rejected")
        void startTwiceRejected() {
            RetryStateMachine m = machine(RetryConfig.defaults());
            m.start();
            assertThrows(IllegalStateException.class, m::start);
        }

        @Test
        @DisplayName("succeed() ends the session and freezes elapsed time")
        void succeedFreezesElapsed() {
            RetryStateMachine m = machine(RetryConfig.defaults());
            m.start();
            advanceMillis(30);
            m.succeed();
            advanceMillis(500);

            assertEquals(SessionState.SUCCEEDED, m.getState());
            assertEquals(Duration.ofMillis(30), m.getElapsed());
        }

        @Test
        @DisplayName("Operations out of order are rejected")
        void outOfOrderRejected() {
            RetryStateMachine m = machine(RetryConfig.defaults());
            assertThrows(IllegalStateException.class, m::resume);
            assertThrows(IllegalStateException.class, () -> m.fail(new IOException()));
            m.start();
            assertThrows(IllegalStateException.class, m::resume);
        }

        @Test
        @DisplayName("Full retry cycle returns to ATTEMPTING with the counter moved")
        void retryCycle() {
            RetryStateMachine m = machine(RetryConfig.builder()
                    .backoff(ConstantBackoff.ofSeconds(0.02, 5))
                    .build());
            m.start();

            RetryStep wait = m.fail(new IOException("flaky"));
            assertEquals(RetryStep.Kind.WAIT, wait.kind());
            assertEquals(20, wait.delayMillis());
            assertEquals(SessionState.RETRYING, m.getState());
            assertEquals(1, m.getAttempts());

            RetryStep proceed = m.resume();
            assertEquals(RetryStep.Kind.PROCEED, proceed.kind());
            assertEquals(SessionState.ATTEMPTING, m.getState());
            assertEquals(2, m.getAttempts());
        }
    }

    @Nested
    @DisplayName("Terminal outcomes")
    class TerminalTests {

        @Test
        @DisplayName("Non-retriable failure ends FAILED_TERMINAL with the failure as cause")
        void nonRetriable() {
            RetryStateMachine m = machine(RetryConfig.defaults());
            m.start();
            PermanentFailureException fatal = new PermanentFailureException("fatal");

            RetryStep step = m.fail(fatal);

            assertTrue(step.isTerminal());
            assertInstanceOf(NonRetriableException.class, step.exception());
            assertSame(fatal, step.exception().getCause());
            assertEquals(SessionState.FAILED_TERMINAL, m.getState());
        }

        @Test
        @DisplayName("Escalated evaluator failure becomes the cause")
        void escalatedCause() {
            IllegalStateException broken = new IllegalStateException("evaluator bug");
            RetryStateMachine m = machine(RetryConfig.builder()
                    .errorEvaluator(failure -> {
                        throw broken;
                    })
                    .build());
            m.start();

            RetryStep step = m.fail(new IOException());

            assertSame(broken, step.exception().getCause());
            assertEquals(SessionState.FAILED_TERMINAL, m.getState());
        }

        @Test
        @DisplayName("maxAttempts counts every attempt including the first")
        void maxAttemptsExhausted() {
            RetryStateMachine m = machine(RetryConfig.builder()
                    .backoff(ConstantBackoff.ofSeconds(0, 0))
                    .maxAttempts(2)
                    .build());
            m.start();
            assertFalse(m.fail(new IOException("1")).isTerminal());
            m.resume();

            IOException last = new IOException("2");
            RetryStep step = m.fail(last);

            assertInstanceOf(MaxRetriesExceededException.class, step.exception());
            assertSame(last, step.exception().getCause());
            assertEquals(2, step.exception().getAttempts());
            assertEquals(SessionState.ATTEMPTS_EXHAUSTED, m.getState());
        }

        @Test
        @DisplayName("Backoff cap ends ATTEMPTS_EXHAUSTED after cap + 1 attempts")
        void backoffCapExhausted() {
            RetryStateMachine m = machine(RetryConfig.builder()
                    .backoff(ConstantBackoff.ofSeconds(0.1, 3))
                    .build());
            m.start();
            for (int i = 0; i < 3; i++) {
                assertEquals(RetryStep.Kind.WAIT, m.fail(new IOException()).kind());
                m.resume();
            }
            RetryStep step = m.fail(new IOException());

            assertInstanceOf(MaxRetriesExceededException.class, step.exception());
            assertEquals(4, m.getAttempts());
        }

        @Test
        @DisplayName("Cancellation failures end CANCELLED")
        void cancellationFailure() {
            RetryStateMachine m = machine(RetryConfig.defaults());
            m.start();
            RetryStep step = m.fail(new CancellationException());
            assertInstanceOf(RetryCancelledException.class, step.exception());
            assertEquals(SessionState.CANCELLED, m.getState());
        }

        @Test
        @DisplayName("cancel() during a wait ends CANCELLED; later cancel() returns null")
        void cancelDuringWait() {
            RetryStateMachine m = machine(RetryConfig.defaults());
            m.start();
            IOException failure = new IOException();
            m.fail(failure);

            RetryCancelledException cancelled = m.cancel(null);

            assertNotNull(cancelled);
            assertSame(failure, cancelled.getCause());
            assertEquals(SessionState.CANCELLED, m.getState());
            assertNull(m.cancel(null));
        }

        @Test
        @DisplayName("abandon() ends FAILED_TERMINAL without classifying")
        void abandon() {
            RetryStateMachine m = machine(RetryConfig.defaults());
            m.start();
            OutOfMemoryError error = new OutOfMemoryError("test");
            m.abandon(error);
            assertEquals(SessionState.FAILED_TERMINAL, m.getState());
            assertSame(error, m.getLastFailure());
        }
    }

    @Nested
    @DisplayName("Timeout")
    class TimeoutTests {

        @Test
        @DisplayName("Timeout is checked before the attempt budget")
        void timeoutBeforeAttempts() {
            RetryStateMachine m = machine(RetryConfig.builder()
                    .maxAttempts(1)
                    .timeout(Duration.ofMillis(50))
                    .build());
            m.start();
            advanceMillis(60);

            RetryStep step = m.fail(new IOException());

            assertInstanceOf(RetryTimeoutException.class, step.exception());
            assertEquals(SessionState.TIMED_OUT, m.getState());
        }

        @Test
        @DisplayName("Waits longer than the remaining budget are shortened")
        void waitClippedToDeadline() {
            RetryStateMachine m = machine(RetryConfig.builder()
                    .backoff(ConstantBackoff.ofSeconds(10, 5))
                    .timeoutSeconds(0.05)
                    .build());
            m.start();
            advanceMillis(20);

            RetryStep step = m.fail(new IOException());

            assertEquals(30, step.delayMillis());
        }

        @Test
        @DisplayName("Deadline passing during the wait ends TIMED_OUT on resume")
        void timeoutOnResume() {
            RetryStateMachine m = machine(RetryConfig.builder()
                    .backoff(ConstantBackoff.ofSeconds(10, 5))
                    .timeoutSeconds(0.05)
                    .build());
            m.start();
            IOException failure = new IOException();
            RetryStep wait = m.fail(failure);
            advanceMillis(wait.delayMillis());

            RetryStep step = m.resume();

            assertInstanceOf(RetryTimeoutException.class, step.exception());
            assertSame(failure, step.exception().getCause());
            assertEquals(1, m.getAttempts());
        }

        @Test
        @DisplayName("Zero timeout means unlimited")
        void zeroTimeoutUnlimited() {
            RetryStateMachine m = machine(RetryConfig.builder()
                    .backoff(ConstantBackoff.ofSeconds(0, 0))
                    .build());
            m.start();
            advanceMillis(TimeUnit.HOURS.toMillis(5));
            assertEquals(RetryStep.Kind.WAIT, m.fail(new IOException()).kind());
        }

        @Test
        @DisplayName("Timeouts beyond the nanosecond range act as an unreachable deadline")
        void foreverTimeout() {
            RetryStateMachine m = machine(RetryConfig.builder()
                    .backoff(ConstantBackoff.ofSeconds(2, 0))
                    .timeout(ChronoUnit.FOREVER.getDuration())
                    .build());
            m.start();
            advanceMillis(TimeUnit.DAYS.toMillis(365));

            RetryStep step = m.fail(new IOException());

            assertEquals(RetryStep.Kind.WAIT, step.kind());
            assertEquals(2_000, step.delayMillis());
            assertEquals(RetryStep.Kind.PROCEED, m.resume().kind());
        }

        @Test
        @DisplayName("Remaining budget near the nanosecond limit does not wrap around")
        void nearLimitTimeoutDoesNotClipWait() {
            RetryStateMachine m = machine(RetryConfig.builder()
                    .backoff(ConstantBackoff.ofSeconds(2, 0))
                    .timeout(Duration.ofNanos(Long.MAX_VALUE))
                    .build());
            m.start();
            clock.addAndGet(1);

            assertEquals(2_000, m.fail(new IOException()).delayMillis());
        }
    }

    @Nested
    @DisplayName("Listener and backoff")
    class ListenerTests {

        @Test
        @DisplayName("Listener sees every retried failure with its delay")
        void listenerNotified() {
            List<Long> delays = new ArrayList<>();
            RetryStateMachine m = machine(RetryConfig.builder()
                    .backoff(FibonacciBackoff.ofSeconds(0.01, 0))
                    .retryListener((failure, delay) -> delays.add(delay))
                    .build());
            m.start();
            for (int i = 0; i < 4; i++) {
                m.fail(new IOException());
                m.resume();
            }
            assertEquals(List.of(10L, 10L, 20L, 30L), delays);
        }

        @Test
        @DisplayName("Listener failures are logged, not propagated")
        void listenerFailureSwallowed() {
            RetryStateMachine m = machine(RetryConfig.builder()
                    .retryListener((failure, delay) -> {
                        throw new IllegalStateException("listener bug");
                    })
                    .build());
            m.start();
            assertEquals(RetryStep.Kind.WAIT, m.fail(new IOException()).kind());
        }

        @Test
        @DisplayName("Each machine works on its own copy of a stateful backoff")
        void backoffCopied() {
            FibonacciBackoff shared = FibonacciBackoff.ofSeconds(0.01, 0);
            RetryConfig config = RetryConfig.builder().backoff(shared).build();

            RetryStateMachine first = machine(config);
            first.start();
            for (int i = 0; i < 3; i++) {
                first.fail(new IOException());
                first.resume();
            }
            RetryStateMachine second = machine(config);
            second.start();

            assertEquals(10, second.fail(new IOException()).delayMillis());
            assertEquals(10, shared.nextDelayMillis(1));
        }
    }

    @Nested
    @DisplayName("Transition table")
    class TransitionTableTests {

        @ParameterizedTest
        @EnumSource(SessionState.class)
        @DisplayName("No state transitions to itself")
        void noSelfTransition(SessionState state) {
            assertFalse(RetryStateMachine.isValidTransition(state, state));
        }

        @ParameterizedTest
        @EnumSource(value = SessionState.class,
                names = {"SUCCEEDED", "FAILED_TERMINAL", "ATTEMPTS_EXHAUSTED", "TIMED_OUT", "CANCELLED"})
        @DisplayName("Terminal states have no outgoing transitions")
        void terminalHasNoTransitions(SessionState terminal) {
            assertTrue(terminal.isTerminal());
            for (SessionState target : SessionState.values()) {
                assertFalse(RetryStateMachine.isValidTransition(terminal, target));
            }
        }

        @Test
        @DisplayName("RETRYING cannot succeed without a new attempt")
        void retryingCannotSucceed() {
            assertFalse(RetryStateMachine.isValidTransition(
                    SessionState.RETRYING, SessionState.SUCCEEDED));
            assertTrue(RetryStateMachine.isValidTransition(
                    SessionState.RETRYING, SessionState.ATTEMPTING));
        }
    }

    @Test
    @DisplayName("toString includes operation name and state")
    void toStringIncludesState() {
        RetryStateMachine m = machine(RetryConfig.builder().operationName("fetch").build());
        assertTrue(m.toString().contains("fetch"));
        assertTrue(m.toString().contains("INIT"));
    }
}
