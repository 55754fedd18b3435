package express.mvp.retry.error;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;

/**
 * Result of {@link ErrorClassifier#classify(Throwable)}: a decision plus the failure that should be
 * reported if the session stops.
 *
 * <p>The reported failure differs from the classified one only when the error evaluator itself
 * failed ({@link #isEscalated()}).
 */
public final class Classification {

    private final RetryDecision decision;
    private final Throwable failure;
    private final boolean escalated;
    private final boolean cancellation;

    private Classification(
            RetryDecision decision, Throwable failure, boolean escalated, boolean cancellation) {
        this.decision = decision;
        this.failure = Objects.requireNonNull(failure, "failure");
        this.escalated = escalated;
        this.cancellation = cancellation;
    }

    static Classification retry(Throwable failure) {
        return new Classification(RetryDecision.RETRY, failure, false, false);
    }

    static Classification stop(Throwable failure) {
        return new Classification(RetryDecision.STOP, failure, false, false);
    }

    static Classification escalated(Throwable evaluatorFailure) {
        return new Classification(RetryDecision.STOP, evaluatorFailure, true, false);
    }

    static Classification cancelled(Throwable failure) {
        return new Classification(RetryDecision.STOP, failure, false, true);
    }

    /**
     * Returns the decision.
     *
     * @return retry or stop
     */
    public RetryDecision decision() {
        return decision;
    }

    /**
     * Returns the failure to report to the caller if the session stops.
     *
     * @return the classified failure, or the evaluator's failure when escalated
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Throwable is exposed for diagnostics and cannot be safely copied.")
    public Throwable failure() {
        return failure;
    }

    /**
     * Checks if the error evaluator failed and its exception replaced the original failure.
     *
     * @return true if escalated
     */
    public boolean isEscalated() {
        return escalated;
    }

    /**
     * Checks if the failure was a cancellation signal.
     *
     * @return true for cancellation kinds
     */
    public boolean isCancellation() {
        return cancellation;
    }

    /**
     * Shortcut for {@code decision().isRetry()}.
     *
     * @return true if the session may try again
     */
    public boolean isRetry() {
        return decision.isRetry();
    }

    @Override
    public String toString() {
        return "Classification[" + decision.name()
                + (escalated ? ", escalated" : "")
                + (cancellation ? ", cancellation" : "")
                + ", failure=" + failure.getClass().getSimpleName() + "]";
    }
}
