package express.mvp.retry.session;

import express.mvp.retry.RetryException;

/**
 * What a session driver must do next, as decided by {@link RetryStateMachine}.
 *
 * <p>Drivers differ only in how they carry out a step: the synchronous session blocks for
 * {@link #delayMillis()}, the asynchronous one schedules a timer.
 */
public final class RetryStep {

    /** Step kinds. */
    public enum Kind {
        /** Run the next attempt now. */
        PROCEED,
        /** Wait {@link #delayMillis()} and then resume. */
        WAIT,
        /** End the session by throwing {@link #exception()}. */
        TERMINATE
    }

    private static final RetryStep PROCEED = new RetryStep(Kind.PROCEED, 0, null);

    private final Kind kind;
    private final long delayMillis;
    private final RetryException exception;

    private RetryStep(Kind kind, long delayMillis, RetryException exception) {
        this.kind = kind;
        this.delayMillis = delayMillis;
        this.exception = exception;
    }

    static RetryStep proceed() {
        return PROCEED;
    }

    static RetryStep waitFor(long delayMillis) {
        return new RetryStep(Kind.WAIT, delayMillis, null);
    }

    static RetryStep terminate(RetryException exception) {
        return new RetryStep(Kind.TERMINATE, 0, exception);
    }

    /**
     * Returns the step kind.
     *
     * @return the kind
     */
    public Kind kind() {
        return kind;
    }

    /**
     * Returns the delay to wait for a {@link Kind#WAIT} step.
     *
     * @return delay in milliseconds
     */
    public long delayMillis() {
        return delayMillis;
    }

    /**
     * Returns the exception ending the session for a {@link Kind#TERMINATE} step.
     *
     * @return the exception, or null for other kinds
     */
    public RetryException exception() {
        return exception;
    }

    /**
     * Checks if this step ends the session.
     *
     * @return true for {@link Kind#TERMINATE}
     */
    public boolean isTerminal() {
        return kind == Kind.TERMINATE;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case WAIT -> "RetryStep[WAIT " + delayMillis + "ms]";
            case TERMINATE -> "RetryStep[TERMINATE " + exception.getClass().getSimpleName() + "]";
            case PROCEED -> "RetryStep[PROCEED]";
        };
    }
}
