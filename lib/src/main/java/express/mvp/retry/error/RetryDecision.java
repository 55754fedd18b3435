package express.mvp.retry.error;

/**
 * Outcome of classifying a failed attempt.
 *
 * @see ErrorClassifier
 */
public enum RetryDecision {

    /** The failure is assumed transient: the session may try again. */
    RETRY(true, "Retriable failure - try again after backoff"),

    /** The failure is final: the session ends and the failure is reported to the caller. */
    STOP(false, "Non-retriable failure - propagate to caller");

    private final boolean retry;
    private final String description;

    RetryDecision(boolean retry, String description) {
        this.retry = retry;
        this.description = description;
    }

    /**
     * Checks if this decision allows another attempt.
     *
     * @return true only for {@link #RETRY}
     */
    public boolean isRetry() {
        return retry;
    }

    /**
     * Returns a human-readable description of this decision.
     *
     * @return the description
     */
    public String description() {
        return description;
    }

    /**
     * Maps a boolean verdict to a decision.
     *
     * @param retry true to retry
     * @return {@link #RETRY} or {@link #STOP}
     */
    public static RetryDecision of(boolean retry) {
        return retry ? RETRY : STOP;
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
