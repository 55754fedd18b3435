package express.mvp.retry.session;

/**
 * States of a retry session.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 * ┌──────┐ start() ┌────────────┐  success   ┌───────────┐
 * │ INIT │────────▶│ ATTEMPTING │───────────▶│ SUCCEEDED │
 * └──────┘         └────────────┘            └───────────┘
 *                    │   ▲    │
 *         retriable  │   │    │ stop / budget spent / cancel
 *          failure   ▼   │    ▼
 *            ┌──────────┐ │  ┌──────────────────────────────────────┐
 *            │ RETRYING │─┘  │ FAILED_TERMINAL, ATTEMPTS_EXHAUSTED, │
 *            └──────────┘    │ TIMED_OUT, CANCELLED                 │
 *                 │          └──────────────────────────────────────┘
 *                 └─── timeout / cancel ──▶ TIMED_OUT, CANCELLED
 * </pre>
 *
 * @see RetryStateMachine
 */
public enum SessionState {

    /** Created, no attempt made yet. */
    INIT(false, false),

    /** An attempt is running. */
    ATTEMPTING(false, false),

    /** Waiting out the backoff delay before the next attempt. */
    RETRYING(false, false),

    /** The operation returned an accepted value. */
    SUCCEEDED(true, true),

    /** A failure was classified as non-retriable. */
    FAILED_TERMINAL(true, false),

    /** A retriable failure occurred with no attempts left. */
    ATTEMPTS_EXHAUSTED(true, false),

    /** The time budget ran out. */
    TIMED_OUT(true, false),

    /** The caller aborted the session. */
    CANCELLED(true, false);

    private final boolean terminal;
    private final boolean successful;

    SessionState(boolean terminal, boolean successful) {
        this.terminal = terminal;
        this.successful = successful;
    }

    /**
     * Checks if the session has ended.
     *
     * @return true for terminal states
     */
    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Checks if the session ended with a value.
     *
     * @return true only for {@link #SUCCEEDED}
     */
    public boolean isSuccessful() {
        return successful;
    }
}
