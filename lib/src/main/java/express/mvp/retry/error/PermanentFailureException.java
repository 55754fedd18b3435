package express.mvp.retry.error;

/**
 * Base class for application failures that must never be retried.
 *
 * <p>This type is on the default whitelist of {@link ClassificationLists}, so any subclass stops
 * the session immediately. A subclass can opt back into normal classification by overriding
 * {@link #isRetriable()}.
 *
 * <pre>{@code
 * class InvalidCredentialsException extends PermanentFailureException { ... }
 *
 * class RateLimitedException extends PermanentFailureException {
 *     @Override
 *     public boolean isRetriable() {
 *         return true;
 *     }
 * }
 * }</pre>
 */
public class PermanentFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception with the specified message.
     *
     * @param message the detail message
     */
    public PermanentFailureException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified message and cause.
     *
     * @param message the detail message
     * @param cause the underlying cause
     */
    public PermanentFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns whether this failure is exempt from the whitelist.
     *
     * @return false by default
     */
    public boolean isRetriable() {
        return false;
    }
}
