package express.mvp.retry;

/**
 * Thrown eagerly when a retry component is configured with invalid parameters.
 *
 * <p>Raised by builders and factory methods, never during a run.
 */
public class RetryConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception.
     *
     * @param message description of the invalid parameter
     */
    public RetryConfigurationException(String message) {
        super(message);
    }
}
