package express.mvp.retry.error;

/**
 * Failure raised when a {@link express.mvp.retry.ResultEvaluator} rejects a returned value.
 *
 * <p>It is classified like any other failure, so by default the rejected result is retried. The
 * rejected value stays available through {@link #getResult()}.
 */
public class UnacceptableResultException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Object result;

    /**
     * Constructs a new exception for a rejected result.
     *
     * @param result the rejected value
     */
    public UnacceptableResultException(Object result) {
        super("Result rejected by evaluator: " + result);
        this.result = result;
    }

    /**
     * Returns the rejected value.
     *
     * @return the value returned by the operation
     */
    public Object getResult() {
        return result;
    }
}
