package express.mvp.retry;

/**
 * Decides whether a successfully returned value should nevertheless be retried.
 *
 * <p>Useful for operations that report failure through their return value (status codes, empty
 * pages). When {@link #shouldRetry(Object)} returns true the attempt is treated as failed with an
 * {@link express.mvp.retry.error.UnacceptableResultException}. If the evaluator throws, the thrown
 * exception becomes the attempt's failure. {@code null} results are accepted without evaluation.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface ResultEvaluator<T> {

    /**
     * Evaluates a result.
     *
     * @param result the non-null value returned by the operation
     * @return true to retry, false to accept the result
     * @throws Exception to fail the attempt with a specific exception
     */
    boolean shouldRetry(T result) throws Exception;
}
