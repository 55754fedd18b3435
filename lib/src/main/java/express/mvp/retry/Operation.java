package express.mvp.retry;

/**
 * A fallible, blocking unit of work guarded by a retry session.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface Operation<T> {

    /**
     * Performs one attempt.
     *
     * @return the result
     * @throws Exception if the attempt failed
     */
    T call() throws Exception;
}
