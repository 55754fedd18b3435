package express.mvp.retry;

import java.util.concurrent.CompletionStage;

/**
 * A fallible unit of work that completes asynchronously.
 *
 * <p>Each invocation starts one attempt. The attempt fails if this method throws or if the
 * returned stage completes exceptionally.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    /**
     * Starts one attempt.
     *
     * @return a stage completing with the attempt's outcome (must not be null)
     * @throws Exception if the attempt could not be started
     */
    CompletionStage<T> call() throws Exception;
}
