package express.mvp.retry.session;

import express.mvp.retry.ResultEvaluator;
import express.mvp.retry.error.UnacceptableResultException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Attempt outcome helpers shared by both session drivers. */
final class Results {

    private Results() {
        // Utility class
    }

    /**
     * Runs the result evaluator.
     *
     * @return null if the value is accepted, otherwise the failure to classify
     */
    static <T> Throwable evaluate(T value, ResultEvaluator<? super T> evaluator) {
        if (evaluator == null || value == null) {
            return null;
        }
        try {
            return evaluator.shouldRetry(value) ? new UnacceptableResultException(value) : null;
        } catch (Exception e) {
            return e;
        }
    }

    /** Strips the wrappers added by {@code CompletableFuture}. */
    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
