package express.mvp.retry.error;

import express.mvp.retry.RetryCancelledException;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether a failed attempt should be retried.
 *
 * <h2>Classification Strategy</h2>
 *
 * <ol>
 *   <li>Cancellation kinds ({@link CancellationException}, {@link InterruptedException},
 *       {@link RetryCancelledException}) always stop and never reach the evaluator
 *   <li>Whitelisted kinds stop
 *   <li>If an {@link ErrorEvaluator} is configured, its verdict is final; if it throws, the thrown
 *       exception replaces the failure and the session stops
 *   <li>Blacklisted kinds retry
 *   <li>Everything else retries
 * </ol>
 *
 * <p>Each call reads one {@link ClassificationLists.Snapshot}, so concurrent list updates never
 * produce a decision mixing two versions of the lists.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ClassificationLists lists = new ClassificationLists();
 * lists.addWhitelisted(AuthenticationException.class);
 * lists.addBlacklisted(SocketTimeoutException.class);
 *
 * ErrorClassifier classifier = new ErrorClassifier(lists, null);
 * if (classifier.classify(failure).isRetry()) {
 *     // back off and try again
 * }
 * }</pre>
 *
 * @see ClassificationLists
 * @see ErrorEvaluator
 */
public final class ErrorClassifier {

    private static final Logger LOGGER = Logger.getLogger(ErrorClassifier.class.getName());

    private final ClassificationLists lists;
    private final ErrorEvaluator evaluator;

    /**
     * Creates a classifier.
     *
     * @param lists the classification lists to consult
     * @param evaluator optional custom evaluator (may be null)
     */
    public ErrorClassifier(ClassificationLists lists, ErrorEvaluator evaluator) {
        this.lists = Objects.requireNonNull(lists, "lists");
        this.evaluator = evaluator;
    }

    /**
     * Classifies a failure.
     *
     * @param failure the failure raised by an attempt
     * @return the classification
     * @throws NullPointerException if failure is null
     */
    public Classification classify(Throwable failure) {
        Objects.requireNonNull(failure, "failure");

        if (isCancellation(failure)) {
            return Classification.cancelled(failure);
        }

        ClassificationLists.Snapshot view = lists.snapshot();

        if (view.isWhitelisted(failure)) {
            return Classification.stop(failure);
        }

        if (evaluator != null) {
            boolean retry;
            try {
                retry = evaluator.shouldRetry(failure);
            } catch (Exception evaluatorFailure) {
                LOGGER.log(
                        Level.FINE,
                        "Error evaluator failed on " + failure.getClass().getName(),
                        evaluatorFailure);
                if (evaluatorFailure != failure) {
                    evaluatorFailure.addSuppressed(failure);
                }
                return Classification.escalated(evaluatorFailure);
            }
            return retry ? Classification.retry(failure) : Classification.stop(failure);
        }

        if (view.isBlacklisted(failure)) {
            return Classification.retry(failure);
        }

        return Classification.retry(failure);
    }

    /**
     * Checks if the failure is a cancellation signal.
     *
     * @param failure the failure
     * @return true for cancellation kinds
     */
    public static boolean isCancellation(Throwable failure) {
        return failure instanceof CancellationException
                || failure instanceof InterruptedException
                || failure instanceof RetryCancelledException;
    }

    /**
     * Returns the lists this classifier consults.
     *
     * @return the lists
     */
    public ClassificationLists getLists() {
        return lists;
    }

    /**
     * Returns whether a custom evaluator is configured.
     *
     * @return true if an evaluator is present
     */
    public boolean hasEvaluator() {
        return evaluator != null;
    }
}
