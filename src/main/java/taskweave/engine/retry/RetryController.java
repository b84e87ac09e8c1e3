package taskweave.engine.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskweave.engine.error.TaskExecutionException;
import taskweave.engine.model.ErrorKind;
import taskweave.engine.model.Task;

import java.time.Instant;

/**
 * Decides whether a failed attempt is retried and when.
 *
 * The attempt has already been counted when the task was dispatched, so
 * {@code task.attempts()} is the number of the attempt that just failed.
 * Cancellations never reach this class.
 */
public final class RetryController {

    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    private final RetryPolicy policy;
    private final ErrorClassifier classifier;

    public RetryController(RetryPolicy policy) {
        this(policy, new ErrorClassifier());
    }

    public RetryController(RetryPolicy policy, ErrorClassifier classifier) {
        this.policy = policy;
        this.classifier = classifier;
    }

    public RetryPolicy policy() {
        return policy;
    }

    public RetryDecision onFailure(Task task, Throwable error, Instant now) {
        ErrorKind kind = ErrorKind.of(error);
        String message = describe(error);
        ErrorCategory category = classifier.classify(message);

        boolean retryable = !(error instanceof TaskExecutionException tee) || tee.isRetryable();
        if (retryable && policy.classifyErrors() && !category.isRetryable()) {
            log.debug("Task {}: {} error is not retried", task.id(), category);
            retryable = false;
        }

        if (retryable && task.canRetry()) {
            return RetryDecision.retry(policy.delayFor(task.attempts()), now, kind, category, message);
        }
        return RetryDecision.fail(kind, category, message);
    }

    /** Message recorded for an error; falls back to the exception class name */
    static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }
}
