package taskweave.engine.error;

/**
 * The executor reported a failed attempt. Executors may throw it directly to
 * control whether the attempt is retried.
 */
public class TaskExecutionException extends TaskQueueException {

    private final boolean retryable;

    public TaskExecutionException(String message) {
        this(message, true);
    }

    public TaskExecutionException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = true;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
