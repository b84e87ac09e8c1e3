package taskweave.engine.error;

/**
 * Raised by {@code CancellationToken.throwIfCancelled()} once a task or its
 * workflow has been cancelled. Cancelled attempts are never retried.
 */
public class TaskCancelledException extends TaskQueueException {

    public TaskCancelledException(String message) {
        super(message);
    }
}
