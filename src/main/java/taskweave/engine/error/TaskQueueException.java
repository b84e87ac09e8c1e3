package taskweave.engine.error;

/**
 * Base class of all errors raised by the queue engine.
 */
public class TaskQueueException extends RuntimeException {

    public TaskQueueException(String message) {
        super(message);
    }

    public TaskQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
