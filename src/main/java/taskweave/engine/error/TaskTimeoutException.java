package taskweave.engine.error;

import java.time.Duration;

/**
 * An attempt ran past its deadline and was abandoned.
 */
public class TaskTimeoutException extends TaskQueueException {

    private final Duration timeout;

    public TaskTimeoutException(String taskId, Duration timeout) {
        super("Task " + taskId + " timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
