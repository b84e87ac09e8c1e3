package taskweave.engine.model;

import taskweave.engine.error.DependencyFailedException;
import taskweave.engine.error.TaskCancelledException;
import taskweave.engine.error.TaskTimeoutException;

/**
 * Category of the error recorded on a task.
 */
public enum ErrorKind {
    /** Executor reported failure or threw */
    EXECUTION,
    /** Attempt exceeded its deadline */
    TIMEOUT,
    /** Workflow- or task-level cancel */
    CANCELLED,
    /** Upstream task failed, was blocked or cancelled */
    DEPENDENCY_FAILED;

    public static ErrorKind of(Throwable error) {
        if (error instanceof TaskTimeoutException) {
            return TIMEOUT;
        }
        if (error instanceof TaskCancelledException) {
            return CANCELLED;
        }
        if (error instanceof DependencyFailedException) {
            return DEPENDENCY_FAILED;
        }
        return EXECUTION;
    }
}
