package taskweave.engine.workflow;

import taskweave.engine.model.Task;
import taskweave.engine.model.WorkflowSummary;
import taskweave.engine.retry.RetryDecision;

/**
 * Callbacks fired by the coordinating loop. Implementations must return quickly;
 * exceptions are logged and otherwise ignored.
 */
public interface WorkflowListener {

    default void onTaskSucceeded(Task task) {
    }

    default void onTaskRetrying(Task task, RetryDecision decision) {
    }

    /** Task failed terminally or was cancelled on its own */
    default void onTaskFailed(Task task) {
    }

    /** Task was blocked because an upstream task did not succeed */
    default void onTaskBlocked(Task task) {
    }

    default void onWorkflowFinished(WorkflowSummary summary) {
    }
}
