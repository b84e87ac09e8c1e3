package taskweave.engine.error;

/**
 * Recorded on a task that was blocked because an upstream task did not succeed.
 */
public class DependencyFailedException extends TaskQueueException {

    private final String taskId;
    private final String rootCauseTaskId;

    public DependencyFailedException(String taskId, String rootCauseTaskId) {
        super("Task " + taskId + " blocked: dependency " + rootCauseTaskId + " did not succeed");
        this.taskId = taskId;
        this.rootCauseTaskId = rootCauseTaskId;
    }

    public String taskId() {
        return taskId;
    }

    public String rootCauseTaskId() {
        return rootCauseTaskId;
    }
}
