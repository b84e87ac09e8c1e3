package taskweave.engine.error;

/**
 * A submission was rejected. Nothing from the rejected submission was added.
 */
public class TaskValidationException extends TaskQueueException {

    /** Why a submission was rejected */
    public enum Reason {
        DUPLICATE_ID,
        UNKNOWN_DEPENDENCY,
        CYCLE_DETECTED,
        INVALID_DESCRIPTOR,
        WORKFLOW_CLOSED
    }

    private final Reason reason;
    private final String taskId;

    public TaskValidationException(Reason reason, String taskId, String message) {
        super(message);
        this.reason = reason;
        this.taskId = taskId;
    }

    public Reason reason() {
        return reason;
    }

    /** Offending task id, may be null for descriptor-level problems */
    public String taskId() {
        return taskId;
    }
}
