package taskweave.engine.model;

/**
 * Workflow status representing the overall state of a task set.
 */
public enum WorkflowStatus {
    /** Created, loop not started yet */
    PENDING,
    /** Loop is dequeuing work */
    RUNNING,
    /** Dequeuing stopped; running tasks drain */
    PAUSED,
    /** Every task reached an accepted terminal state */
    COMPLETED,
    /** Some task failed terminally with continue-on-failure off */
    FAILED,
    /** Cancelled by the caller */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(WorkflowStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == PAUSED || target == CANCELLED;
            case RUNNING -> target == PAUSED || target == COMPLETED || target == FAILED || target == CANCELLED;
            case PAUSED -> target == RUNNING || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
