package taskweave.engine.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Task execution status.
 *
 * Transitions follow a fixed state machine:
 * PENDING -> READY -> RUNNING -> {SUCCEEDED | RETRY_PENDING | FAILED | BLOCKED | CANCELLED},
 * RETRY_PENDING -> READY. Waiting states may also move to BLOCKED or CANCELLED.
 */
public enum TaskStatus {
    /** Submitted, waiting for its dependencies */
    PENDING,
    /** Dependencies satisfied, sitting in the ready queue */
    READY,
    /** Occupies a worker slot */
    RUNNING,
    /** Failed an attempt, waiting for its backoff to elapse */
    RETRY_PENDING,
    /** Finished successfully */
    SUCCEEDED,
    /** Failed terminally (attempts exhausted or permanent error) */
    FAILED,
    /** Never ran because an upstream task did not succeed */
    BLOCKED,
    /** Cancelled by the caller or by a workflow cancel */
    CANCELLED;

    private Set<TaskStatus> next;

    static {
        PENDING.next = EnumSet.of(READY, BLOCKED, CANCELLED);
        READY.next = EnumSet.of(RUNNING, BLOCKED, CANCELLED);
        RUNNING.next = EnumSet.of(SUCCEEDED, RETRY_PENDING, FAILED, BLOCKED, CANCELLED);
        RETRY_PENDING.next = EnumSet.of(READY, BLOCKED, CANCELLED);
        SUCCEEDED.next = EnumSet.noneOf(TaskStatus.class);
        FAILED.next = EnumSet.noneOf(TaskStatus.class);
        BLOCKED.next = EnumSet.noneOf(TaskStatus.class);
        CANCELLED.next = EnumSet.noneOf(TaskStatus.class);
    }

    public boolean canTransitionTo(TaskStatus target) {
        return next.contains(target);
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == BLOCKED || this == CANCELLED;
    }

    /** Still owes work: not terminal. */
    public boolean isWaiting() {
        return this == PENDING || this == READY || this == RETRY_PENDING;
    }
}
