package taskweave.engine.model;

import org.junit.jupiter.api.Test;
import taskweave.engine.config.PersistenceMode;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @Test
    void terminalStatesAllowNoTransition() {
        for (TaskStatus terminal : new TaskStatus[] { TaskStatus.SUCCEEDED, TaskStatus.FAILED,
                TaskStatus.BLOCKED, TaskStatus.CANCELLED }) {
            assertTrue(terminal.isTerminal());
            for (TaskStatus target : TaskStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
    }

    @Test
    void retryGoesBackThroughReady() {
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.RETRY_PENDING));
        assertTrue(TaskStatus.RETRY_PENDING.canTransitionTo(TaskStatus.READY));
        assertFalse(TaskStatus.RETRY_PENDING.canTransitionTo(TaskStatus.RUNNING));
        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.RUNNING));
    }

    @Test
    void workflowTransitions() {
        assertTrue(WorkflowStatus.PENDING.canTransitionTo(WorkflowStatus.RUNNING));
        assertTrue(WorkflowStatus.RUNNING.canTransitionTo(WorkflowStatus.PAUSED));
        assertTrue(WorkflowStatus.PAUSED.canTransitionTo(WorkflowStatus.RUNNING));
        assertFalse(WorkflowStatus.PAUSED.canTransitionTo(WorkflowStatus.COMPLETED));
        assertFalse(WorkflowStatus.COMPLETED.canTransitionTo(WorkflowStatus.RUNNING));
        assertFalse(WorkflowStatus.CANCELLED.canTransitionTo(WorkflowStatus.RUNNING));
    }

    @Test
    void adaptiveConcurrencyFollowsReadyWidth() {
        assertEquals(1, ExecutionStrategy.SEQUENTIAL.effectiveConcurrency(5, 10));
        assertEquals(5, ExecutionStrategy.PARALLEL.effectiveConcurrency(5, 1));
        assertEquals(2, ExecutionStrategy.ADAPTIVE.effectiveConcurrency(5, 2));
        assertEquals(5, ExecutionStrategy.ADAPTIVE.effectiveConcurrency(5, 9));
        assertEquals(1, ExecutionStrategy.ADAPTIVE.effectiveConcurrency(5, 0));
    }

    @Test
    void priorityLevels() {
        assertEquals(TaskPriority.CRITICAL, TaskPriority.fromLevel(0));
        assertEquals(TaskPriority.BACKGROUND, TaskPriority.fromLevel(4));
        assertThrows(IllegalArgumentException.class, () -> TaskPriority.fromLevel(9));
    }

    @Test
    void strategyNamesParseUnderTurkishLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(ExecutionStrategy.ADAPTIVE, ExecutionStrategy.parse("adaptive"));
            assertEquals(ExecutionStrategy.PARALLEL, ExecutionStrategy.parse(" parallel "));
            assertEquals(PersistenceMode.FILE, PersistenceMode.parse("file"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
