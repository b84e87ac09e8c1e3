package taskweave.engine.graph;

import taskweave.engine.model.Task;
import taskweave.engine.model.TaskStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Decides which tasks may run, based on the status of their dependencies.
 */
public final class DependencyResolver {

    private final boolean continueOnFailure;

    /**
     * @param continueOnFailure when true, any terminal dependency counts as satisfied
     */
    public DependencyResolver(boolean continueOnFailure) {
        this.continueOnFailure = continueOnFailure;
    }

    public boolean continueOnFailure() {
        return continueOnFailure;
    }

    /**
     * Check whether every dependency of {@code task} allows it to start.
     *
     * @param lookup resolves a task id to its current state
     */
    public boolean isSatisfied(Task task, Function<String, Task> lookup) {
        for (String depId : task.dependencies()) {
            Task dep = lookup.apply(depId);
            if (dep == null) {
                return false;
            }
            if (dep.status() == TaskStatus.SUCCEEDED) {
                continue;
            }
            if (continueOnFailure && dep.isTerminal()) {
                continue;
            }
            return false;
        }
        return true;
    }

    /**
     * A task is degraded when at least one dependency ended without succeeding.
     * Only possible under continue-on-failure.
     */
    public boolean isDegraded(Task task, Function<String, Task> lookup) {
        for (String depId : task.dependencies()) {
            Task dep = lookup.apply(depId);
            if (dep != null && dep.isTerminal() && dep.status() != TaskStatus.SUCCEEDED) {
                return true;
            }
        }
        return false;
    }

    /**
     * Tasks eligible for the ready queue at {@code now}: PENDING tasks with
     * satisfied dependencies, and RETRY_PENDING tasks whose backoff has elapsed.
     * Result keeps the order of {@code tasks}.
     */
    public List<Task> readySet(Collection<Task> tasks, Function<String, Task> lookup, Instant now) {
        List<Task> ready = new ArrayList<>();
        for (Task task : tasks) {
            if (task.status() == TaskStatus.PENDING && isSatisfied(task, lookup)) {
                ready.add(task);
            } else if (task.status() == TaskStatus.RETRY_PENDING && retryDue(task, now)) {
                ready.add(task);
            }
        }
        return ready;
    }

    /** Whether a terminal failure blocks the failed task's dependents */
    public boolean propagatesFailure() {
        return !continueOnFailure;
    }

    private static boolean retryDue(Task task, Instant now) {
        return task.nextAttemptAt() == null || !now.isBefore(task.nextAttemptAt());
    }
}
