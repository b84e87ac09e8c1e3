package taskweave.engine.queue;

import taskweave.engine.model.Task;
import taskweave.engine.model.TaskStatus;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Authoritative store of task records, keyed by id in submission order.
 *
 * Mutations happen under the owning queue's lock. Readers use {@link #view()},
 * an immutable copy republished by {@link #publish()}, and never block the writer.
 */
final class TaskRegistry {

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private long nextSequence;
    private volatile Map<String, Task> view = Map.of();

    TaskRegistry(long nextSequence) {
        this.nextSequence = nextSequence;
    }

    long nextSequence() {
        return nextSequence;
    }

    /** Reserve the next creation sequence number */
    long allocateSequence() {
        return nextSequence++;
    }

    Task get(String id) {
        return tasks.get(id);
    }

    boolean contains(String id) {
        return tasks.containsKey(id);
    }

    Collection<Task> all() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    int size() {
        return tasks.size();
    }

    /** Insert a new task or overwrite one during restore; no transition check */
    void put(Task task) {
        tasks.put(task.id(), task);
    }

    void remove(String id) {
        tasks.remove(id);
    }

    /**
     * Move a task to {@code target}, applying {@code changes} to the new record.
     *
     * @throws IllegalArgumentException if the task is unknown
     * @throws IllegalStateException    if the state machine forbids the move
     */
    Task transition(String id, TaskStatus target, UnaryOperator<Task.Builder> changes) {
        Task current = tasks.get(id);
        if (current == null) {
            throw new IllegalArgumentException("Unknown task: " + id);
        }
        if (!current.status().canTransitionTo(target)) {
            throw new IllegalStateException("Task " + id + ": illegal transition "
                    + current.status() + " -> " + target);
        }
        Task updated = changes.apply(current.toBuilder().status(target)).build();
        tasks.put(id, updated);
        return updated;
    }

    /** Rewrite a task without changing its status */
    Task update(String id, UnaryOperator<Task.Builder> changes) {
        Task current = tasks.get(id);
        if (current == null) {
            throw new IllegalArgumentException("Unknown task: " + id);
        }
        Task updated = changes.apply(current.toBuilder()).build();
        tasks.put(id, updated);
        return updated;
    }

    /** Make the current state visible to lock-free readers */
    void publish() {
        view = Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
    }

    Map<String, Task> view() {
        return view;
    }
}
