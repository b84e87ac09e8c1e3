package taskweave.engine.queue;

import taskweave.engine.model.Task;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Ready tasks ordered by dispatch key: priority level ascending, then creation
 * sequence ascending. Equal-priority tasks leave in submission order.
 *
 * Not thread-safe.
 */
public final class ReadyQueue {

    /** Dispatch key of one queued task */
    record Entry(String taskId, int priority, long sequence) {
    }

    static final Comparator<Entry> DISPATCH_ORDER = Comparator
            .comparingInt(Entry::priority)
            .thenComparingLong(Entry::sequence);

    private final PriorityQueue<Entry> heap = new PriorityQueue<>(DISPATCH_ORDER);
    private final Set<String> queued = new HashSet<>();

    /**
     * Enqueue a task. A task already queued is left where it is.
     *
     * @return true if the task was added
     */
    public boolean offer(Task task) {
        if (!queued.add(task.id())) {
            return false;
        }
        heap.add(new Entry(task.id(), task.priority().level(), task.sequence()));
        return true;
    }

    /** Remove and return the most urgent task id */
    public Optional<String> poll() {
        Entry e = heap.poll();
        if (e == null) {
            return Optional.empty();
        }
        queued.remove(e.taskId());
        return Optional.of(e.taskId());
    }

    public boolean remove(String taskId) {
        if (!queued.remove(taskId)) {
            return false;
        }
        heap.removeIf(e -> e.taskId().equals(taskId));
        return true;
    }

    public boolean contains(String taskId) {
        return queued.contains(taskId);
    }

    public int size() {
        return heap.size();
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    /** Queued ids in dispatch order, without removing them */
    public List<String> ids() {
        List<Entry> entries = new ArrayList<>(heap);
        entries.sort(DISPATCH_ORDER);
        return entries.stream().map(Entry::taskId).toList();
    }

    /** Drop everything, returning what was queued in dispatch order */
    public List<String> clear() {
        List<String> ids = ids();
        heap.clear();
        queued.clear();
        return ids;
    }
}
