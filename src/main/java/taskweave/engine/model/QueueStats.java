package taskweave.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time task counts of a queue.
 */
public record QueueStats(
        @JsonProperty("total") int total,
        @JsonProperty("byStatus") Map<TaskStatus, Integer> byStatus,
        @JsonProperty("readyQueued") int readyQueued) {

    public QueueStats {
        EnumMap<TaskStatus, Integer> copy = new EnumMap<>(TaskStatus.class);
        for (TaskStatus s : TaskStatus.values()) {
            copy.put(s, byStatus == null ? 0 : byStatus.getOrDefault(s, 0));
        }
        byStatus = Collections.unmodifiableMap(copy);
    }

    public static QueueStats of(Collection<Task> tasks, int readyQueued) {
        EnumMap<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (Task t : tasks) {
            counts.merge(t.status(), 1, Integer::sum);
        }
        return new QueueStats(tasks.size(), counts, readyQueued);
    }

    public int count(TaskStatus status) {
        return byStatus.get(status);
    }

    public int running() {
        return count(TaskStatus.RUNNING);
    }

    /** Tasks that are not terminal yet */
    public int unfinished() {
        return count(TaskStatus.PENDING) + count(TaskStatus.READY)
                + count(TaskStatus.RUNNING) + count(TaskStatus.RETRY_PENDING);
    }
}
