package taskweave.engine.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What a caller submits through {@code addTask}. Optional fields fall back to the
 * queue's configured defaults.
 *
 * @param id           unique id within the queue
 * @param payload      opaque value passed to the executor
 * @param priority     dispatch priority
 * @param dependencies ids of tasks that must finish first
 * @param maxAttempts  attempt budget, or null for the configured default
 * @param timeout      per-attempt deadline, or null for the configured default
 * @param tags         free-form labels for queries
 */
public record TaskDescriptor(
        String id,
        TaskPayload payload,
        TaskPriority priority,
        Set<String> dependencies,
        Integer maxAttempts,
        Duration timeout,
        List<String> tags) {

    public TaskDescriptor {
        priority = priority == null ? TaskPriority.NORMAL : priority;
        dependencies = dependencies == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private TaskPayload payload;
        private TaskPriority priority = TaskPriority.NORMAL;
        private final LinkedHashSet<String> dependencies = new LinkedHashSet<>();
        private Integer maxAttempts;
        private Duration timeout;
        private final ArrayList<String> tags = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder payload(TaskPayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder payload(String type) {
            this.payload = TaskPayload.of(type);
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder dependsOn(String... ids) {
            dependencies.addAll(List.of(ids));
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder tags(String... tags) {
            this.tags.addAll(List.of(tags));
            return this;
        }

        public TaskDescriptor build() {
            return new TaskDescriptor(id, payload, priority, dependencies, maxAttempts, timeout, tags);
        }
    }
}
