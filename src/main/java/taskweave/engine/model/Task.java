package taskweave.engine.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable domain model representing a unit of work in a queue.
 * Every state change produces a new instance via {@link #toBuilder()}.
 */
public final class Task {
    private final String id;
    private final String workflowId;
    private final TaskPayload payload;
    private final TaskPriority priority;
    private final Set<String> dependencies;
    private final List<String> tags;
    private final TaskStatus status;
    private final int attempts;
    private final int maxAttempts;
    private final Duration timeout; // null means no deadline
    private final long sequence;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final Instant nextAttemptAt;
    private final Object result;
    private final String errorMessage;
    private final ErrorKind errorKind;
    private final List<String> errorHistory;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.workflowId = builder.workflowId;
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.dependencies = builder.dependencies == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(builder.dependencies));
        this.tags = builder.tags == null ? List.of() : List.copyOf(builder.tags);
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.attempts = builder.attempts;
        this.maxAttempts = builder.maxAttempts;
        this.timeout = builder.timeout;
        this.sequence = builder.sequence;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
        this.nextAttemptAt = builder.nextAttemptAt;
        this.result = builder.result;
        this.errorMessage = builder.errorMessage;
        this.errorKind = builder.errorKind;
        this.errorHistory = builder.errorHistory == null ? List.of() : List.copyOf(builder.errorHistory);
    }

    // Getters
    public String id() {
        return id;
    }

    public String workflowId() {
        return workflowId;
    }

    public TaskPayload payload() {
        return payload;
    }

    public TaskPriority priority() {
        return priority;
    }

    public Set<String> dependencies() {
        return dependencies;
    }

    public List<String> tags() {
        return tags;
    }

    public TaskStatus status() {
        return status;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration timeout() {
        return timeout;
    }

    public long sequence() {
        return sequence;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public Instant nextAttemptAt() {
        return nextAttemptAt;
    }

    public Object result() {
        return result;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }

    public List<String> errorHistory() {
        return errorHistory;
    }

    /** Check if another attempt is allowed */
    public boolean canRetry() {
        return attempts < maxAttempts;
    }

    /** Check if task is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    /** Deadline of the current attempt, or null when the task has no timeout or is not running */
    public Instant deadline() {
        if (timeout == null || startedAt == null) {
            return null;
        }
        return startedAt.plus(timeout);
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .workflowId(workflowId)
                .payload(payload)
                .priority(priority)
                .dependencies(dependencies)
                .tags(tags)
                .status(status)
                .attempts(attempts)
                .maxAttempts(maxAttempts)
                .timeout(timeout)
                .sequence(sequence)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .nextAttemptAt(nextAttemptAt)
                .result(result)
                .errorMessage(errorMessage)
                .errorKind(errorKind)
                .errorHistory(errorHistory);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String workflowId;
        private TaskPayload payload;
        private TaskPriority priority = TaskPriority.NORMAL;
        private Set<String> dependencies;
        private List<String> tags;
        private TaskStatus status = TaskStatus.PENDING;
        private int attempts = 0;
        private int maxAttempts = 3;
        private Duration timeout;
        private long sequence;
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;
        private Instant nextAttemptAt;
        private Object result;
        private String errorMessage;
        private ErrorKind errorKind;
        private List<String> errorHistory;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder payload(TaskPayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder dependencies(Set<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
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

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder nextAttemptAt(Instant nextAttemptAt) {
            this.nextAttemptAt = nextAttemptAt;
            return this;
        }

        public Builder result(Object result) {
            this.result = result;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder errorKind(ErrorKind errorKind) {
            this.errorKind = errorKind;
            return this;
        }

        public Builder errorHistory(List<String> errorHistory) {
            this.errorHistory = errorHistory;
            return this;
        }

        /** Append one line to the error history */
        public Builder addError(String entry) {
            List<String> copy = errorHistory == null ? new ArrayList<>() : new ArrayList<>(errorHistory);
            copy.add(entry);
            this.errorHistory = copy;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', status=" + status + ", priority=" + priority
                + ", attempts=" + attempts + "/" + maxAttempts + "}";
    }
}
