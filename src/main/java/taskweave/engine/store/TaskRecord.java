package taskweave.engine.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskweave.engine.model.ErrorKind;
import taskweave.engine.model.Task;
import taskweave.engine.model.TaskPayload;
import taskweave.engine.model.TaskPriority;
import taskweave.engine.model.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Persisted form of a {@link Task}. The result is held as plain JSON values
 * so every store can encode it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskRecord(
        @JsonProperty("id") String id,
        @JsonProperty("payload") TaskPayload payload,
        @JsonProperty("priority") TaskPriority priority,
        @JsonProperty("dependencies") List<String> dependencies,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("maxAttempts") int maxAttempts,
        @JsonProperty("timeoutMs") Long timeoutMs,
        @JsonProperty("sequence") long sequence,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("nextAttemptAt") Instant nextAttemptAt,
        @JsonProperty("result") Object result,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("errorKind") ErrorKind errorKind,
        @JsonProperty("errorHistory") List<String> errorHistory) {

    public TaskRecord {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        tags = tags == null ? List.of() : List.copyOf(tags);
        errorHistory = errorHistory == null ? List.of() : List.copyOf(errorHistory);
    }

    public static TaskRecord from(Task task) {
        return new TaskRecord(
                task.id(),
                task.payload(),
                task.priority(),
                List.copyOf(task.dependencies()),
                task.tags(),
                task.status(),
                task.attempts(),
                task.maxAttempts(),
                task.timeout() != null ? task.timeout().toMillis() : null,
                task.sequence(),
                task.createdAt(),
                task.startedAt(),
                task.finishedAt(),
                task.nextAttemptAt(),
                SnapshotCodec.toPlainValue(task.id(), task.result()),
                task.errorMessage(),
                task.errorKind(),
                task.errorHistory());
    }

    public Task toTask(String workflowId) {
        return Task.builder()
                .id(id)
                .workflowId(workflowId)
                .payload(payload)
                .priority(priority)
                .dependencies(new LinkedHashSet<>(dependencies))
                .tags(tags)
                .status(status)
                .attempts(attempts)
                .maxAttempts(maxAttempts)
                .timeout(timeoutMs != null ? Duration.ofMillis(timeoutMs) : null)
                .sequence(sequence)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .nextAttemptAt(nextAttemptAt)
                .result(result)
                .errorMessage(errorMessage)
                .errorKind(errorKind)
                .errorHistory(errorHistory)
                .build();
    }
}
