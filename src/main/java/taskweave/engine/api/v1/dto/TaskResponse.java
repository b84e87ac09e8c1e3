package taskweave.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskweave.engine.model.Task;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for one task.
 * The payload is echoed by type only; its attributes belong to the executor.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("status") String status,
        @JsonProperty("payloadType") String payloadType,
        @JsonProperty("priority") String priority,
        @JsonProperty("dependencies") List<String> dependencies,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("maxAttempts") int maxAttempts,
        @JsonProperty("timeoutMs") Long timeoutMs,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("nextAttemptAt") Instant nextAttemptAt,
        @JsonProperty("result") Object result,
        @JsonProperty("errorKind") String errorKind,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("errorHistory") List<String> errorHistory) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.status().name(),
                task.payload().type(),
                task.priority().name(),
                List.copyOf(task.dependencies()),
                task.tags(),
                task.attempts(),
                task.maxAttempts(),
                task.timeout() != null ? task.timeout().toMillis() : null,
                task.createdAt(),
                task.startedAt(),
                task.finishedAt(),
                task.nextAttemptAt(),
                task.result(),
                task.errorKind() != null ? task.errorKind().name() : null,
                task.errorMessage(),
                task.errorHistory().isEmpty() ? null : task.errorHistory());
    }
}
