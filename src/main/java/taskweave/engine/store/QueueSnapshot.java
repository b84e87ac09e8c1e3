package taskweave.engine.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskweave.engine.model.ExecutionStrategy;
import taskweave.engine.model.TaskStatus;
import taskweave.engine.model.WorkflowStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Everything needed to rebuild a workflow after a restart.
 *
 * @param nextSequence creation sequence the next submitted task receives
 * @param takenAt      when the snapshot was captured
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueueSnapshot(
        @JsonProperty("workflowId") String workflowId,
        @JsonProperty("status") WorkflowStatus status,
        @JsonProperty("strategy") ExecutionStrategy strategy,
        @JsonProperty("maxConcurrent") int maxConcurrent,
        @JsonProperty("continueOnFailure") boolean continueOnFailure,
        @JsonProperty("nextSequence") long nextSequence,
        @JsonProperty("rootCauseTaskIds") List<String> rootCauseTaskIds,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("takenAt") Instant takenAt,
        @JsonProperty("tasks") List<TaskRecord> tasks) {

    public QueueSnapshot {
        rootCauseTaskIds = rootCauseTaskIds == null ? List.of() : List.copyOf(rootCauseTaskIds);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public Optional<TaskRecord> task(String id) {
        return tasks.stream().filter(t -> t.id().equals(id)).findFirst();
    }

    public long count(TaskStatus status) {
        return tasks.stream().filter(t -> t.status() == status).count();
    }
}
