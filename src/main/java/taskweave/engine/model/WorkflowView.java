package taskweave.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Consistent read-only view of a workflow, as returned by {@code getWorkflowStatus()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowView(
        @JsonProperty("workflowId") String workflowId,
        @JsonProperty("status") WorkflowStatus status,
        @JsonProperty("strategy") ExecutionStrategy strategy,
        @JsonProperty("maxConcurrent") int maxConcurrent,
        @JsonProperty("continueOnFailure") boolean continueOnFailure,
        @JsonProperty("stats") QueueStats stats,
        @JsonProperty("runningTaskIds") List<String> runningTaskIds,
        @JsonProperty("rootCauseTaskIds") List<String> rootCauseTaskIds,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    public WorkflowView {
        runningTaskIds = runningTaskIds == null ? List.of() : List.copyOf(runningTaskIds);
        rootCauseTaskIds = rootCauseTaskIds == null ? List.of() : List.copyOf(rootCauseTaskIds);
    }

    /** Calculate progress percentage */
    public int progressPercent() {
        if (stats.total() == 0)
            return 0;
        return (stats.total() - stats.unfinished()) * 100 / stats.total();
    }
}
