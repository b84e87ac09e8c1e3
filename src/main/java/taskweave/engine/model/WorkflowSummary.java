package taskweave.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import taskweave.engine.error.WorkflowFailedException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one {@code processQueue} run.
 *
 * @param rootCauseTaskIds tasks that failed or were cancelled on their own, in failure order;
 *                         blocked dependents are not root causes
 * @param errors           error message per task that did not succeed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowSummary(
        @JsonProperty("workflowId") String workflowId,
        @JsonProperty("status") WorkflowStatus status,
        @JsonProperty("strategy") ExecutionStrategy strategy,
        @JsonProperty("stats") QueueStats stats,
        @JsonProperty("rootCauseTaskIds") List<String> rootCauseTaskIds,
        @JsonProperty("errors") Map<String, String> errors,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    public WorkflowSummary {
        rootCauseTaskIds = rootCauseTaskIds == null ? List.of() : List.copyOf(rootCauseTaskIds);
        errors = errors == null ? Map.of() : Map.copyOf(errors);
    }

    public boolean isSuccess() {
        return status == WorkflowStatus.COMPLETED && stats.count(TaskStatus.SUCCEEDED) == stats.total();
    }

    public Duration duration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }

    /**
     * Return this summary, or throw if the workflow ended FAILED.
     */
    public WorkflowSummary orThrow() {
        if (status == WorkflowStatus.FAILED) {
            throw new WorkflowFailedException(workflowId, rootCauseTaskIds);
        }
        return this;
    }
}
