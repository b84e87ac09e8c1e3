package taskweave.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("persistence") String persistence,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("workflowStatus") String workflowStatus,
        @JsonProperty("pendingTasks") Integer pendingTasks,
        @JsonProperty("runningTasks") Integer runningTasks) {

    public static HealthResponse healthy(String persistence, String uptime, String version, String workflowStatus,
            int pendingTasks, int runningTasks) {
        return new HealthResponse("healthy", persistence, uptime, version, workflowStatus, pendingTasks,
                runningTasks);
    }

    public static HealthResponse unhealthy(String persistence) {
        return new HealthResponse("unhealthy", persistence, null, null, null, null, null);
    }
}
