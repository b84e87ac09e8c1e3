package taskweave.engine.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskweave.engine.api.Controller;
import taskweave.engine.api.v1.dto.HealthResponse;
import taskweave.engine.model.QueueStats;
import taskweave.engine.model.TaskStatus;
import taskweave.engine.model.WorkflowView;
import taskweave.engine.server.RouterHandler;
import taskweave.engine.store.SnapshotStore;
import taskweave.engine.workflow.WorkflowOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final WorkflowOrchestrator orchestrator;
    private final SnapshotStore snapshotStore;

    public HealthController(WorkflowOrchestrator orchestrator, SnapshotStore snapshotStore) {
        this.orchestrator = orchestrator;
        this.snapshotStore = snapshotStore;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!snapshotStore.isHealthy()) {
                HealthResponse response = HealthResponse.unhealthy(snapshotStore.kind() + ": unavailable");
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            }

            WorkflowView view = orchestrator.getWorkflowStatus();
            QueueStats stats = view.stats();
            int waiting = stats.count(TaskStatus.PENDING) + stats.count(TaskStatus.READY)
                    + stats.count(TaskStatus.RETRY_PENDING);

            HealthResponse response = HealthResponse.healthy(
                    snapshotStore.kind(), formatUptime(), VERSION, view.status().name(), waiting, stats.running());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (JsonProcessingException e) {
            log.error("Health check failed", e);
            return ControllerResponse.error("health check failed");
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
