package taskweave.engine.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskweave.engine.api.Controller;
import taskweave.engine.api.v1.dto.OperationResponse;
import taskweave.engine.server.RouterHandler;
import taskweave.engine.workflow.WorkflowOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the workflow lifecycle (public API).
 *
 * GET /api/v1/workflow - Status, strategy, counts, running tasks
 * GET /api/v1/workflow/plan - Dependency levels and topological order
 * POST /api/v1/workflow/{pause|resume|cancel}
 */
public class WorkflowController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private static final String WORKFLOW_PATH = "/api/v1/workflow";
    private static final String PLAN_PATH = "/api/v1/workflow/plan";
    private static final Pattern ACTION_PATTERN = Pattern.compile("^/api/v1/workflow/(pause|resume|cancel)$");

    private final WorkflowOrchestrator orchestrator;

    public WorkflowController(WorkflowOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return WORKFLOW_PATH.equals(path) || PLAN_PATH.equals(path);
        }
        return method.equals(HttpMethod.POST) && ACTION_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (WORKFLOW_PATH.equals(path)) {
                return ControllerResponse.json(RouterHandler.mapper()
                        .writeValueAsString(orchestrator.getWorkflowStatus()));
            }
            if (PLAN_PATH.equals(path)) {
                return ControllerResponse.json(RouterHandler.mapper()
                        .writeValueAsString(orchestrator.executionPlan()));
            }

            Matcher m = ACTION_PATTERN.matcher(path);
            if (m.matches()) {
                String action = m.group(1);
                BooleanSupplier op = switch (action) {
                    case "pause" -> orchestrator::pause;
                    case "resume" -> orchestrator::resume;
                    default -> orchestrator::cancel;
                };
                return apply(action, op);
            }
            return ControllerResponse.notFound("unknown workflow endpoint");
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize workflow response", e);
        }
    }

    private ControllerResponse apply(String action, BooleanSupplier op) throws JsonProcessingException {
        boolean applied = op.getAsBoolean();
        String status = orchestrator.getWorkflowStatus().status().name();
        if (!applied) {
            OperationResponse response = OperationResponse.rejected(status, "cannot " + action + " in state " + status);
            return ControllerResponse.json(HttpResponseStatus.CONFLICT,
                    RouterHandler.mapper().writeValueAsString(response));
        }
        log.info("Workflow {} {} via API", orchestrator.workflowId(), action);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success(status)));
    }
}
