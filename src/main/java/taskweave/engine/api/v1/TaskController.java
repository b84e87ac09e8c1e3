package taskweave.engine.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import taskweave.engine.api.Controller;
import taskweave.engine.api.v1.dto.OperationResponse;
import taskweave.engine.api.v1.dto.TaskResponse;
import taskweave.engine.model.Task;
import taskweave.engine.model.TaskStatus;
import taskweave.engine.server.RouterHandler;
import taskweave.engine.workflow.WorkflowOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task queries (public API).
 *
 * GET /api/v1/queue/stats - Counts per status
 * GET /api/v1/tasks?status=...|tag=... - List tasks, optionally filtered
 * GET /api/v1/tasks/{taskId} - One task
 * POST /api/v1/tasks/{taskId}/cancel - Cancel one task
 *
 * Exceptions bubble to RouterHandler for proper error responses.
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern STATS_PATTERN = Pattern.compile("^/api/v1/queue/stats$");
    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");
    private static final Pattern CANCEL_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/cancel$");

    private final WorkflowOrchestrator orchestrator;

    public TaskController(WorkflowOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return STATS_PATTERN.matcher(path).matches()
                    || TASKS_PATTERN.matcher(path).matches()
                    || TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (STATS_PATTERN.matcher(path).matches()) {
                return ControllerResponse.json(RouterHandler.mapper()
                        .writeValueAsString(orchestrator.getQueueStats()));
            }

            if (TASKS_PATTERN.matcher(path).matches()) {
                return handleList(req);
            }

            Matcher cancelMatcher = CANCEL_PATTERN.matcher(path);
            if (cancelMatcher.matches()) {
                return handleCancel(cancelMatcher.group(1));
            }

            Matcher byIdMatcher = TASK_BY_ID_PATTERN.matcher(path);
            if (byIdMatcher.matches()) {
                String taskId = byIdMatcher.group(1);
                Optional<Task> task = orchestrator.getTask(taskId);
                if (task.isEmpty()) {
                    return ControllerResponse.notFound("task not found: " + taskId);
                }
                return ControllerResponse.json(RouterHandler.mapper()
                        .writeValueAsString(TaskResponse.from(task.get())));
            }

            return ControllerResponse.notFound("unknown task endpoint");
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize task response", e);
        }
    }

    /**
     * GET /api/v1/tasks - filters combine with AND
     */
    private ControllerResponse handleList(FullHttpRequest req) throws JsonProcessingException {
        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
        String status = first(params, "status");
        String tag = first(params, "tag");

        List<Task> tasks;
        if (status != null) {
            TaskStatus parsed = TaskStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
            tasks = orchestrator.findByStatus(parsed);
        } else if (tag != null) {
            tasks = orchestrator.findByTag(tag);
        } else {
            tasks = orchestrator.queue().tasks();
        }
        if (status != null && tag != null) {
            tasks = tasks.stream().filter(t -> t.hasTag(tag)).toList();
        }

        List<TaskResponse> body = tasks.stream().map(TaskResponse::from).toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("tasks", body)));
    }

    /**
     * POST /api/v1/tasks/{taskId}/cancel
     */
    private ControllerResponse handleCancel(String taskId) throws JsonProcessingException {
        Optional<Task> task = orchestrator.getTask(taskId);
        if (task.isEmpty()) {
            return ControllerResponse.notFound("task not found: " + taskId);
        }
        if (!orchestrator.cancelTask(taskId)) {
            TaskStatus current = orchestrator.getTaskStatus(taskId).orElse(task.get().status());
            return ControllerResponse.conflict("task already " + current);
        }
        log.info("Task {} cancelled via API", taskId);
        String status = orchestrator.getTaskStatus(taskId).map(Enum::name).orElse(null);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success(status)));
    }

    private static String first(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        return values == null || values.isEmpty() || values.get(0).isBlank() ? null : values.get(0);
    }
}
