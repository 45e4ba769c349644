package conductor.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import conductor.coordinator.api.Controller;
import conductor.coordinator.api.v1.dto.EnqueueTaskRequest;
import conductor.coordinator.api.v1.dto.TaskResponse;
import conductor.coordinator.model.Task;
import conductor.coordinator.server.RouterHandler;
import conductor.coordinator.service.OrchestratorService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the task queue (public API).
 *
 * POST /api/v1/tasks - Queue a task
 * GET /api/v1/tasks/{taskId} - Get a task
 * POST /api/v1/tasks/assign - Run an assignment sweep now
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern ASSIGN_PATTERN = Pattern.compile("^/api/v1/tasks/assign$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    private final OrchestratorService service;

    public TaskController(OrchestratorService service) {
        this.service = service;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches() || ASSIGN_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST) && TASKS_PATTERN.matcher(path).matches()) {
                return handleEnqueue(req);
            }

            if (req.method().equals(HttpMethod.POST) && ASSIGN_PATTERN.matcher(path).matches()) {
                return handleAssign();
            }

            Matcher taskMatcher = TASK_BY_ID_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && taskMatcher.matches()) {
                return handleGetTask(taskMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed request body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/tasks - Queue a task
     */
    private ControllerResponse handleEnqueue(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        EnqueueTaskRequest request = RouterHandler.mapper().readValue(body, EnqueueTaskRequest.class);

        request.validate();

        String taskId = service.enqueue(request.command(), request.resourceContext(), request.priorityValue());
        String status = service.findTask(taskId).map(t -> t.status().name()).orElse("PENDING");

        Map<String, Object> response = Map.of(
                "taskId", taskId,
                "status", status);

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /api/v1/tasks/assign - Run an assignment sweep now
     */
    private ControllerResponse handleAssign() throws Exception {
        int assigned = service.triggerAssignment();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("assigned", assigned)));
    }

    /**
     * GET /api/v1/tasks/{taskId} - Get a task
     */
    private ControllerResponse handleGetTask(String taskId) throws Exception {
        Optional<Task> task = service.findTask(taskId);
        if (task.isEmpty()) {
            return ControllerResponse.notFound("task not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task.get())));
    }
}
