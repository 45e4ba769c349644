package conductor.coordinator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import conductor.coordinator.api.Controller;
import conductor.coordinator.api.internal.v1.dto.OperationResponse;
import conductor.coordinator.api.internal.v1.dto.TaskStatusRequest;
import conductor.coordinator.model.Task;
import conductor.coordinator.model.TaskStatus;
import conductor.coordinator.server.RouterHandler;
import conductor.coordinator.service.OrchestratorService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task progress reports (internal API).
 * POST /internal/v1/tasks/{taskId}/status - Move a task forward (IN_PROGRESS, COMPLETED, FAILED)
 */
public class TaskReportController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskReportController.class);

    private static final Pattern STATUS_PATTERN = Pattern.compile("^/internal/v1/tasks/([^/]+)/status$");

    private final OrchestratorService service;

    public TaskReportController(OrchestratorService service) {
        this.service = service;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && STATUS_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher matcher = STATUS_PATTERN.matcher(path);
            if (!matcher.matches()) {
                return ControllerResponse.notFound("unknown task endpoint");
            }
            return handleStatus(req, matcher.group(1));

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed request body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Task report controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleStatus(FullHttpRequest req, String taskId) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        TaskStatusRequest request = RouterHandler.mapper().readValue(body, TaskStatusRequest.class);

        request.validate();

        Optional<Task> task = service.findTask(taskId);
        if (task.isEmpty()) {
            return ControllerResponse.notFound("task not found");
        }

        TaskStatus target = request.statusValue();
        if (!service.updateTaskStatus(taskId, target, request.result())) {
            return ControllerResponse.conflict(
                    "transition " + task.get().status() + " -> " + target + " not allowed");
        }
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(OperationResponse.success(target.name())));
    }
}
