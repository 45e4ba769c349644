package conductor.coordinator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import conductor.coordinator.api.Controller;
import conductor.coordinator.api.internal.v1.dto.OperationResponse;
import conductor.coordinator.api.internal.v1.dto.WorkerStatusRequest;
import conductor.coordinator.api.v1.dto.TaskResponse;
import conductor.coordinator.model.Task;
import conductor.coordinator.model.WorkerStatus;
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
 * Controller for worker-facing operations (internal API).
 * POST /internal/v1/workers/{workerId}/status - Report worker status
 * GET /internal/v1/workers/{workerId}/next-task - Fetch the next assigned task (204 if none)
 */
public class WorkerReportController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkerReportController.class);

    private static final Pattern STATUS_PATTERN = Pattern.compile("^/internal/v1/workers/([^/]+)/status$");
    private static final Pattern NEXT_TASK_PATTERN = Pattern.compile("^/internal/v1/workers/([^/]+)/next-task$");

    private final OrchestratorService service;

    public WorkerReportController(OrchestratorService service) {
        this.service = service;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return STATUS_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return NEXT_TASK_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher statusMatcher = STATUS_PATTERN.matcher(path);
            if (statusMatcher.matches()) {
                return handleStatus(req, statusMatcher.group(1));
            }

            Matcher nextMatcher = NEXT_TASK_PATTERN.matcher(path);
            if (nextMatcher.matches()) {
                return handleNextTask(nextMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown worker endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed request body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Worker report controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /internal/v1/workers/{workerId}/status
     */
    private ControllerResponse handleStatus(FullHttpRequest req, String workerId) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        WorkerStatusRequest request = RouterHandler.mapper().readValue(body, WorkerStatusRequest.class);

        request.validate();

        WorkerStatus status = request.statusValue();
        if (!service.updateWorkerStatus(workerId, status, request.currentTask())) {
            return ControllerResponse.notFound("worker not found");
        }
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(OperationResponse.success(status.name())));
    }

    /**
     * GET /internal/v1/workers/{workerId}/next-task
     */
    private ControllerResponse handleNextTask(String workerId) throws Exception {
        if (service.findWorker(workerId).isEmpty()) {
            return ControllerResponse.notFound("worker not found");
        }
        Optional<Task> next = service.nextTaskForWorker(workerId);
        if (next.isEmpty()) {
            return ControllerResponse.noContent();
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(next.get())));
    }
}
