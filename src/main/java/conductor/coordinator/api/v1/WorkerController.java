package conductor.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import conductor.coordinator.api.Controller;
import conductor.coordinator.api.v1.dto.RegisterWorkerRequest;
import conductor.coordinator.api.v1.dto.WorkerResponse;
import conductor.coordinator.discovery.DiscoveryRefresher;
import conductor.coordinator.model.Worker;
import conductor.coordinator.server.RouterHandler;
import conductor.coordinator.service.OrchestratorService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Controller for the worker registry (public API).
 *
 * GET /api/v1/workers - List workers
 * POST /api/v1/workers - Register a worker by hand
 * DELETE /api/v1/workers - Remove all workers
 * POST /api/v1/workers/refresh - Run worker discovery now
 */
public class WorkerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    private static final String WORKERS_PATH = "/api/v1/workers";
    private static final String REFRESH_PATH = "/api/v1/workers/refresh";

    private final OrchestratorService service;

    public WorkerController(OrchestratorService service) {
        this.service = service;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (WORKERS_PATH.equals(path)) {
            return method.equals(HttpMethod.GET)
                    || method.equals(HttpMethod.POST)
                    || method.equals(HttpMethod.DELETE);
        }
        return method.equals(HttpMethod.POST) && REFRESH_PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (REFRESH_PATH.equals(path)) {
                return handleRefresh();
            }

            HttpMethod method = req.method();
            if (method.equals(HttpMethod.GET)) {
                return handleList();
            }
            if (method.equals(HttpMethod.POST)) {
                return handleRegister(req);
            }
            if (method.equals(HttpMethod.DELETE)) {
                return handleClear();
            }

            return ControllerResponse.notFound("unknown worker endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed request body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Worker controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleList() throws Exception {
        List<WorkerResponse> workers = service.workers().stream()
                .map(WorkerResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(workers));
    }

    private ControllerResponse handleRegister(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        RegisterWorkerRequest request = RouterHandler.mapper().readValue(body, RegisterWorkerRequest.class);

        request.validate();

        Worker worker = request.toWorker();
        if (!service.registerWorker(worker)) {
            return ControllerResponse.badRequest("worker rejected");
        }
        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(Map.of("workerId", worker.id())));
    }

    private ControllerResponse handleClear() throws Exception {
        service.clearWorkers();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("success", true)));
    }

    private ControllerResponse handleRefresh() throws Exception {
        if (!service.discoveryEnabled()) {
            return ControllerResponse.conflict("worker discovery is not configured");
        }
        int registered = service.refreshWorkers();
        if (registered == DiscoveryRefresher.PROVIDER_FAILED) {
            return ControllerResponse.error("worker discovery failed");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("workers", registered)));
    }
}
