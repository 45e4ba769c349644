package conductor.coordinator.api.v1;

import conductor.coordinator.api.Controller;
import conductor.coordinator.api.v1.dto.StateResponse;
import conductor.coordinator.server.RouterHandler;
import conductor.coordinator.service.OrchestratorService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only view of workers and the task queue.
 * GET /api/v1/state
 */
public class StateController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(StateController.class);

    private final OrchestratorService service;

    public StateController(OrchestratorService service) {
        this.service = service;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/state".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            StateResponse response = StateResponse.from(service.getSnapshot());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (Exception e) {
            log.error("State controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
