package conductor.coordinator.api.v1;

import conductor.coordinator.api.Controller;
import conductor.coordinator.api.v1.dto.RepositoryResponse;
import conductor.coordinator.server.RouterHandler;
import conductor.coordinator.service.OrchestratorService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Workers grouped per resource context.
 * GET /api/v1/repositories
 */
public class RepositoryController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(RepositoryController.class);

    private final OrchestratorService service;

    public RepositoryController(OrchestratorService service) {
        this.service = service;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/repositories".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            List<RepositoryResponse> repositories = service.repositories().stream()
                    .map(RepositoryResponse::from)
                    .toList();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(repositories));
        } catch (Exception e) {
            log.error("Repository controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
