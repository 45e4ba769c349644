package conductor.coordinator.api.v1;

import conductor.coordinator.api.Controller;
import conductor.coordinator.api.v1.dto.HealthResponse;
import conductor.coordinator.model.RegistrySnapshot;
import conductor.coordinator.model.TaskStatus;
import conductor.coordinator.server.RouterHandler;
import conductor.coordinator.service.OrchestratorService;
import conductor.coordinator.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
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

    private final OrchestratorService service;
    private final Database database;

    /**
     * @param database checked for connectivity; null when state is not kept in a database
     */
    public HealthController(OrchestratorService service, Database database) {
        this.service = service;
        this.database = database;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (database != null && !database.isHealthy()) {
                HealthResponse response = HealthResponse.unhealthy("connection failed");
                return ControllerResponse.json(
                        HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            }

            RegistrySnapshot snapshot = service.getSnapshot();
            int pending = (int) snapshot.countTasks(TaskStatus.PENDING);
            int active = (int) (snapshot.countTasks(TaskStatus.ASSIGNED)
                    + snapshot.countTasks(TaskStatus.IN_PROGRESS));

            HealthResponse response = HealthResponse.healthy(
                    database != null ? "ok" : "none",
                    formatUptime(),
                    VERSION,
                    snapshot.workers().size(),
                    snapshot.idleWorkers().size(),
                    pending,
                    active);

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
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
