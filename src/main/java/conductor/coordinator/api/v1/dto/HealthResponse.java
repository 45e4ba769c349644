package conductor.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("workers") Integer workers,
        @JsonProperty("idleWorkers") Integer idleWorkers,
        @JsonProperty("pendingTasks") Integer pendingTasks,
        @JsonProperty("activeTasks") Integer activeTasks) {
    public static HealthResponse healthy(String database, String uptime, String version, int workers,
            int idleWorkers, int pendingTasks, int activeTasks) {
        return new HealthResponse("healthy", database, uptime, version, workers, idleWorkers, pendingTasks,
                activeTasks);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
