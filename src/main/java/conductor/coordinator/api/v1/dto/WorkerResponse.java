package conductor.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import conductor.coordinator.model.Worker;

import java.time.Instant;

/**
 * Response DTO for a worker.
 * GET /api/v1/workers
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerResponse(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("name") String name,
        @JsonProperty("kind") String kind,
        @JsonProperty("resourceContext") String resourceContext,
        @JsonProperty("status") String status,
        @JsonProperty("lastActivity") Instant lastActivity,
        @JsonProperty("currentTask") String currentTask,
        @JsonProperty("sessionRef") String sessionRef) {
    public static WorkerResponse from(Worker worker) {
        return new WorkerResponse(
                worker.id(),
                worker.name(),
                worker.kind(),
                worker.resourceContext(),
                worker.status().name(),
                worker.lastActivity(),
                worker.currentTaskRef(),
                worker.sessionRef());
    }
}
