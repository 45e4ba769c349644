package conductor.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import conductor.coordinator.model.Worker;
import conductor.coordinator.model.WorkerStatus;

/**
 * Request DTO for registering a worker by hand.
 * POST /api/v1/workers
 */
public record RegisterWorkerRequest(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("kind") String kind,
        @JsonProperty("resourceContext") String resourceContext) {

    public void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
    }

    /** New IDLE worker; name falls back to the id */
    public Worker toWorker() {
        return Worker.builder()
                .id(id.trim())
                .name(name != null && !name.isBlank() ? name : id.trim())
                .kind(kind != null && !kind.isBlank() ? kind : "manual")
                .resourceContext(resourceContext != null ? resourceContext : "")
                .status(WorkerStatus.IDLE)
                .build();
    }
}
