package conductor.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import conductor.coordinator.model.RepositoryInfo;

import java.time.Instant;
import java.util.List;

/**
 * Workers of one resource context.
 * GET /api/v1/repositories
 */
public record RepositoryResponse(
        @JsonProperty("name") String name,
        @JsonProperty("path") String path,
        @JsonProperty("idle") int idle,
        @JsonProperty("busy") int busy,
        @JsonProperty("error") int error,
        @JsonProperty("offline") int offline,
        @JsonProperty("workers") List<WorkerResponse> workers,
        @JsonProperty("lastUpdate") Instant lastUpdate) {
    public static RepositoryResponse from(RepositoryInfo info) {
        return new RepositoryResponse(
                info.name(),
                info.path(),
                info.idleCount(),
                info.busyCount(),
                info.errorCount(),
                info.offlineCount(),
                info.workers().stream().map(WorkerResponse::from).toList(),
                info.lastUpdate());
    }
}
