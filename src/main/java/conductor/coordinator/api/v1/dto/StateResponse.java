package conductor.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import conductor.coordinator.model.RegistrySnapshot;
import conductor.coordinator.model.TaskStatus;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for the full orchestrator state.
 * GET /api/v1/state
 */
public record StateResponse(
        @JsonProperty("workers") List<WorkerResponse> workers,
        @JsonProperty("tasks") List<TaskResponse> tasks,
        @JsonProperty("pendingTasks") long pendingTasks,
        @JsonProperty("takenAt") Instant takenAt) {
    public static StateResponse from(RegistrySnapshot snapshot) {
        return new StateResponse(
                snapshot.workers().stream().map(WorkerResponse::from).toList(),
                snapshot.tasks().stream().map(TaskResponse::from).toList(),
                snapshot.countTasks(TaskStatus.PENDING),
                snapshot.takenAt());
    }
}
